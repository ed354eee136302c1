package work.tikzgraph.props.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import work.tikzgraph.props.model.DataType;
import work.tikzgraph.props.model.Undefined;

/**
 * Type-directed conversion of raw declaration values.
 *
 * <p>Coercion never throws. Invalid numeric input yields {@link Double#NaN}, invalid boolean
 * input yields {@code false}. Whole numbers come back as {@link Long}, reals as {@link Double}.
 * Whole numbers outside the {@code long} range stay reals rather than wrapping.
 * {@code null} and {@link Undefined#INSTANCE} pass through untouched.
 */
public final class ValueCoercion {
    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "y");
    private static final Pattern FLOAT_PREFIX = Pattern.compile("^[+-]?(?:Infinity|(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");
    private static final Pattern INTEGER_PREFIX = Pattern.compile("^[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("^[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?$");
    private static final double LONG_RANGE = 0x1p63;
    private static final Pattern RADIX = Pattern.compile("^0([xXoObB])([0-9a-fA-F]+)$");

    private ValueCoercion() {}

    public static Object coerce(Object raw, DataType type) {
        if (raw == null || Undefined.is(raw)) {
            return raw;
        }
        return switch (type.coercionType()) {
            case STRING -> stringify(raw);
            case FLOAT -> toFloat(raw);
            case INTEGER -> toInteger(raw);
            case NUMBER -> toNumber(raw);
            case BOOLEAN -> toBoolean(raw);
            default -> raw;
        };
    }

    /**
     * String form of a value; whole doubles lose their trailing {@code .0}.
     */
    public static String stringify(Object raw) {
        if (raw instanceof String str) {
            return str;
        }
        if (raw instanceof Double || raw instanceof Float) {
            return formatReal(((Number) raw).doubleValue());
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (raw instanceof Collection<?> items) {
            var joined = new StringBuilder();
            int position = 0;
            for (Object item : items) {
                if (position++ > 0) {
                    joined.append(',');
                }
                joined.append(item == null ? "" : stringify(item));
            }
            return joined.toString();
        }
        if (raw instanceof Map<?, ?>) {
            return "[object Object]";
        }
        return String.valueOf(raw);
    }

    private static Object toFloat(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (!(raw instanceof CharSequence)) {
            return Double.NaN;
        }
        var matcher = FLOAT_PREFIX.matcher(raw.toString().stripLeading());
        if (!matcher.find()) {
            return Double.NaN;
        }
        return parseReal(matcher.group());
    }

    private static Object toInteger(Object raw) {
        if (raw instanceof BigInteger big) {
            return wholeOrReal(big);
        }
        if (isWholeType(raw)) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return d;
            }
            // beyond the long range the rounded real is kept
            if (Math.abs(d) >= LONG_RANGE) {
                return Math.rint(d);
            }
            return Math.round(d);
        }
        if (!(raw instanceof CharSequence)) {
            return Double.NaN;
        }
        var matcher = INTEGER_PREFIX.matcher(raw.toString().stripLeading());
        if (!matcher.find()) {
            return Double.NaN;
        }
        return parseWhole(matcher.group());
    }

    private static Object toNumber(Object raw) {
        if (raw instanceof Boolean bool) {
            return bool ? 1L : 0L;
        }
        if (raw instanceof BigInteger big) {
            return wholeOrReal(big);
        }
        if (isWholeType(raw)) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (!(raw instanceof CharSequence)) {
            return Double.NaN;
        }
        String text = raw.toString().strip();
        if (text.isEmpty()) {
            return 0L;
        }
        if (text.equals("Infinity") || text.equals("+Infinity")) {
            return Double.POSITIVE_INFINITY;
        }
        if (text.equals("-Infinity")) {
            return Double.NEGATIVE_INFINITY;
        }
        var radix = RADIX.matcher(text);
        if (radix.matches()) {
            return parseRadix(radix.group(1), radix.group(2));
        }
        if (!DECIMAL.matcher(text).matches()) {
            return Double.NaN;
        }
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            return parseWhole(text);
        }
        return parseReal(text);
    }

    private static Object toBoolean(Object raw) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        if (raw instanceof CharSequence text) {
            return TRUE_WORDS.contains(text.toString().toLowerCase(Locale.ROOT));
        }
        if (raw instanceof Number number) {
            double d = number.doubleValue();
            return !(d == 0 || Double.isNaN(d));
        }
        return Boolean.TRUE;
    }

    private static boolean isWholeType(Object raw) {
        return raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte;
    }

    private static Object wholeOrReal(BigInteger big) {
        return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
    }

    private static Object parseWhole(String digits) {
        try {
            return Long.parseLong(digits.startsWith("+") ? digits.substring(1) : digits);
        } catch (NumberFormatException ex) {
            return parseReal(digits);
        }
    }

    private static Object parseReal(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            return Double.NaN;
        }
    }

    private static Object parseRadix(String marker, String digits) {
        int radix = switch (Character.toLowerCase(marker.charAt(0))) {
            case 'x' -> 16;
            case 'o' -> 8;
            default -> 2;
        };
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException ex) {
            return Double.NaN;
        }
    }

    private static String formatReal(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e21) {
            return BigDecimal.valueOf(d).toBigInteger().toString();
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
