package work.tikzgraph.props.model;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of value types a property declaration may carry.
 */
public enum DataType {
    STRING("string"),
    FLOAT("float"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    /** String-valued toggle or command, placed under {@code __flags} in the hierarchy. */
    FLAG("flag");

    private final String token;

    DataType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * Type used when coercing raw values. Flags coerce like strings.
     */
    public DataType coercionType() {
        return this == FLAG ? STRING : this;
    }

    public static Optional<DataType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (DataType type : values()) {
            if (type.token.equals(token)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static DataType from(String value) {
        return fromToken(value == null ? null : value.trim().toLowerCase(Locale.ROOT))
            .orElseThrow(() -> new IllegalArgumentException("Unsupported data type: " + value));
    }

    /**
     * Type assumed for an untyped value: whole numbers are integers, other numbers floats.
     */
    public static DataType infer(Object value) {
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long
            || value instanceof BigInteger) {
            return INTEGER;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d) ? INTEGER : FLOAT;
        }
        return STRING;
    }

    @Override
    public String toString() {
        return token;
    }
}
