package work.tikzgraph.props.style;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalizes style references ({@code "bold, red"}, {@code "bold|red"}, lists) into a stack
 * that always starts with {@value #BASE}.
 */
public final class StyleNames {
    public static final String BASE = "base";
    /** Rejection code for a style name that can never be referenced from a stack. */
    public static final String INVALID_NAME = "invalid_style_name";

    private static final Pattern DELIMITERS = Pattern.compile("[,|&]+");
    private static final Pattern VALID_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9 ]*$");

    private StyleNames() {}

    public static List<String> splitByDelimiters(String input) {
        if (input == null || input.isBlank()) {
            return List.of();
        }
        var parts = new ArrayList<String>();
        for (String part : DELIMITERS.split(input)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    public static boolean isValid(String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }

    /**
     * Names in {@code names} that {@link #normalize(String)} would drop, in input order.
     */
    public static List<String> invalidNames(String names) {
        var invalid = new ArrayList<String>();
        for (String name : splitByDelimiters(names)) {
            if (!isValid(name)) {
                invalid.add(name);
            }
        }
        return invalid;
    }

    public static List<String> normalize(String names) {
        return normalize(names == null ? List.of() : List.of(names));
    }

    /**
     * Invalid names are dropped; {@code base} is prepended unless it already leads the stack.
     */
    public static List<String> normalize(List<String> names) {
        var clean = new ArrayList<String>();
        if (names != null) {
            for (String item : names) {
                for (String name : splitByDelimiters(item)) {
                    if (isValid(name)) {
                        clean.add(name);
                    }
                }
            }
        }
        if (clean.isEmpty()) {
            return List.of(BASE);
        }
        if (!clean.get(0).equals(BASE)) {
            clean.add(0, BASE);
        }
        return List.copyOf(clean);
    }
}
