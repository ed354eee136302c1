package work.tikzgraph.props.hierarchy;

import java.util.Locale;

/**
 * How the hierarchy builder reacts to a descriptor whose path collides with an existing shape.
 */
public enum HierarchyMode {
    /** Skip the conflicting assignment and keep going. */
    LENIENT,
    /** Fail with {@link HierarchyConflictException}. */
    STRICT;

    public static HierarchyMode from(String value) {
        if (value == null || value.isBlank()) {
            return LENIENT;
        }
        try {
            return HierarchyMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported hierarchy mode: " + value);
        }
    }
}
