package work.tikzgraph.props.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One dot-separated segment of a group or name path.
 */
public record PathSegment(String text, Kind kind) {
    public enum Kind {
        NAME,
        INDEX
    }

    public PathSegment {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(kind, "kind");
    }

    public static PathSegment of(String text) {
        return new PathSegment(text, isIndex(text) ? Kind.INDEX : Kind.NAME);
    }

    /**
     * Splits a dotted path; an empty or null path yields no segments.
     */
    public static List<PathSegment> split(String path) {
        if (path == null || path.isEmpty()) {
            return List.of();
        }
        var segments = new ArrayList<PathSegment>();
        for (String part : path.split("\\.", -1)) {
            segments.add(of(part));
        }
        return List.copyOf(segments);
    }

    public boolean isIndex() {
        return kind == Kind.INDEX;
    }

    /**
     * Key addressing this segment in a hierarchy: an {@link Integer} for indices, the text otherwise.
     */
    public Object key() {
        return isIndex() ? Integer.valueOf(text) : text;
    }

    private static boolean isIndex(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return text;
    }
}
