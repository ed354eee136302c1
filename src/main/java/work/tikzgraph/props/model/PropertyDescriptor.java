package work.tikzgraph.props.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import work.tikzgraph.props.core.ValueCoercion;

/**
 * Parsed, typed representation of one property declaration.
 *
 * <p>Instances are immutable. They are created by the declaration parser or through
 * {@link #builder()} for ad-hoc overrides, and are only read by the merge engine and
 * the hierarchy builder.
 */
public final class PropertyDescriptor {
    public static final String DEFAULT_RENDERER = "common";
    public static final String CLEAR_TAG = "!clear";
    /** Key holding flag properties in a hierarchy level; no path segment may use it. */
    public static final String FLAGS_KEY = "__flags";

    private static final Pattern NAME_SEGMENT = Pattern.compile("^[_a-zA-Z][a-zA-Z\\d\\s_\\-]*$");
    private static final int MAX_INDEX_DIGITS = 6;

    private final String renderer;
    private final String group;
    private final List<PathSegment> groupSegments;
    private final String namePath;
    private final List<PathSegment> nameSegments;
    private final DataType dataType;
    private final Object value;
    private final boolean clearChildren;
    private final List<String> tags;

    private PropertyDescriptor(Builder builder, List<PathSegment> groupSegments, List<PathSegment> nameSegments, Object value) {
        this.renderer = builder.renderer;
        this.group = builder.group;
        this.groupSegments = groupSegments;
        this.namePath = builder.namePath;
        this.nameSegments = nameSegments;
        this.dataType = builder.dataType;
        this.value = value;
        var tagSet = new LinkedHashSet<>(builder.tags);
        if (builder.clearChildren) {
            tagSet.add(CLEAR_TAG);
        }
        this.tags = List.copyOf(tagSet);
        this.clearChildren = tagSet.contains(CLEAR_TAG);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String renderer() {
        return renderer;
    }

    /** Secondary path, empty when the declaration has none. */
    public String group() {
        return group;
    }

    public List<PathSegment> groupSegments() {
        return groupSegments;
    }

    public String namePath() {
        return namePath;
    }

    public List<PathSegment> nameSegments() {
        return nameSegments;
    }

    public List<String> namePathArray() {
        return nameSegments.stream().map(PathSegment::text).collect(Collectors.toUnmodifiableList());
    }

    public List<PathSegment.Kind> namePathTypes() {
        return nameSegments.stream().map(PathSegment::kind).collect(Collectors.toUnmodifiableList());
    }

    public DataType dataType() {
        return dataType;
    }

    public boolean isFlag() {
        return dataType == DataType.FLAG;
    }

    /**
     * Coerced value; {@code null} when explicitly absent, {@link Undefined#INSTANCE} when never declared.
     */
    public Object value() {
        return value;
    }

    public boolean hasValue() {
        return !Undefined.is(value);
    }

    public boolean clearChildren() {
        return clearChildren;
    }

    public List<String> tags() {
        return tags;
    }

    /**
     * Name path keys with index segments as {@link Integer} and name segments as strings.
     */
    public List<Object> pathWithIndices() {
        return keys(nameSegments);
    }

    public List<Object> groupWithIndices() {
        return keys(groupSegments);
    }

    public boolean isNamePathIndex(int position) {
        return position >= 0 && position < nameSegments.size() && nameSegments.get(position).isIndex();
    }

    /**
     * Copy of this descriptor holding {@code rawValue} coerced to this descriptor's type.
     */
    public PropertyDescriptor withValue(Object rawValue) {
        return toBuilder().value(rawValue).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .renderer(renderer)
            .group(group)
            .namePath(namePath)
            .dataType(dataType)
            .tags(tags)
            .clearChildren(clearChildren)
            .value(value);
    }

    /**
     * Canonical declaration text ({@code _renderer:group:type:name[:tags]}) for this descriptor.
     */
    public String toDeclaration() {
        var text = new StringBuilder()
            .append('_').append(renderer)
            .append(':').append(group)
            .append(':').append(dataType.token())
            .append(':').append(namePath);
        if (!tags.isEmpty()) {
            text.append(':').append(String.join(" ", tags));
        }
        return text.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PropertyDescriptor that)) {
            return false;
        }
        return clearChildren == that.clearChildren
            && renderer.equals(that.renderer)
            && group.equals(that.group)
            && namePath.equals(that.namePath)
            && dataType == that.dataType
            && Objects.equals(value, that.value)
            && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(renderer, group, namePath, dataType, value, clearChildren, tags);
    }

    @Override
    public String toString() {
        return toDeclaration() + "=" + value;
    }

    private static List<Object> keys(List<PathSegment> segments) {
        var keys = new ArrayList<Object>(segments.size());
        for (PathSegment segment : segments) {
            keys.add(segment.key());
        }
        return keys;
    }

    public static final class Builder {
        private String renderer = DEFAULT_RENDERER;
        private String group = "";
        private String namePath;
        private DataType dataType;
        private Object value = Undefined.INSTANCE;
        private boolean clearChildren;
        private List<String> tags = List.of();

        private Builder() {}

        public Builder renderer(String renderer) {
            this.renderer = renderer == null || renderer.isEmpty() ? DEFAULT_RENDERER : renderer;
            return this;
        }

        public Builder group(String group) {
            this.group = group == null ? "" : group;
            return this;
        }

        public Builder namePath(String namePath) {
            this.namePath = namePath;
            return this;
        }

        /** Leave unset to infer the type from the value. */
        public Builder dataType(DataType dataType) {
            this.dataType = dataType;
            return this;
        }

        /** Raw value; coerced to the data type on {@link #build()}. */
        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder clearChildren(boolean clearChildren) {
            this.clearChildren = clearChildren;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags == null ? List.of() : List.copyOf(tags);
            return this;
        }

        public PropertyDescriptor build() {
            var errors = new ArrayList<String>();
            if (namePath == null || namePath.isEmpty()) {
                errors.add("namePath is required and cannot be empty");
            } else {
                validatePath("namePath", namePath, errors);
            }
            if (!group.isEmpty()) {
                validatePath("group", group, errors);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid property " + namePath + ": " + String.join("; ", errors));
            }
            if (dataType == null) {
                dataType = DataType.infer(value);
            }
            Object coerced = ValueCoercion.coerce(value, dataType);
            return new PropertyDescriptor(this, PathSegment.split(group), PathSegment.split(namePath), coerced);
        }

        private static void validatePath(String label, String path, List<String> errors) {
            if (path.startsWith(".") || path.endsWith(".")) {
                errors.add(label + " cannot start or end with a dot");
            }
            String[] segments = path.split("\\.", -1);
            for (int i = 0; i < segments.length; i++) {
                String segment = segments[i];
                PathSegment parsed = PathSegment.of(segment);
                if (segment.isEmpty()) {
                    errors.add(label + " segment at position " + i + " cannot be empty");
                } else if (!segment.equals(segment.strip())) {
                    errors.add(label + " segment \"" + segment + "\" cannot have leading or trailing spaces");
                } else if (parsed.isIndex()) {
                    if (segment.length() > MAX_INDEX_DIGITS) {
                        errors.add(label + " index \"" + segment + "\" is out of range (at most "
                            + MAX_INDEX_DIGITS + " digits)");
                    }
                } else if (segment.equals(FLAGS_KEY)) {
                    errors.add(label + " segment \"" + FLAGS_KEY + "\" is reserved for flag properties");
                } else if (!NAME_SEGMENT.matcher(segment).matches()) {
                    errors.add("Invalid " + label + " segment \"" + segment + "\" at position " + i);
                }
            }
        }
    }
}
