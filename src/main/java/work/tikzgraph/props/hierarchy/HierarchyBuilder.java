package work.tikzgraph.props.hierarchy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import work.tikzgraph.props.model.PathSegment;
import work.tikzgraph.props.model.PropertyDescriptor;

/**
 * Projects a resolved descriptor sequence into a nested attribute tree.
 *
 * <p>Name segments address {@link LinkedHashMap} containers, index segments address
 * {@link SparseList} containers. Flag descriptors land in a {@value #FLAGS_KEY} map next to the
 * ordinary attributes of the same level. Descriptors without a value create their containers
 * but write no leaf.
 */
public final class HierarchyBuilder {
    public static final String FLAGS_KEY = PropertyDescriptor.FLAGS_KEY;

    private final HierarchyMode mode;
    private final Consumer<HierarchyConflict> conflictListener;

    public HierarchyBuilder(HierarchyMode mode) {
        this(mode, conflict -> {});
    }

    public HierarchyBuilder(HierarchyMode mode, Consumer<HierarchyConflict> conflictListener) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.conflictListener = Objects.requireNonNull(conflictListener, "conflictListener");
    }

    /**
     * Lenient build: conflicting assignments are dropped silently.
     */
    public static Map<String, Object> buildHierarchy(List<PropertyDescriptor> resolved) {
        return new HierarchyBuilder(HierarchyMode.LENIENT).build(resolved);
    }

    public Map<String, Object> build(List<PropertyDescriptor> resolved) {
        var root = new LinkedHashMap<String, Object>();
        if (resolved == null) {
            return root;
        }
        for (PropertyDescriptor descriptor : resolved) {
            place(root, descriptor);
        }
        return root;
    }

    private void place(Map<String, Object> root, PropertyDescriptor descriptor) {
        var segments = new ArrayList<PathSegment>(descriptor.groupSegments());
        segments.addAll(descriptor.nameSegments());
        if (segments.isEmpty()) {
            return;
        }
        Object container = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            PathSegment segment = segments.get(i);
            boolean wantsSequence = segments.get(i + 1).isIndex();
            Object child = read(container, segment);
            if (child == null && !holds(container, segment)) {
                child = wantsSequence ? new SparseList() : new LinkedHashMap<String, Object>();
                write(container, segment, child);
            } else if (wantsSequence ? !(child instanceof SparseList) : !(child instanceof Map)) {
                conflict(descriptor, segments, i, wantsSequence
                    ? "expected a sequence but found " + describe(child)
                    : "expected an object but found " + describe(child));
                return;
            }
            container = child;
        }

        PathSegment last = segments.get(segments.size() - 1);
        if (descriptor.isFlag()) {
            placeFlag(container, descriptor, segments, last);
            return;
        }
        Object existing = read(container, last);
        if (existing instanceof Map || existing instanceof SparseList) {
            conflict(descriptor, segments, segments.size() - 1, "would replace " + describe(existing) + " with a value");
            return;
        }
        if (descriptor.hasValue()) {
            write(container, last, descriptor.value());
        }
    }

    @SuppressWarnings("unchecked")
    private void placeFlag(Object container, PropertyDescriptor descriptor, List<PathSegment> segments, PathSegment last) {
        if (!(container instanceof Map)) {
            conflict(descriptor, segments, segments.size() - 2, "flags need an object container");
            return;
        }
        var object = (Map<String, Object>) container;
        Object flags = object.get(FLAGS_KEY);
        if (flags == null) {
            flags = new LinkedHashMap<String, Object>();
            object.put(FLAGS_KEY, flags);
        } else if (!(flags instanceof Map)) {
            conflict(descriptor, segments, segments.size() - 1, FLAGS_KEY + " holds " + describe(flags));
            return;
        }
        if (descriptor.hasValue()) {
            ((Map<String, Object>) flags).put(last.text(), descriptor.value());
        }
    }

    private void conflict(PropertyDescriptor descriptor, List<PathSegment> segments, int position, String reason) {
        var path = new StringBuilder();
        for (int i = 0; i <= Math.max(position, 0); i++) {
            if (i > 0) {
                path.append('.');
            }
            path.append(segments.get(i).text());
        }
        var conflict = new HierarchyConflict(descriptor, path.toString(), reason);
        if (mode == HierarchyMode.STRICT) {
            throw new HierarchyConflictException(conflict);
        }
        conflictListener.accept(conflict);
    }

    @SuppressWarnings("unchecked")
    private static Object read(Object container, PathSegment segment) {
        if (container instanceof SparseList list) {
            int index = (Integer) segment.key();
            return index < list.size() ? list.get(index) : null;
        }
        return ((Map<String, Object>) container).get(segment.text());
    }

    @SuppressWarnings("unchecked")
    private static boolean holds(Object container, PathSegment segment) {
        if (container instanceof SparseList list) {
            return list.has((Integer) segment.key());
        }
        return ((Map<String, Object>) container).containsKey(segment.text());
    }

    @SuppressWarnings("unchecked")
    private static void write(Object container, PathSegment segment, Object value) {
        if (container instanceof SparseList list) {
            list.put((Integer) segment.key(), value);
        } else {
            ((Map<String, Object>) container).put(segment.text(), value);
        }
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "an object";
        }
        if (value instanceof SparseList) {
            return "a sequence";
        }
        return "the value " + value;
    }
}
