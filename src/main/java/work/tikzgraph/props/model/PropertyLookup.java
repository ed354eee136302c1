package work.tikzgraph.props.model;

import java.util.List;

/**
 * Lookups over resolved descriptor sequences.
 */
public final class PropertyLookup {
    private PropertyLookup() {}

    /**
     * First descriptor whose name path equals {@code namePath}, otherwise {@code defaultDescriptor}
     * (which may be {@code null}).
     */
    public static PropertyDescriptor findOrDefault(
        List<PropertyDescriptor> descriptors,
        String namePath,
        PropertyDescriptor defaultDescriptor
    ) {
        if (descriptors == null || descriptors.isEmpty() || namePath == null || namePath.isEmpty()) {
            return defaultDescriptor;
        }
        for (PropertyDescriptor descriptor : descriptors) {
            if (descriptor.namePath().equals(namePath)) {
                return descriptor;
            }
        }
        return defaultDescriptor;
    }
}
