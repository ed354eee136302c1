package work.tikzgraph.props.core;

import java.util.List;
import work.tikzgraph.props.model.PropertyDescriptor;

/**
 * Descriptors read from one application unit, in declaration order, plus the keys that were skipped.
 */
public record DeclarationBatch(List<PropertyDescriptor> descriptors, List<Rejection> rejected) {
    public DeclarationBatch {
        descriptors = List.copyOf(descriptors);
        rejected = List.copyOf(rejected);
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    public record Rejection(String key, String code, String message) {}
}
