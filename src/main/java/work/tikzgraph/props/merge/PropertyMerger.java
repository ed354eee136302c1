package work.tikzgraph.props.merge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.tikzgraph.props.model.PathSegment;
import work.tikzgraph.props.model.PropertyDescriptor;

/**
 * Resolves an ordered sequence of descriptors into the minimal sequence describing the final state.
 *
 * <p>Renderer compatibility is only a filter: among compatible descriptors the later declaration of
 * an exact group and name path replaces the earlier one in place. A descriptor tagged
 * {@code !clear} first removes every resolved descriptor of the same group at or below its name
 * path, then is appended. Parents and children otherwise coexist.
 */
public final class PropertyMerger {
    private PropertyMerger() {}

    public static List<PropertyDescriptor> merge(List<PropertyDescriptor> descriptors, Collection<String> compatibleRenderers) {
        return mergeInto(List.of(), descriptors, compatibleRenderers);
    }

    /**
     * Applies {@code incoming} on top of an already resolved sequence. The inputs are not modified.
     */
    public static List<PropertyDescriptor> mergeInto(
        List<PropertyDescriptor> resolved,
        List<PropertyDescriptor> incoming,
        Collection<String> compatibleRenderers
    ) {
        Set<String> renderers = Set.copyOf(Objects.requireNonNull(compatibleRenderers, "compatibleRenderers"));
        var result = new ArrayList<PropertyDescriptor>(resolved == null ? List.of() : resolved);
        if (incoming == null || incoming.isEmpty()) {
            return result;
        }
        for (PropertyDescriptor descriptor : incoming) {
            if (!renderers.contains(descriptor.renderer())) {
                continue;
            }
            apply(result, descriptor);
        }
        return result;
    }

    private static void apply(List<PropertyDescriptor> result, PropertyDescriptor descriptor) {
        if (descriptor.clearChildren()) {
            result.removeIf(existing -> isAtOrBelow(existing, descriptor));
            result.add(descriptor);
            return;
        }
        for (int i = 0; i < result.size(); i++) {
            if (samePath(result.get(i), descriptor)) {
                result.set(i, descriptor);
                return;
            }
        }
        result.add(descriptor);
    }

    static boolean samePath(PropertyDescriptor a, PropertyDescriptor b) {
        return a.group().equals(b.group()) && a.namePath().equals(b.namePath());
    }

    /**
     * True when {@code candidate} shares the group of {@code anchor} and its name path starts with
     * every segment of the anchor's name path (the exact path included).
     */
    static boolean isAtOrBelow(PropertyDescriptor candidate, PropertyDescriptor anchor) {
        if (!candidate.group().equals(anchor.group())) {
            return false;
        }
        List<PathSegment> prefix = anchor.nameSegments();
        List<PathSegment> path = candidate.nameSegments();
        if (path.size() < prefix.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!path.get(i).text().equals(prefix.get(i).text())) {
                return false;
            }
        }
        return true;
    }
}
