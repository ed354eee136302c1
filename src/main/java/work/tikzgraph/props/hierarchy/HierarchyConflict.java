package work.tikzgraph.props.hierarchy;

import work.tikzgraph.props.model.PropertyDescriptor;

/**
 * A skipped assignment: the descriptor, the path at which its shape clashed, and why.
 */
public record HierarchyConflict(PropertyDescriptor descriptor, String path, String reason) {
    public String describe() {
        return "Cannot place " + descriptor.toDeclaration() + " at '" + path + "': " + reason;
    }
}
