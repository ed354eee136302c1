package work.tikzgraph.props.hierarchy;

/**
 * Raised by the strict hierarchy mode when a descriptor cannot be placed.
 */
public final class HierarchyConflictException extends RuntimeException {
    private final HierarchyConflict conflict;

    public HierarchyConflictException(HierarchyConflict conflict) {
        super(conflict.describe());
        this.conflict = conflict;
    }

    public HierarchyConflict conflict() {
        return conflict;
    }
}
