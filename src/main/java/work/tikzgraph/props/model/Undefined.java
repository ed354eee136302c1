package work.tikzgraph.props.model;

/**
 * Marker for a property that declares no value at all, as opposed to an explicit {@code null}.
 */
public final class Undefined {
    public static final Undefined INSTANCE = new Undefined();

    private Undefined() {}

    public static boolean is(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
