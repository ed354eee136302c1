package work.tikzgraph.props.hierarchy;

import java.util.AbstractList;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Index-addressed sequence that keeps unassigned positions as holes.
 *
 * <p>{@link #size()} is one past the highest assigned index. {@link #get(int)} returns {@code null}
 * for a hole; use {@link #isHole(int)} to tell a hole from an assigned {@code null}.
 */
public final class SparseList extends AbstractList<Object> {
    private final NavigableMap<Integer, Object> entries = new TreeMap<>();

    @Override
    public Object get(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + size());
        }
        return entries.get(index);
    }

    @Override
    public int size() {
        return entries.isEmpty() ? 0 : entries.lastKey() + 1;
    }

    public boolean isHole(int index) {
        return index >= 0 && index < size() && !entries.containsKey(index);
    }

    public int holeCount() {
        return size() - entries.size();
    }

    /** Assigned positions and their values, in index order. */
    public NavigableMap<Integer, Object> assigned() {
        return Collections.unmodifiableNavigableMap(entries);
    }

    boolean has(int index) {
        return entries.containsKey(index);
    }

    void put(int index, Object value) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Negative index " + index);
        }
        entries.put(index, value);
    }
}
