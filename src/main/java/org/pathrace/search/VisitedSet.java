package org.pathrace.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.BitSet;

/**
 * Visited-node tracker over dense node indices.
 * <p>
 * Wraps a {@link java.util.BitSet} for O(1) membership and keeps the order in which
 * nodes were first marked, which snapshots report.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;
    private final IntArrayList order;

    /**
     * @param initialCapacity expected node count, to avoid resizing.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(initialCapacity);
        this.order = new IntArrayList(initialCapacity);
    }

    /**
     * Marks a node as visited if it hasn't been visited already.
     *
     * @return {@code true} if the node was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(int nodeId) {
        if (visited.get(nodeId)) {
            return false;
        }
        visited.set(nodeId);
        order.add(nodeId);
        return true;
    }

    public boolean isVisited(int nodeId) {
        return visited.get(nodeId);
    }

    public int size() {
        return order.size();
    }

    /**
     * Returns a read-only view of node indices in first-visit order.
     */
    public IntList visitOrder() {
        return IntLists.unmodifiable(order);
    }

    /**
     * Resets the set for reuse.
     */
    public void clear() {
        visited.clear();
        order.clear();
    }
}
