package org.pathrace.traversal;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.pathrace.graph.AdjacencyIndex;

/**
 * Depth-first traversal over an explicit stack. Edge weights are ignored.
 *
 * <p>Neighbors are pushed in reverse adjacency order so they pop in adjacency order.
 * A neighbor's parent is assigned the first time any node discovers it, and a node
 * that already has a parent is never pushed again. The reported parent chain can
 * therefore differ from the order in which nodes were actually visited.</p>
 */
final class DfsTraversalEngine extends AbstractTraversalEngine {
    private final IntArrayList stack = new IntArrayList();

    DfsTraversalEngine() {
        super(TraversalStrategy.DFS);
    }

    @Override
    void seed(TraversalState state) {
        stack.add(state.startIndex());
    }

    @Override
    int selectNext(TraversalState state) {
        while (!stack.isEmpty()) {
            int node = stack.removeInt(stack.size() - 1);
            if (state.visited().markVisited(node)) {
                return node;
            }
        }
        return NO_NODE;
    }

    @Override
    void expand(TraversalState state, int node) {
        AdjacencyIndex adjacency = state.adjacency();
        for (int p = adjacency.end(node) - 1; p >= adjacency.start(node); p--) {
            int neighbor = adjacency.neighborAt(p);
            if (!state.visited().isVisited(neighbor) && !state.hasParent(neighbor)) {
                state.setParent(neighbor, node);
                stack.add(neighbor);
            }
        }
    }

    @Override
    void clearFrontier() {
        stack.clear();
    }
}
