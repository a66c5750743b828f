package org.pathrace.traversal;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.pathrace.graph.AdjacencyIndex;

/**
 * Breadth-first traversal. Edge weights are ignored.
 *
 * <p>Nodes are marked visited and given their parent when enqueued, so no node is
 * enqueued twice. The start is marked visited at seed time.</p>
 */
final class BfsTraversalEngine extends AbstractTraversalEngine {
    private final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

    BfsTraversalEngine() {
        super(TraversalStrategy.BFS);
    }

    @Override
    void seed(TraversalState state) {
        state.visited().markVisited(state.startIndex());
        queue.enqueue(state.startIndex());
    }

    @Override
    int selectNext(TraversalState state) {
        return queue.isEmpty() ? NO_NODE : queue.dequeueInt();
    }

    @Override
    void expand(TraversalState state, int node) {
        AdjacencyIndex adjacency = state.adjacency();
        for (int p = adjacency.start(node); p < adjacency.end(node); p++) {
            int neighbor = adjacency.neighborAt(p);
            if (state.visited().markVisited(neighbor)) {
                state.setParent(neighbor, node);
                queue.enqueue(neighbor);
            }
        }
    }

    @Override
    void clearFrontier() {
        queue.clear();
    }
}
