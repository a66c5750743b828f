package org.pathrace.traversal;

/**
 * Dijkstra's algorithm: best-first by cumulative distance.
 */
final class DijkstraTraversalEngine extends BestFirstTraversalEngine {

    DijkstraTraversalEngine(TraversalSettings settings) {
        super(TraversalStrategy.DIJKSTRA, settings);
    }
}
