package org.pathrace.traversal;

/**
 * A*: best-first by cumulative distance plus scaled straight-line distance to the target.
 */
final class AStarTraversalEngine extends BestFirstTraversalEngine {

    AStarTraversalEngine(TraversalSettings settings) {
        super(TraversalStrategy.A_STAR, settings);
    }
}
