package org.pathrace.heuristic;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore turns a weighted best-first
 * traversal into plain Dijkstra.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    public static final GoalBoundHeuristic ZERO = nodeId -> 0.0d;

    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        return ZERO;
    }
}
