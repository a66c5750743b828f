package org.pathrace.heuristic;

/**
 * Heuristic provider contract used by weighted traversals.
 *
 * <p>Providers are immutable. Binding returns an immutable goal-bound estimator.</p>
 */
public interface HeuristicProvider {

    /**
     * Binds a goal node and returns a reusable estimator.
     *
     * @param goalNodeId dense goal index, or {@code -1} when the goal is not a node of the graph.
     * @return estimator bound to the goal; a zero estimator for an unknown goal.
     */
    GoalBoundHeuristic bindGoal(int goalNodeId);
}
