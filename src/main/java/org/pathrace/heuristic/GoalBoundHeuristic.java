package org.pathrace.heuristic;

/**
 * Heuristic estimator bound to one goal node.
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining cost from a node to the bound goal.
     *
     * @param nodeId dense node index.
     * @return non-negative lower-bound estimate.
     */
    double estimateFromNode(int nodeId);
}
