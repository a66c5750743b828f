package org.pathrace.heuristic;

import org.pathrace.graph.Graph;
import org.pathrace.graph.Node;

import java.util.Objects;

/**
 * Euclidean heuristic provider.
 *
 * <p>Uses straight-line (L2) distance between node positions divided by a fixed
 * scale. With a scale of {@code 20} the estimate stays admissible on layouts where
 * every edge weighs at least one unit per 20 distance units.</p>
 */
public final class EuclideanHeuristicProvider implements HeuristicProvider {
    private final Graph graph;
    private final double scale;

    /**
     * @param graph graph whose node positions drive the estimate.
     * @param scale distance units per unit of cost; must be finite and positive.
     */
    public EuclideanHeuristicProvider(Graph graph, double scale) {
        this.graph = Objects.requireNonNull(graph, "graph");
        if (!Double.isFinite(scale) || scale <= 0.0d) {
            throw new IllegalArgumentException("scale must be finite and > 0, got " + scale);
        }
        this.scale = scale;
    }

    /**
     * Binds this provider to one goal node.
     *
     * @param goalNodeId dense goal index; an index outside the graph yields a zero estimator.
     */
    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        if (goalNodeId < 0 || goalNodeId >= graph.nodeCount()) {
            return NullHeuristicProvider.ZERO;
        }
        Node goal = graph.nodeAt(goalNodeId);
        return new BoundEuclideanHeuristic(graph, goal.x(), goal.y(), scale);
    }

    private static final class BoundEuclideanHeuristic implements GoalBoundHeuristic {
        private final Graph graph;
        private final double goalX;
        private final double goalY;
        private final double scale;

        private BoundEuclideanHeuristic(Graph graph, double goalX, double goalY, double scale) {
            this.graph = graph;
            this.goalX = goalX;
            this.goalY = goalY;
            this.scale = scale;
        }

        /**
         * Returns the scaled straight-line estimate, or zero for an index outside the graph.
         */
        @Override
        public double estimateFromNode(int nodeId) {
            if (nodeId < 0 || nodeId >= graph.nodeCount()) {
                return 0.0d;
            }
            Node node = graph.nodeAt(nodeId);
            double estimate = GeometryDistance.euclideanDistance(node.x(), node.y(), goalX, goalY) / scale;
            if (!Double.isFinite(estimate) || estimate < 0.0d) {
                // Preserve admissibility under extreme numeric ranges.
                return 0.0d;
            }
            return estimate;
        }
    }
}
