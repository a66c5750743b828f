package org.pathrace.graph;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Objects;

/**
 * Weight accounting for node paths reported by traversals.
 */
@UtilityClass
public class PathMetrics {

    /**
     * Sums the weights along a node path.
     *
     * <p>Each consecutive pair is charged the lightest edge joining it, in either direction.</p>
     *
     * @param graph graph the path was computed on.
     * @param path ordered node ids.
     * @return total weight; {@code 0} for a single-node path and positive infinity for an empty path.
     * @throws IllegalArgumentException when no edge joins two consecutive path nodes.
     */
    public static double pathWeight(Graph graph, List<String> path) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        long total = 0L;
        for (int i = 0; i + 1 < path.size(); i++) {
            total += edgeWeight(graph, path.get(i), path.get(i + 1));
        }
        return total;
    }

    private static int edgeWeight(Graph graph, String a, String b) {
        int best = Integer.MAX_VALUE;
        for (Edge edge : graph.edges()) {
            if (edge.connects(a, b) && edge.weight() < best) {
                best = edge.weight();
            }
        }
        if (best == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("no edge joins " + a + " and " + b);
        }
        return best;
    }
}
