package org.pathrace.traversal;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.pathrace.graph.AdjacencyIndex;
import org.pathrace.graph.Graph;
import org.pathrace.graph.id.IDMapper;
import org.pathrace.search.VisitedSet;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable per-run traversal state in dense node-index space.
 *
 * <p>Owned by exactly one engine and created at {@code init}. Frontier containers
 * live with the strategy that shapes them. {@link #snapshot(int)} deep-copies
 * everything a {@link PathStep} reports.</p>
 */
@Getter
@Accessors(fluent = true)
final class TraversalState {
    static final int UNKNOWN_NODE = IDMapper.UNKNOWN;

    private final Graph graph;
    private final AdjacencyIndex adjacency;
    private final IDMapper ids;
    private final String startId;
    private final String endId;
    private final int startIndex;
    private final int endIndex;

    /** Best-known cumulative distance per node. */
    private final double[] distances;
    /** Best-known frontier score per node: distance, or distance plus heuristic. */
    private final double[] scores;
    private final int[] parents;
    private final VisitedSet visited;

    TraversalState(Graph graph, String startId, String endId) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.startId = Objects.requireNonNull(startId, "startId");
        this.endId = Objects.requireNonNull(endId, "endId");
        this.adjacency = AdjacencyIndex.build(graph);
        this.ids = graph.idMapper();
        this.startIndex = ids.indexOf(startId);
        this.endIndex = ids.indexOf(endId);

        int nodeCount = graph.nodeCount();
        this.distances = new double[nodeCount];
        this.scores = new double[nodeCount];
        this.parents = new int[nodeCount];
        Arrays.fill(distances, Double.POSITIVE_INFINITY);
        Arrays.fill(scores, Double.POSITIVE_INFINITY);
        Arrays.fill(parents, PathReconstructor.NO_PARENT);
        this.visited = new VisitedSet(nodeCount);
    }

    boolean hasStart() {
        return startIndex != UNKNOWN_NODE;
    }

    boolean isTarget(int nodeIndex) {
        return nodeIndex == endIndex;
    }

    boolean hasParent(int nodeIndex) {
        return parents[nodeIndex] != PathReconstructor.NO_PARENT;
    }

    void setParent(int nodeIndex, int parentIndex) {
        parents[nodeIndex] = parentIndex;
    }

    /**
     * Reconstructs the current start-to-node path.
     */
    List<String> pathTo(int nodeIndex) {
        if (!hasStart() || nodeIndex == UNKNOWN_NODE) {
            return List.of();
        }
        return PathReconstructor.reconstruct(parents, startIndex, nodeIndex, ids);
    }

    /**
     * Copies the visited set and parent map out of the live state for one finalized node.
     */
    PathStep snapshot(int nodeIndex) {
        return new PathStep(
                ids.toExternal(nodeIndex),
                visitedIds(),
                parentIds(),
                pathTo(nodeIndex),
                isTarget(nodeIndex)
        );
    }

    Set<String> visitedIds() {
        IntList order = visited.visitOrder();
        Set<String> copy = new LinkedHashSet<>(order.size() * 2);
        for (int i = 0; i < order.size(); i++) {
            copy.add(ids.toExternal(order.getInt(i)));
        }
        return copy;
    }

    private Map<String, String> parentIds() {
        Map<String, String> copy = new LinkedHashMap<>();
        for (int index = 0; index < parents.length; index++) {
            if (hasParent(index)) {
                copy.put(ids.toExternal(index), ids.toExternal(parents[index]));
            }
        }
        return copy;
    }
}
