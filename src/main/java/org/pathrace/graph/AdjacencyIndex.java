package org.pathrace.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.pathrace.graph.id.IDMapper;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable symmetric adjacency index over one {@link Graph}.
 *
 * <p>Backed by CSR-style arrays: each node index maps to a contiguous range inside
 * {@code neighborIndices}/{@code weights}. Within a range, entries keep edge-list order,
 * and every edge {@code (u, v)} contributes {@code v} to {@code u}'s range and {@code u}
 * to {@code v}'s range. Edges naming an id that is not a node of the graph are dropped
 * in both directions.</p>
 */
@Slf4j
public final class AdjacencyIndex {
    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int droppedEdgeCount;
    private final int[] firstByNode;
    private final int[] neighborIndices;
    private final int[] weights;

    private AdjacencyIndex(int nodeCount, int droppedEdgeCount, int[] firstByNode, int[] neighborIndices, int[] weights) {
        this.nodeCount = nodeCount;
        this.droppedEdgeCount = droppedEdgeCount;
        this.firstByNode = firstByNode;
        this.neighborIndices = neighborIndices;
        this.weights = weights;
    }

    /**
     * Builds the index in {@code O(V + E)}.
     *
     * @param graph source graph.
     * @return adjacency index in the graph's dense node-index space.
     */
    public static AdjacencyIndex build(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        IDMapper ids = graph.idMapper();
        int nodeCount = graph.nodeCount();
        int edgeCount = graph.edgeCount();

        int[] fromIndex = new int[edgeCount];
        int[] toIndex = new int[edgeCount];
        int[] degree = new int[nodeCount];
        int dropped = 0;
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            Edge edge = graph.edges().get(edgeId);
            int from = ids.indexOf(edge.from());
            int to = ids.indexOf(edge.to());
            if (from == IDMapper.UNKNOWN || to == IDMapper.UNKNOWN) {
                fromIndex[edgeId] = IDMapper.UNKNOWN;
                dropped++;
                log.debug("Dropping dangling edge {}-{} (weight {})", edge.from(), edge.to(), edge.weight());
                continue;
            }
            fromIndex[edgeId] = from;
            toIndex[edgeId] = to;
            degree[from]++;
            degree[to]++;
        }

        int[] first = new int[nodeCount + 1];
        int cursor = 0;
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            first[nodeId] = cursor;
            cursor += degree[nodeId];
        }
        first[nodeCount] = cursor;

        int[] fillCursor = Arrays.copyOf(first, first.length);
        int[] neighbors = new int[cursor];
        int[] entryWeights = new int[cursor];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            int from = fromIndex[edgeId];
            if (from == IDMapper.UNKNOWN) {
                continue;
            }
            int to = toIndex[edgeId];
            int weight = graph.edges().get(edgeId).weight();

            int forward = fillCursor[from]++;
            neighbors[forward] = to;
            entryWeights[forward] = weight;

            int backward = fillCursor[to]++;
            neighbors[backward] = from;
            entryWeights[backward] = weight;
        }

        log.debug("Built adjacency index: nodes={}, entries={}, droppedEdges={}", nodeCount, cursor, dropped);
        return new AdjacencyIndex(nodeCount, dropped, first, neighbors, entryWeights);
    }

    /**
     * Returns start position (inclusive) of one node's neighbor range.
     */
    public int start(int nodeId) {
        validateNode(nodeId);
        return firstByNode[nodeId];
    }

    /**
     * Returns end position (exclusive) of one node's neighbor range.
     */
    public int end(int nodeId) {
        validateNode(nodeId);
        return firstByNode[nodeId + 1];
    }

    public int degree(int nodeId) {
        return end(nodeId) - start(nodeId);
    }

    /**
     * Returns the neighbor node index stored at one range position.
     */
    public int neighborAt(int position) {
        return neighborIndices[position];
    }

    /**
     * Returns the edge weight stored at one range position.
     */
    public int weightAt(int position) {
        return weights[position];
    }

    /**
     * Total number of directed entries (two per kept edge).
     */
    public int entryCount() {
        return neighborIndices.length;
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }
}
