package org.pathrace.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.pathrace.testutil.GraphFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathMetrics Tests")
class PathMetricsTest {

    @Test
    @DisplayName("Empty path weighs positive infinity")
    void testEmptyPath() {
        assertEquals(Double.POSITIVE_INFINITY, PathMetrics.pathWeight(GraphFixtures.triangle(), List.of()));
    }

    @Test
    @DisplayName("Single-node path weighs zero")
    void testSingleNode() {
        assertEquals(0.0, PathMetrics.pathWeight(GraphFixtures.triangle(), List.of("a")));
    }

    @Test
    @DisplayName("Edges are charged in either direction")
    void testSummation() {
        Graph graph = GraphFixtures.triangle();
        assertEquals(2.0, PathMetrics.pathWeight(graph, List.of("a", "b", "c")));
        assertEquals(2.0, PathMetrics.pathWeight(graph, List.of("c", "b", "a")));
        assertEquals(5.0, PathMetrics.pathWeight(graph, List.of("a", "c")));
    }

    @Test
    @DisplayName("Parallel edges charge the lightest one")
    void testParallelEdges() {
        Graph graph = Graph.of(
                List.of(Node.of("a", 0, 0), Node.of("b", 10, 0)),
                List.of(Edge.of("a", "b", 7), Edge.of("b", "a", 2))
        );
        assertEquals(2.0, PathMetrics.pathWeight(graph, List.of("a", "b")));
    }

    @Test
    @DisplayName("Unjoined consecutive nodes are rejected")
    void testMissingEdge() {
        assertThrows(
                IllegalArgumentException.class,
                () -> PathMetrics.pathWeight(GraphFixtures.disconnected(), List.of("start", "end"))
        );
    }
}
