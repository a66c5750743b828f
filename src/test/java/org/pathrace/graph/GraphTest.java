package org.pathrace.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pathrace.testutil.GraphFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Model Tests")
class GraphTest {

    @Nested
    @DisplayName("1. Node and Edge contracts")
    class ValueContracts {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Blank node ids are rejected with a reason code")
        void testBlankNodeId(String id) {
            GraphContractException ex = assertThrows(GraphContractException.class, () -> Node.of(id, 0, 0));
            assertEquals(GraphContractException.REASON_NODE_ID_REQUIRED, ex.reasonCode());
            assertTrue(ex.getMessage().startsWith("[GRAPH_NODE_ID_REQUIRED]"));
        }

        @Test
        @DisplayName("Non-finite coordinates are rejected")
        void testNonFiniteCoordinate() {
            GraphContractException ex = assertThrows(
                    GraphContractException.class,
                    () -> Node.of("a", Double.NaN, 0)
            );
            assertEquals(GraphContractException.REASON_NON_FINITE_COORDINATE, ex.reasonCode());
            assertThrows(GraphContractException.class, () -> Node.of("a", 0, Double.POSITIVE_INFINITY));
        }

        @Test
        @DisplayName("Labels are optional")
        void testLabel() {
            assertTrue(Node.of("a", 1, 2).displayLabel().isEmpty());
            assertEquals("A", new Node("a", 1, 2, "A").displayLabel().orElseThrow());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, -100})
        @DisplayName("Edge weights below one are rejected")
        void testNonPositiveWeight(int weight) {
            GraphContractException ex = assertThrows(GraphContractException.class, () -> Edge.of("a", "b", weight));
            assertEquals(GraphContractException.REASON_NON_POSITIVE_WEIGHT, ex.reasonCode());
        }

        @Test
        @DisplayName("Edge endpoints must be present")
        void testEdgeEndpoints() {
            GraphContractException ex = assertThrows(GraphContractException.class, () -> Edge.of(null, "b", 1));
            assertEquals(GraphContractException.REASON_EDGE_ENDPOINT_REQUIRED, ex.reasonCode());
            assertThrows(GraphContractException.class, () -> Edge.of("a", " ", 1));
        }

        @Test
        @DisplayName("Edges connect in both directions")
        void testConnects() {
            Edge edge = Edge.of("a", "b", 3);
            assertTrue(edge.connects("a", "b"));
            assertTrue(edge.connects("b", "a"));
            assertFalse(edge.connects("a", "c"));
        }

        @Test
        @DisplayName("Blank reason codes are rejected")
        void testBlankReasonCode() {
            assertThrows(IllegalArgumentException.class, () -> new GraphContractException(" ", "details"));
        }
    }

    @Nested
    @DisplayName("2. Graph construction and lookup")
    class Construction {

        @Test
        @DisplayName("Builder keeps node and edge order")
        void testBuilderOrder() {
            Graph graph = GraphFixtures.triangle();

            assertEquals(3, graph.nodeCount());
            assertEquals(3, graph.edgeCount());
            assertEquals("a", graph.nodeAt(0).id());
            assertEquals("c", graph.nodeAt(2).id());
            assertEquals(1, graph.idMapper().toInternal("b"));
        }

        @Test
        @DisplayName("Duplicate node ids are rejected")
        void testDuplicateIds() {
            GraphContractException ex = assertThrows(
                    GraphContractException.class,
                    () -> Graph.of(List.of(Node.of("a", 0, 0), Node.of("a", 5, 5)), List.of())
            );
            assertEquals(GraphContractException.REASON_DUPLICATE_NODE_ID, ex.reasonCode());
        }

        @Test
        @DisplayName("Lookup of known and unknown ids")
        void testLookup() {
            Graph graph = GraphFixtures.triangle();

            assertTrue(graph.containsNode("a"));
            assertFalse(graph.containsNode("zzz"));
            assertEquals(20.0, graph.node("b").orElseThrow().x());
            assertTrue(graph.node("zzz").isEmpty());
        }

        @Test
        @DisplayName("Edges may reference ids outside the node list")
        void testDanglingEdgeAccepted() {
            Graph graph = Graph.of(List.of(Node.of("a", 0, 0)), List.of(Edge.of("a", "ghost", 1)));
            assertEquals(1, graph.edgeCount());
        }

        @Test
        @DisplayName("Node and edge lists are immutable")
        void testImmutability() {
            Graph graph = GraphFixtures.triangle();
            assertThrows(UnsupportedOperationException.class, () -> graph.nodes().add(Node.of("d", 0, 0)));
            assertThrows(UnsupportedOperationException.class, () -> graph.edges().clear());
        }
    }
}
