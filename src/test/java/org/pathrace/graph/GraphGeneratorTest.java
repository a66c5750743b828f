package org.pathrace.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pathrace.testutil.GraphFixtures;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphGenerator Tests")
class GraphGeneratorTest {

    @Nested
    @DisplayName("1. Grid graphs")
    class Grids {

        @Test
        @DisplayName("Grid has rows*cols nodes and 4-neighbor edges")
        void testGridShape() {
            Graph graph = GraphGenerator.grid(4, 6, new Random(7));

            assertEquals(24, graph.nodeCount());
            assertEquals(4 * 5 + 3 * 6, graph.edgeCount());
            assertTrue(graph.containsNode(GraphGenerator.gridId(3, 5)));
            assertEquals("2,3", graph.node(GraphGenerator.gridId(2, 3)).orElseThrow().label());
        }

        @Test
        @DisplayName("Grid weights stay within 1..10")
        void testGridWeights() {
            Graph graph = GraphGenerator.grid(10, 10, new Random(3));
            for (Edge edge : graph.edges()) {
                assertTrue(edge.weight() >= 1 && edge.weight() <= 10, "weight out of range: " + edge);
            }
        }

        @Test
        @DisplayName("Same seed yields the same grid")
        void testGridDeterminism() {
            Graph first = GraphGenerator.grid(5, 5, new Random(99));
            Graph second = GraphGenerator.grid(5, 5, new Random(99));
            assertEquals(first.nodes(), second.nodes());
            assertEquals(first.edges(), second.edges());
        }

        @Test
        @DisplayName("Cells further right sit further right")
        void testGridLayout() {
            Graph graph = GraphGenerator.grid(3, 3, new Random(1));
            Node left = graph.node(GraphGenerator.gridId(1, 0)).orElseThrow();
            Node right = graph.node(GraphGenerator.gridId(1, 2)).orElseThrow();
            assertTrue(right.x() > left.x());
            assertEquals(left.y(), right.y());
        }

        @Test
        @DisplayName("Non-positive dimensions are rejected")
        void testGridArguments() {
            GraphContractException ex = assertThrows(
                    GraphContractException.class,
                    () -> GraphGenerator.grid(0, 3, new Random(1))
            );
            assertEquals(GraphContractException.REASON_GENERATOR_ARGUMENT, ex.reasonCode());
        }
    }

    @Nested
    @DisplayName("2. Random spatial graphs")
    class RandomGraphs {

        @ParameterizedTest
        @ValueSource(longs = {1L, 17L, 2024L})
        @DisplayName("Every node is reachable from node-0")
        void testConnected(long seed) {
            Graph graph = GraphGenerator.random(25, 0.1, new Random(seed));
            Map<String, Double> distances = GraphFixtures.shortestDistances(graph, "node-0");

            assertEquals(25, graph.nodeCount());
            distances.forEach((id, distance) -> assertTrue(Double.isFinite(distance), id + " unreachable"));
        }

        @Test
        @DisplayName("Zero density still produces a connected graph")
        void testZeroDensity() {
            Graph graph = GraphGenerator.random(10, 0.0, new Random(5));
            assertEquals(9, graph.edgeCount());
        }

        @Test
        @DisplayName("Weights grow with distance and are capped")
        void testSpatialWeights() {
            Graph graph = GraphGenerator.random(20, 0.5, new Random(11));
            for (Edge edge : graph.edges()) {
                Node a = graph.node(edge.from()).orElseThrow();
                Node b = graph.node(edge.to()).orElseThrow();
                int expected = Math.min((int) Math.floor(Math.hypot(a.x() - b.x(), a.y() - b.y()) / 20.0) + 1, 20);
                assertEquals(expected, edge.weight());
            }
        }

        @Test
        @DisplayName("Same seed yields the same graph")
        void testDeterminism() {
            Graph first = GraphGenerator.random(15, 0.3, new Random(42));
            Graph second = GraphGenerator.random(15, 0.3, new Random(42));
            assertEquals(first.nodes(), second.nodes());
            assertEquals(first.edges(), second.edges());
        }

        @Test
        @DisplayName("Density outside [0, 1] is rejected")
        void testDensityArgument() {
            assertThrows(GraphContractException.class, () -> GraphGenerator.random(5, 1.5, new Random(1)));
            assertThrows(GraphContractException.class, () -> GraphGenerator.random(5, Double.NaN, new Random(1)));
            assertThrows(GraphContractException.class, () -> GraphGenerator.random(0, 0.5, new Random(1)));
        }
    }
}
