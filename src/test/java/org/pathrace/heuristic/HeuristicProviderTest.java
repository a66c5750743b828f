package org.pathrace.heuristic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.pathrace.graph.Edge;
import org.pathrace.graph.Graph;
import org.pathrace.graph.GraphGenerator;
import org.pathrace.graph.Node;
import org.pathrace.testutil.GraphFixtures;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Heuristic Provider Tests")
class HeuristicProviderTest {

    @Test
    @DisplayName("Euclidean estimate is straight-line distance over the scale")
    void testEuclideanEstimate() {
        Graph graph = Graph.of(List.of(Node.of("a", 0, 0), Node.of("b", 30, 40)), List.of());
        GoalBoundHeuristic heuristic = new EuclideanHeuristicProvider(graph, 20.0).bindGoal(1);

        assertEquals(2.5, heuristic.estimateFromNode(0), 1e-9);
        assertEquals(0.0, heuristic.estimateFromNode(1), 1e-9);
    }

    @Test
    @DisplayName("Out-of-range goal or node yields zero")
    void testOutOfRange() {
        EuclideanHeuristicProvider provider = new EuclideanHeuristicProvider(GraphFixtures.triangle(), 20.0);

        assertSame(NullHeuristicProvider.ZERO, provider.bindGoal(-1));
        assertSame(NullHeuristicProvider.ZERO, provider.bindGoal(3));
        assertEquals(0.0, provider.bindGoal(2).estimateFromNode(42));
    }

    @Test
    @DisplayName("Invalid scales are rejected")
    void testInvalidScale() {
        Graph graph = GraphFixtures.triangle();
        assertThrows(IllegalArgumentException.class, () -> new EuclideanHeuristicProvider(graph, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new EuclideanHeuristicProvider(graph, -1.0));
        assertThrows(IllegalArgumentException.class, () -> new EuclideanHeuristicProvider(graph, Double.NaN));
    }

    @Test
    @DisplayName("Factory builds the provider for each heuristic type")
    void testFactory() {
        Graph graph = GraphFixtures.triangle();

        HeuristicProvider none = HeuristicFactory.create(HeuristicType.NONE, graph, 20.0);
        assertInstanceOf(NullHeuristicProvider.class, none);
        assertEquals(0.0, none.bindGoal(2).estimateFromNode(0));

        HeuristicProvider euclidean = HeuristicFactory.create(HeuristicType.EUCLIDEAN, graph, 20.0);
        assertInstanceOf(EuclideanHeuristicProvider.class, euclidean);
        assertEquals(2.0, euclidean.bindGoal(2).estimateFromNode(0), 1e-9);
        assertEquals(1.0, HeuristicFactory.create(HeuristicType.EUCLIDEAN, graph, 40.0)
                .bindGoal(2).estimateFromNode(0), 1e-9);
    }

    @Test
    @DisplayName("Factory validates its arguments")
    void testFactoryArguments() {
        Graph graph = GraphFixtures.triangle();
        assertThrows(NullPointerException.class, () -> HeuristicFactory.create(null, graph, 20.0));
        assertThrows(NullPointerException.class, () -> HeuristicFactory.create(HeuristicType.NONE, null, 20.0));
        assertThrows(IllegalArgumentException.class, () -> HeuristicFactory.create(HeuristicType.EUCLIDEAN, graph, 0.0));
    }

    @Test
    @DisplayName("Estimate never exceeds true cost on a dense grid")
    void testAdmissibleOnDenseGrid() {
        // Cells narrower than 20 units keep every edge at least as heavy as its straight-line share.
        Graph graph = GraphGenerator.grid(30, 40, new Random(8));
        String goal = GraphGenerator.gridId(29, 39);
        Map<String, Double> exact = GraphFixtures.shortestDistances(graph, goal);
        GoalBoundHeuristic heuristic = new EuclideanHeuristicProvider(graph, 20.0)
                .bindGoal(graph.idMapper().toInternal(goal));

        for (int i = 0; i < graph.nodeCount(); i++) {
            String id = graph.nodeAt(i).id();
            assertTrue(heuristic.estimateFromNode(i) <= exact.get(id) + 1e-9, "overestimate at " + id);
        }
    }

    @Test
    @DisplayName("Estimate is consistent across every edge of a dense grid")
    void testConsistentOnDenseGrid() {
        Graph graph = GraphGenerator.grid(30, 40, new Random(21));
        GoalBoundHeuristic heuristic = new EuclideanHeuristicProvider(graph, 20.0).bindGoal(0);

        for (Edge edge : graph.edges()) {
            double hFrom = heuristic.estimateFromNode(graph.idMapper().toInternal(edge.from()));
            double hTo = heuristic.estimateFromNode(graph.idMapper().toInternal(edge.to()));
            assertTrue(Math.abs(hFrom - hTo) <= edge.weight() + 1e-9, "inconsistent on " + edge);
        }
    }
}
