package org.pathrace.race;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pathrace.traversal.TraversalStrategy;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RaceFairness Tests")
class RaceFairnessTest {

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource({
            "DIJKSTRA, A_STAR, FAIR",
            "A_STAR, A_STAR, FAIR",
            "DIJKSTRA, BFS, MIXED",
            "DFS, A_STAR, MIXED",
            "BFS, DFS, UNWEIGHTED",
            "DFS, DFS, UNWEIGHTED"
    })
    @DisplayName("Classifies by shortest-path guarantees")
    void testClassify(TraversalStrategy left, TraversalStrategy right, RaceFairness expected) {
        assertEquals(expected, RaceFairness.classify(left, right));
        assertEquals(expected, RaceFairness.classify(right, left));
    }
}
