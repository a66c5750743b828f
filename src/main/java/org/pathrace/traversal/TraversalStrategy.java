package org.pathrace.traversal;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.pathrace.heuristic.HeuristicType;

/**
 * Traversal strategy selector.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum TraversalStrategy {
    DIJKSTRA("Dijkstra's Algorithm", true, HeuristicType.NONE),
    A_STAR("A* Algorithm", true, HeuristicType.EUCLIDEAN),
    BFS("Breadth-First Search", false, HeuristicType.NONE),
    DFS("Depth-First Search", false, HeuristicType.NONE);

    private final String displayName;
    /**
     * Whether the strategy reports a minimum-weight path.
     *
     * <p>For {@link #A_STAR} this holds only while the heuristic is admissible: every
     * edge must weigh at least its length divided by
     * {@link TraversalSettings#heuristicScale()}. Sparse layouts with long, light
     * edges can make A* return a heavier path than Dijkstra.</p>
     */
    private final boolean guaranteesShortestPath;
    /** Heuristic the best-first engines bind for this strategy. */
    private final HeuristicType heuristicType;
}
