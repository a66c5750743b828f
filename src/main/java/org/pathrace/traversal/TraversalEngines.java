package org.pathrace.traversal;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Factory for strategy-specific {@link TraversalEngine} instances.
 */
@UtilityClass
public class TraversalEngines {

    /**
     * Creates an engine with settings loaded from system properties.
     */
    public static TraversalEngine create(TraversalStrategy strategy) {
        return create(strategy, TraversalSettings.defaults());
    }

    public static TraversalEngine create(TraversalStrategy strategy, TraversalSettings settings) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(settings, "settings");
        return switch (strategy) {
            case DIJKSTRA -> new DijkstraTraversalEngine(settings);
            case A_STAR -> new AStarTraversalEngine(settings);
            case BFS -> new BfsTraversalEngine();
            case DFS -> new DfsTraversalEngine();
        };
    }
}
