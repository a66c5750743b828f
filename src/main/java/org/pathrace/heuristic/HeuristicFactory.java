package org.pathrace.heuristic;

import lombok.experimental.UtilityClass;
import org.pathrace.graph.Graph;

import java.util.Objects;

/**
 * Creates heuristic providers by {@link HeuristicType}.
 */
@UtilityClass
public class HeuristicFactory {
    private static final NullHeuristicProvider NULL_PROVIDER = new NullHeuristicProvider();

    /**
     * @param type requested heuristic mode.
     * @param graph graph whose node positions back geometric estimates.
     * @param scale distance units per unit of cost, used by {@link HeuristicType#EUCLIDEAN}.
     * @return provider for {@code type}.
     * @throws IllegalArgumentException if a Euclidean scale is not finite and positive.
     */
    public static HeuristicProvider create(HeuristicType type, Graph graph, double scale) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(graph, "graph");
        return switch (type) {
            case NONE -> NULL_PROVIDER;
            case EUCLIDEAN -> new EuclideanHeuristicProvider(graph, scale);
        };
    }
}
