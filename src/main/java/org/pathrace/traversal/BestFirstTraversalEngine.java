package org.pathrace.traversal;

import org.pathrace.graph.AdjacencyIndex;
import org.pathrace.heuristic.GoalBoundHeuristic;
import org.pathrace.heuristic.HeuristicFactory;
import org.pathrace.search.FrontierEntry;
import org.pathrace.search.PriorityFrontier;

import java.util.Objects;

/**
 * Weighted best-first traversal over a lazily invalidated min-heap.
 *
 * <p>The frontier score is {@code g + h}, where {@code g} is the cumulative edge weight
 * and {@code h} comes from the bound heuristic. A zero heuristic gives Dijkstra; a
 * scaled Euclidean heuristic gives A*. Nodes may sit in the frontier several times;
 * extractions that are already visited or whose score exceeds the node's best-known
 * score are discarded.</p>
 */
abstract class BestFirstTraversalEngine extends AbstractTraversalEngine {
    private final TraversalSettings settings;
    private final PriorityFrontier frontier = new PriorityFrontier();
    private GoalBoundHeuristic heuristic;

    BestFirstTraversalEngine(TraversalStrategy strategy, TraversalSettings settings) {
        super(strategy);
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    final void seed(TraversalState state) {
        heuristic = HeuristicFactory.create(strategy().heuristicType(), state.graph(), settings.heuristicScale())
                .bindGoal(state.endIndex());
        int start = state.startIndex();
        double startScore = heuristic.estimateFromNode(start);
        state.distances()[start] = 0.0d;
        state.scores()[start] = startScore;
        frontier.insert(startScore, start);
    }

    @Override
    final int selectNext(TraversalState state) {
        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.extractMin();
            int node = entry.item();
            if (state.visited().isVisited(node)) {
                continue;
            }
            if (Double.compare(entry.score(), state.scores()[node]) > 0) {
                // stale: a better score was pushed after this entry
                continue;
            }
            state.visited().markVisited(node);
            return node;
        }
        return NO_NODE;
    }

    @Override
    final void expand(TraversalState state, int node) {
        AdjacencyIndex adjacency = state.adjacency();
        double[] distances = state.distances();
        double[] scores = state.scores();
        double base = distances[node];
        for (int p = adjacency.start(node); p < adjacency.end(node); p++) {
            int neighbor = adjacency.neighborAt(p);
            if (state.visited().isVisited(neighbor)) {
                continue;
            }
            double candidate = base + adjacency.weightAt(p);
            if (candidate < distances[neighbor]) {
                distances[neighbor] = candidate;
                state.setParent(neighbor, node);
                double score = candidate + heuristic.estimateFromNode(neighbor);
                scores[neighbor] = score;
                frontier.insert(score, neighbor);
            }
        }
    }

    @Override
    final void clearFrontier() {
        frontier.clear();
        heuristic = null;
    }
}
