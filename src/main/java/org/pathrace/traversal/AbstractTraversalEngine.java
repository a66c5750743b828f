package org.pathrace.traversal;

import lombok.extern.slf4j.Slf4j;
import org.pathrace.graph.Graph;
import org.pathrace.graph.PathMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared step loop for all strategies.
 *
 * <p>Subclasses supply three hooks over {@link TraversalState}: seeding the frontier,
 * selecting the next node to finalize, and expanding a finalized node. This class
 * owns snapshotting, completion tracking and result assembly.</p>
 */
@Slf4j
abstract class AbstractTraversalEngine implements TraversalEngine {
    static final int NO_NODE = -1;

    private final TraversalStrategy strategy;
    private final List<PathStep> emitted = new ArrayList<>();
    private TraversalState state;
    private boolean complete;

    AbstractTraversalEngine(TraversalStrategy strategy) {
        this.strategy = strategy;
    }

    @Override
    public final TraversalStrategy strategy() {
        return strategy;
    }

    @Override
    public final void init(Graph graph, String startId, String endId) {
        reset();
        TraversalState fresh = new TraversalState(graph, startId, endId);
        if (fresh.hasStart()) {
            seed(fresh);
        }
        this.state = fresh;
        log.debug("{} initialized: start={}, end={}, nodes={}, startKnown={}, endKnown={}",
                strategy, startId, endId, graph.nodeCount(), fresh.hasStart(),
                fresh.endIndex() != TraversalState.UNKNOWN_NODE);
    }

    @Override
    public final Optional<PathStep> step() {
        if (state == null || complete) {
            return Optional.empty();
        }
        int node = selectNext(state);
        if (node == NO_NODE) {
            complete = true;
            log.debug("{} exhausted frontier after {} steps without reaching {}",
                    strategy, emitted.size(), state.endId());
            return Optional.empty();
        }

        PathStep snapshot = state.snapshot(node);
        emitted.add(snapshot);
        log.trace("{} step {}: finalized {}", strategy, emitted.size() - 1, snapshot.currentNode());

        if (state.isTarget(node)) {
            complete = true;
            log.debug("{} reached {} after {} steps", strategy, state.endId(), emitted.size());
        } else {
            expand(state, node);
        }
        return Optional.of(snapshot);
    }

    @Override
    public final AlgorithmResult runToCompletion() {
        requireInitialized();
        Optional<PathStep> next = step();
        while (next.isPresent()) {
            next = step();
        }
        return result();
    }

    @Override
    public final AlgorithmResult result() {
        requireInitialized();
        List<String> path = state.pathTo(state.endIndex());
        int completionIndex = AlgorithmResult.NOT_COMPLETED;
        for (int i = 0; i < emitted.size(); i++) {
            if (emitted.get(i).complete()) {
                completionIndex = i;
                break;
            }
        }
        return AlgorithmResult.builder()
                .strategy(strategy)
                .startId(state.startId())
                .endId(state.endId())
                .path(path)
                .steps(emitted)
                .visitedNodes(state.visitedIds())
                .distance(PathMetrics.pathWeight(state.graph(), path))
                .completionStepIndex(completionIndex)
                .terminal(complete)
                .build();
    }

    @Override
    public final boolean isComplete() {
        return complete;
    }

    @Override
    public final void reset() {
        state = null;
        complete = false;
        emitted.clear();
        clearFrontier();
    }

    /**
     * Places the start node on the frontier. Called only when the start is a node of the graph.
     */
    abstract void seed(TraversalState state);

    /**
     * Pops frontier entries until one node can be finalized, and marks it visited if the
     * strategy has not already done so.
     *
     * @return finalized node index, or {@link #NO_NODE} when the frontier is exhausted.
     */
    abstract int selectNext(TraversalState state);

    /**
     * Pushes the neighbors of a just-finalized, non-target node.
     */
    abstract void expand(TraversalState state, int node);

    abstract void clearFrontier();

    private void requireInitialized() {
        if (state == null) {
            throw new IllegalStateException(strategy + " engine is not initialized");
        }
    }
}
