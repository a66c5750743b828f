package org.pathrace.traversal;

import org.pathrace.graph.Graph;

import java.util.Optional;

/**
 * Resumable graph traversal shared by all strategies.
 *
 * <p>One engine instance runs one traversal at a time and is not thread-safe. A batch
 * run is exactly a sequence of {@link #step()} calls, so both modes report the same
 * snapshots in the same order.</p>
 */
public interface TraversalEngine {

    /**
     * @return strategy implemented by this engine.
     */
    TraversalStrategy strategy();

    /**
     * Discards any previous run and prepares a new traversal.
     *
     * <p>A start id that is not a node of the graph leaves the frontier empty: the
     * engine then finalizes nothing. An unknown end id is never reached.</p>
     *
     * @param graph graph to traverse.
     * @param startId start node id.
     * @param endId target node id.
     */
    void init(Graph graph, String startId, String endId);

    /**
     * Finalizes exactly one node.
     *
     * @return the snapshot for the finalized node, or empty when there is no more work:
     * the target was already finalized, the frontier is exhausted, or the engine is not initialized.
     */
    Optional<PathStep> step();

    /**
     * Steps until there is no more work.
     *
     * @return result covering every step emitted since {@link #init(Graph, String, String)}.
     * @throws IllegalStateException if the engine is not initialized.
     */
    AlgorithmResult runToCompletion();

    /**
     * Builds a result from the steps emitted so far and the current parent links.
     *
     * @throws IllegalStateException if the engine is not initialized.
     */
    AlgorithmResult result();

    /**
     * @return whether the engine has finalized the target or reported an exhausted frontier.
     */
    boolean isComplete();

    /**
     * Discards all traversal state; the engine can be initialized again.
     */
    void reset();
}
