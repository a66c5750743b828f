package org.pathrace.traversal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one traversal: the final path, every emitted step, and the visited set.
 *
 * <p>When the target was not reached, {@code path} is empty and {@code distance} is
 * {@code +INF}. A result taken before the run finished is not {@code terminal}; its
 * path is the current best guess, not the final one.</p>
 */
@Value
@Builder
public class AlgorithmResult {
    public static final int NOT_COMPLETED = -1;

    /** Strategy that produced this result. */
    TraversalStrategy strategy;
    String startId;
    String endId;
    /** Start-to-target node ids, empty when unreachable. */
    @Singular("pathNode")
    List<String> path;
    /** Snapshots in emission order. */
    @Singular
    List<PathStep> steps;
    /** Every node the traversal marked visited, in first-visit order. */
    @Singular
    Set<String> visitedNodes;
    /** Total weight of {@code path}. */
    double distance;
    /** Index of the first step whose completion flag is set, or {@link #NOT_COMPLETED}. */
    int completionStepIndex;
    /** Whether the traversal had finished when this result was taken; mid-run results are partial. */
    boolean terminal;

    /**
     * Returns whether {@code path} runs from the start to the target.
     */
    public boolean foundPath() {
        return !path.isEmpty()
                && path.get(0).equals(startId)
                && path.get(path.size() - 1).equals(endId);
    }

    public int stepCount() {
        return steps.size();
    }
}
