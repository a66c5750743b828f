package org.pathrace.traversal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot emitted each time a traversal finalizes one node.
 *
 * <p>All collections are copied on construction, so a retained snapshot never
 * observes later engine mutations.</p>
 *
 * @param currentNode node finalized by this step.
 * @param visitedNodes visited node ids in first-visit order.
 * @param parentNodes parent id per node; nodes without a parent are absent.
 * @param path start-to-{@code currentNode} path, empty when no chain reaches the start.
 * @param complete whether {@code currentNode} is the traversal target.
 */
public record PathStep(
        String currentNode,
        Set<String> visitedNodes,
        Map<String, String> parentNodes,
        List<String> path,
        boolean complete
) {
    public PathStep {
        visitedNodes = Collections.unmodifiableSet(new LinkedHashSet<>(visitedNodes));
        parentNodes = Collections.unmodifiableMap(new LinkedHashMap<>(parentNodes));
        path = List.copyOf(path);
    }

    public Optional<String> parentOf(String nodeId) {
        return Optional.ofNullable(parentNodes.get(nodeId));
    }
}
