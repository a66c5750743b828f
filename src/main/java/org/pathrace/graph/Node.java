package org.pathrace.graph;

import java.util.Optional;

/**
 * Immutable graph vertex with a planar position.
 *
 * @param id unique node identifier.
 * @param x horizontal coordinate.
 * @param y vertical coordinate.
 * @param label optional display label, {@code null} when absent.
 */
public record Node(String id, double x, double y, String label) {

    public Node {
        if (id == null || id.isBlank()) {
            throw new GraphContractException(
                    GraphContractException.REASON_NODE_ID_REQUIRED,
                    "node id must be non-blank"
            );
        }
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new GraphContractException(
                    GraphContractException.REASON_NON_FINITE_COORDINATE,
                    "node " + id + " has non-finite position (" + x + ", " + y + ")"
            );
        }
    }

    /**
     * Creates an unlabeled node.
     */
    public static Node of(String id, double x, double y) {
        return new Node(id, x, y, null);
    }

    public Optional<String> displayLabel() {
        return Optional.ofNullable(label);
    }
}
