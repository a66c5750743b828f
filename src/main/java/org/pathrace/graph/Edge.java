package org.pathrace.graph;

/**
 * Undirected weighted edge between two node ids.
 *
 * <p>Endpoints are not required to exist in the owning graph; traversal code drops
 * dangling edges when building its adjacency index.</p>
 *
 * @param from first endpoint id.
 * @param to second endpoint id.
 * @param weight positive traversal weight, identical in both directions.
 */
public record Edge(String from, String to, int weight) {

    public Edge {
        if (from == null || from.isBlank() || to == null || to.isBlank()) {
            throw new GraphContractException(
                    GraphContractException.REASON_EDGE_ENDPOINT_REQUIRED,
                    "edge endpoints must be non-blank, got (" + from + ", " + to + ")"
            );
        }
        if (weight <= 0) {
            throw new GraphContractException(
                    GraphContractException.REASON_NON_POSITIVE_WEIGHT,
                    "edge " + from + "-" + to + " weight must be >= 1, got " + weight
            );
        }
    }

    public static Edge of(String from, String to, int weight) {
        return new Edge(from, to, weight);
    }

    /**
     * Returns whether this edge joins the two ids in either direction.
     */
    public boolean connects(String a, String b) {
        return (from.equals(a) && to.equals(b)) || (from.equals(b) && to.equals(a));
    }
}
