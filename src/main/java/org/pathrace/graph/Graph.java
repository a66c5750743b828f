package org.pathrace.graph;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.experimental.Accessors;
import org.pathrace.graph.id.IDMapper;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable undirected weighted graph: an ordered node list and an ordered edge list.
 *
 * <p>Node ids are unique and map densely onto their list position through
 * {@link #idMapper()}. Edges may name ids that are not nodes of this graph; such
 * edges are kept as given and skipped by traversal code.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Graph {
    private final List<Node> nodes;
    private final List<Edge> edges;
    private final IDMapper idMapper;

    /**
     * Creates a graph from nodes and edges.
     *
     * @throws GraphContractException when two nodes share an id.
     */
    @Builder
    public Graph(@Singular List<Node> nodes, @Singular List<Edge> edges) {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        this.edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        this.idMapper = IDMapper.createImmutable(collectUniqueIds(this.nodes));
    }

    public static Graph of(List<Node> nodes, List<Edge> edges) {
        return new Graph(nodes, edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean containsNode(String id) {
        return idMapper.containsExternal(id);
    }

    /**
     * Looks up a node by id.
     */
    public Optional<Node> node(String id) {
        int index = idMapper.indexOf(id);
        return index == IDMapper.UNKNOWN ? Optional.empty() : Optional.of(nodes.get(index));
    }

    /**
     * Returns the node at one dense index.
     */
    public Node nodeAt(int index) {
        return nodes.get(index);
    }

    private static List<String> collectUniqueIds(List<Node> nodes) {
        ObjectOpenHashSet<String> seen = new ObjectOpenHashSet<>(nodes.size());
        String[] ids = new String[nodes.size()];
        for (int i = 0; i < ids.length; i++) {
            String id = nodes.get(i).id();
            if (!seen.add(id)) {
                throw new GraphContractException(
                        GraphContractException.REASON_DUPLICATE_NODE_ID,
                        "duplicate node id: " + id
                );
            }
            ids[i] = id;
        }
        return List.of(ids);
    }
}
