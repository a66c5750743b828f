package org.pathrace.traversal;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.experimental.UtilityClass;
import org.pathrace.graph.id.IDMapper;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds start-to-node paths from parent links.
 *
 * <p>Both forms walk backward from the queried node until the start or a missing
 * parent, and return the path only when it begins at the start. A parent chain that
 * loops back on itself also yields an empty path.</p>
 */
@UtilityClass
public class PathReconstructor {
    /** Parent marker for "no parent" in index space. */
    public static final int NO_PARENT = -1;

    /**
     * Reconstructs a path from an external-id parent map.
     *
     * @param parents child id to parent id; absent or {@code null} means no parent.
     * @param startId traversal start id.
     * @param nodeId queried node id.
     * @return path from {@code startId} to {@code nodeId}, or an empty list.
     */
    public static List<String> reconstruct(Map<String, String> parents, String startId, String nodeId) {
        Objects.requireNonNull(parents, "parents");
        Objects.requireNonNull(startId, "startId");
        Objects.requireNonNull(nodeId, "nodeId");

        ObjectArrayList<String> reversed = new ObjectArrayList<>();
        ObjectOpenHashSet<String> seen = new ObjectOpenHashSet<>();
        String current = nodeId;
        while (current != null) {
            if (!seen.add(current)) {
                return List.of();
            }
            reversed.add(current);
            if (current.equals(startId)) {
                break;
            }
            current = parents.get(current);
        }
        return finish(reversed, startId);
    }

    /**
     * Reconstructs a path from an index-space parent array.
     *
     * @param parents parent index per node, {@link #NO_PARENT} when none.
     * @param startIndex traversal start index.
     * @param nodeIndex queried node index.
     * @param ids mapper used to translate indices back to external ids.
     * @return path of external ids from start to node, or an empty list.
     */
    public static List<String> reconstruct(int[] parents, int startIndex, int nodeIndex, IDMapper ids) {
        Objects.requireNonNull(parents, "parents");
        Objects.requireNonNull(ids, "ids");
        if (nodeIndex < 0 || nodeIndex >= parents.length || startIndex < 0 || startIndex >= parents.length) {
            return List.of();
        }

        ObjectArrayList<String> reversed = new ObjectArrayList<>();
        int current = nodeIndex;
        // A valid chain visits each node at most once.
        int budget = parents.length;
        while (current != NO_PARENT) {
            if (budget-- == 0) {
                return List.of();
            }
            reversed.add(ids.toExternal(current));
            if (current == startIndex) {
                break;
            }
            current = parents[current];
        }
        return finish(reversed, ids.toExternal(startIndex));
    }

    private static List<String> finish(ObjectArrayList<String> reversed, String startId) {
        if (reversed.isEmpty() || !reversed.get(reversed.size() - 1).equals(startId)) {
            return List.of();
        }
        Collections.reverse(reversed);
        return List.copyOf(reversed);
    }
}
