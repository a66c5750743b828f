package org.pathrace.graph.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * {@link IDMapper} backed by a fastutil open hash map for the forward lookup and a
 * plain array for the reverse lookup.
 *
 * <p>Immutable once constructed and safe for concurrent reads.</p>
 */
public class FastUtilIDMapper implements IDMapper {

    private final Object2IntOpenHashMap<String> forward;
    // Zero allocation reverse read
    private final String[] reverse;

    /**
     * Builds the mapper from ids in index order.
     *
     * @throws IllegalArgumentException if {@code orderedIds} is null or contains null or duplicate ids.
     */
    public FastUtilIDMapper(List<String> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("Ids cannot be null");
        }
        int size = orderedIds.size();

        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(UNKNOWN);
        this.reverse = new String[size];

        for (int index = 0; index < size; index++) {
            String id = orderedIds.get(index);
            if (id == null) {
                throw new IllegalArgumentException("Null id at index " + index);
            }
            if (forward.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate id detected in input: " + id);
            }
            forward.put(id, index);
            reverse[index] = id;
        }

        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int id = indexOf(externalId);
        if (id == UNKNOWN) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public int indexOf(String externalId) {
        if (externalId == null) {
            return UNKNOWN;
        }
        // getInt avoids boxing
        return forward.getInt(externalId);
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
