package org.pathrace.graph.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between external node ids and dense internal indices.
 *
 * <p>Traversal state is kept in index space; snapshots and results translate
 * back to external ids.</p>
 */
public interface IDMapper {

    /** Sentinel returned by {@link #indexOf(String)} for unknown ids. */
    int UNKNOWN = -1;

    /**
     * Converts an external id to its internal index.
     *
     * @param externalId node id as supplied by the graph.
     * @return the internal index.
     * @throws UnknownIDException if the id is not mapped.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an external id to its internal index without throwing.
     *
     * @param externalId node id, may be {@code null}.
     * @return the internal index, or {@link #UNKNOWN}.
     */
    int indexOf(String externalId);

    /**
     * Converts an internal index back to the external id.
     *
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    String toExternal(int internalId);

    boolean containsExternal(String externalId);

    boolean containsInternal(int internalId);

    int size();

    /**
     * Exception thrown when an external id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable mapper where each id maps to its list position.
     *
     * @param orderedIds external ids in dense index order; must be unique.
     * @return an immutable mapper.
     */
    static IDMapper createImmutable(List<String> orderedIds) {
        return new FastUtilIDMapper(orderedIds);
    }
}
