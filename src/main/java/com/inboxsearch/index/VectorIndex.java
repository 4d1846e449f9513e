package com.inboxsearch.index;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.inboxsearch.identity.Principal;

/**
 * Similarity index over chunk embeddings. Every operation is scoped to exactly one owner; there is no
 * way to read or modify another owner's vectors through this interface.
 */
public interface VectorIndex {
    /**
     * Stores or replaces the vector for a chunk.
     *
     * @throws DimensionMismatchException when the vector length differs from {@link #dimension()}
     */
    void upsert(Principal owner, UUID chunkId, float[] vector);

    /** Removing an absent chunk is a no-op. */
    void remove(Principal owner, UUID chunkId);

    void removeAll(Principal owner, Collection<UUID> chunkIds);

    /**
     * Returns at most {@code k} chunks with cosine similarity {@code >= similarityThreshold}, ordered by
     * similarity descending and then chunk id ascending.
     */
    List<ScoredChunk> search(Principal owner, float[] queryVector, int k, double similarityThreshold);

    int size(Principal owner);

    int dimension();
}
