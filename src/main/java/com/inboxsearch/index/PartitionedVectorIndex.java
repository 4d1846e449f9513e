package com.inboxsearch.index;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.inboxsearch.identity.Principal;
import com.inboxsearch.runtime.ConfigurationException;

/**
 * In-memory vector index with one physically separate partition per owner. Small partitions are
 * searched exhaustively, large ones through IVF clustering; both paths return the same contract.
 */
public class PartitionedVectorIndex implements VectorIndex {
    private final int dimension;
    private final IndexOptions options;
    private final Map<Principal, OwnerPartition> partitions = new ConcurrentHashMap<>();

    public PartitionedVectorIndex(int dimension) {
        this(dimension, IndexOptions.defaults());
    }

    public PartitionedVectorIndex(int dimension, IndexOptions options) {
        if (dimension <= 0) {
            throw new ConfigurationException("index dimension must be > 0");
        }
        this.dimension = dimension;
        this.options = options;
    }

    @Override
    public void upsert(Principal owner, UUID chunkId, float[] vector) {
        requireOwner(owner);
        checkDimension(vector);
        partitions.computeIfAbsent(owner, unused -> new OwnerPartition(options)).upsert(chunkId, vector);
    }

    @Override
    public void remove(Principal owner, UUID chunkId) {
        removeAll(owner, List.of(chunkId));
    }

    @Override
    public void removeAll(Principal owner, Collection<UUID> chunkIds) {
        requireOwner(owner);
        OwnerPartition partition = partitions.get(owner);
        if (partition != null && !chunkIds.isEmpty()) {
            partition.removeAll(chunkIds);
        }
    }

    @Override
    public List<ScoredChunk> search(Principal owner, float[] queryVector, int k, double similarityThreshold) {
        requireOwner(owner);
        checkDimension(queryVector);
        if (k < 0) {
            throw new ConfigurationException("k must be >= 0");
        }
        if (Double.isNaN(similarityThreshold)) {
            throw new ConfigurationException("similarity threshold must be a number");
        }
        OwnerPartition partition = partitions.get(owner);
        if (partition == null || k == 0) {
            return List.of();
        }
        return partition.search(queryVector, k, similarityThreshold);
    }

    @Override
    public int size(Principal owner) {
        requireOwner(owner);
        OwnerPartition partition = partitions.get(owner);
        return partition == null ? 0 : partition.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    boolean usesApproximateSearch(Principal owner) {
        OwnerPartition partition = partitions.get(owner);
        return partition != null && partition.usesApproximateSearch();
    }

    private void checkDimension(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector == null ? 0 : vector.length);
        }
    }

    private static void requireOwner(Principal owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner is required");
        }
    }
}
