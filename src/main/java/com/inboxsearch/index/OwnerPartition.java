package com.inboxsearch.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One owner's vectors. Writes take the write lock, so a concurrent search sees an upsert either
 * completely or not at all.
 */
final class OwnerPartition {
    private static final Logger log = LoggerFactory.getLogger(OwnerPartition.class);

    private final IndexOptions options;
    private final Map<UUID, float[]> vectors = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private IvfClusters clusters;

    OwnerPartition(IndexOptions options) {
        this.options = options;
    }

    void upsert(UUID chunkId, float[] vector) {
        float[] unit = VectorMath.normalized(vector);
        lock.writeLock().lock();
        try {
            vectors.put(chunkId, unit);
            if (needsTraining()) {
                clusters = IvfClusters.train(vectors, options.lists());
                log.debug("index.ivf.trained size={} lists={}", vectors.size(), clusters.listCount());
            } else if (clusters != null) {
                clusters.assign(chunkId, unit);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    void removeAll(Collection<UUID> chunkIds) {
        lock.writeLock().lock();
        try {
            for (UUID chunkId : chunkIds) {
                if (vectors.remove(chunkId) != null && clusters != null) {
                    clusters.remove(chunkId);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    List<ScoredChunk> search(float[] queryVector, int k, double similarityThreshold) {
        float[] unitQuery = VectorMath.normalized(queryVector);
        lock.readLock().lock();
        try {
            Collection<UUID> candidates = candidateIds(unitQuery, k);
            List<ScoredChunk> matches = new ArrayList<>();
            for (UUID chunkId : candidates) {
                double similarity = VectorMath.similarity(unitQuery, vectors.get(chunkId));
                if (similarity >= similarityThreshold) {
                    matches.add(new ScoredChunk(chunkId, similarity));
                }
            }
            matches.sort(ScoredChunk.RANKING);
            return matches.size() > k ? List.copyOf(matches.subList(0, k)) : List.copyOf(matches);
        } finally {
            lock.readLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return vectors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean usesApproximateSearch() {
        lock.readLock().lock();
        try {
            return clusters != null && vectors.size() >= options.exactSearchThreshold();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Collection<UUID> candidateIds(float[] unitQuery, int k) {
        if (clusters == null || vectors.size() < options.exactSearchThreshold()) {
            return vectors.keySet();
        }
        Collection<UUID> probed = clusters.candidates(unitQuery, options.probes());
        if (probed.size() < k) {
            return vectors.keySet();
        }
        return probed;
    }

    private boolean needsTraining() {
        if (vectors.size() < Math.max(1, options.exactSearchThreshold())) {
            return false;
        }
        return clusters == null || vectors.size() >= clusters.trainedSize() * options.retrainGrowthFactor();
    }
}
