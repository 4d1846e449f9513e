package com.inboxsearch.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.inboxsearch.identity.Principal;
import com.inboxsearch.runtime.ConfigurationException;

class PartitionedVectorIndexTest {
    private final Principal alice = new Principal(UUID.randomUUID());
    private final Principal bob = new Principal(UUID.randomUUID());

    @Test
    void shouldFindStoredVectorWithSimilarityOne() {
        PartitionedVectorIndex index = new PartitionedVectorIndex(3);
        UUID chunk = UUID.randomUUID();
        index.upsert(alice, chunk, new float[] {1f, 2f, 3f});

        List<ScoredChunk> results = index.search(alice, new float[] {2f, 4f, 6f}, 5, 0.0);

        assertEquals(1, results.size());
        assertEquals(chunk, results.get(0).chunkId());
        assertEquals(1.0, results.get(0).similarity(), 1e-6);
    }

    @Test
    void shouldMatchStoredHighDimensionalVectorAtThresholdOne() {
        PartitionedVectorIndex index = new PartitionedVectorIndex(1536);
        Random random = new Random(7);
        for (int n = 0; n < 50; n++) {
            float[] vector = new float[1536];
            for (int d = 0; d < vector.length; d++) {
                vector[d] = (float) random.nextGaussian();
            }
            UUID chunk = UUID.randomUUID();
            index.upsert(alice, chunk, vector);

            List<ScoredChunk> results = index.search(alice, vector, 1, 1.0);

            assertEquals(1, results.size(), "vector " + n);
            assertEquals(chunk, results.get(0).chunkId());
            assertEquals(1.0, results.get(0).similarity());
        }
    }

    @Test
    void shouldNeverReturnAnotherOwnersChunks() {
        PartitionedVectorIndex index = new PartitionedVectorIndex(2);
        UUID aliceChunk = UUID.randomUUID();
        index.upsert(alice, aliceChunk, new float[] {1f, 0f});
        index.upsert(bob, UUID.randomUUID(), new float[] {1f, 0f});

        List<ScoredChunk> results = index.search(alice, new float[] {1f, 0f}, 10, -1.0);

        assertEquals(List.of(aliceChunk), results.stream().map(ScoredChunk::chunkId).toList());
        assertEquals(1, index.size(bob));
        assertTrue(index.search(new Principal(UUID.randomUUID()), new float[] {1f, 0f}, 10, -1.0).isEmpty());
    }

    @Test
    void shouldApplyThresholdAndLimit() {
        PartitionedVectorIndex index = new PartitionedVectorIndex(2);
        UUID exact = UUID.randomUUID();
        UUID close = UUID.randomUUID();
        UUID opposite = UUID.randomUUID();
        index.upsert(alice, exact, new float[] {1f, 0f});
        index.upsert(alice, close, new float[] {1f, 0.2f});
        index.upsert(alice, opposite, new float[] {-1f, 0f});

        List<ScoredChunk> aboveZero = index.search(alice, new float[] {1f, 0f}, 10, 0.5);
        assertEquals(List.of(exact, close), aboveZero.stream().map(ScoredChunk::chunkId).toList());

        List<ScoredChunk> topOne = index.search(alice, new float[] {1f, 0f}, 1, -1.0);
        assertEquals(List.of(exact), topOne.stream().map(ScoredChunk::chunkId).toList());

        assertTrue(index.search(alice, new float[] {1f, 0f}, 0, -1.0).isEmpty());
        assertEquals(3, index.search(alice, new float[] {1f, 0f}, 10, -1.0).size());
    }

    @Test
    void shouldBreakTiesByChunkId() {
        PartitionedVectorIndex index = new PartitionedVectorIndex(2);
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            UUID id = UUID.randomUUID();
            ids.add(id);
            index.upsert(alice, id, new float[] {0f, 3f});
        }
        ids.sort((left, right) -> left.toString().compareTo(right.toString()));

        List<ScoredChunk> results = index.search(alice, new float[] {0f, 1f}, 5, 0.0);

        assertEquals(ids, results.stream().map(ScoredChunk::chunkId).toList());
    }

    @Test
    void shouldRejectWrongDimensionAndInvalidArguments() {
        PartitionedVectorIndex index = new PartitionedVectorIndex(3);

        assertThrows(DimensionMismatchException.class, () -> index.upsert(alice, UUID.randomUUID(), new float[] {1f, 0f}));
        assertThrows(DimensionMismatchException.class, () -> index.search(alice, new float[] {1f}, 1, 0.0));
        assertThrows(ConfigurationException.class, () -> index.search(alice, new float[] {1f, 0f, 0f}, -1, 0.0));
        assertThrows(ConfigurationException.class, () -> index.search(alice, new float[] {1f, 0f, 0f}, 1, Double.NaN));
        assertThrows(ConfigurationException.class, () -> new PartitionedVectorIndex(0));
    }

    @Test
    void shouldReplaceOnUpsertAndIgnoreUnknownRemovals() {
        PartitionedVectorIndex index = new PartitionedVectorIndex(2);
        UUID chunk = UUID.randomUUID();
        index.upsert(alice, chunk, new float[] {1f, 0f});
        index.upsert(alice, chunk, new float[] {0f, 1f});

        assertEquals(1, index.size(alice));
        assertEquals(1.0, index.search(alice, new float[] {0f, 1f}, 1, 0.0).get(0).similarity(), 1e-6);

        index.remove(alice, UUID.randomUUID());
        index.remove(bob, chunk);
        assertEquals(1, index.size(alice));

        index.remove(alice, chunk);
        index.remove(alice, chunk);
        assertEquals(0, index.size(alice));
    }

    @Test
    void shouldSwitchToClusteredSearchForLargePartitions() {
        PartitionedVectorIndex index = new PartitionedVectorIndex(16, new IndexOptions(50, 8, 2, 2.0));
        Random random = new Random(42);
        List<UUID> ids = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            float[] vector = new float[16];
            for (int d = 0; d < vector.length; d++) {
                vector[d] = (float) random.nextGaussian();
            }
            UUID id = UUID.randomUUID();
            ids.add(id);
            vectors.add(vector);
            index.upsert(alice, id, vector);
        }

        assertTrue(index.usesApproximateSearch(alice));
        for (int i = 0; i < ids.size(); i += 17) {
            List<ScoredChunk> results = index.search(alice, vectors.get(i), 1, 0.99);
            assertEquals(ids.get(i), results.get(0).chunkId());
        }

        // asking for more results than the nearest lists hold falls back to a full scan
        assertEquals(200, index.search(alice, vectors.get(0), 500, -1.0).size());
        assertFalse(index.usesApproximateSearch(bob));
    }

    @Test
    void shouldIsolateConcurrentWritersPerOwner() throws Exception {
        PartitionedVectorIndex index = new PartitionedVectorIndex(4);
        List<Principal> owners = List.of(alice, bob, new Principal(UUID.randomUUID()), new Principal(UUID.randomUUID()));
        ExecutorService executor = Executors.newFixedThreadPool(owners.size());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Principal owner : owners) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 250; i++) {
                        index.upsert(owner, UUID.randomUUID(), new float[] {1f, i, 0f, 1f});
                        index.search(owner, new float[] {1f, 0f, 0f, 0f}, 3, 0.0);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (Principal owner : owners) {
            assertEquals(250, index.size(owner));
        }
    }
}
