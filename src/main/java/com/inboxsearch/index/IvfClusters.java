package com.inboxsearch.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Inverted-file clustering over unit vectors (spherical k-means). Not thread-safe; the owning
 * partition guards it.
 */
final class IvfClusters {
    private static final int TRAINING_ROUNDS = 8;

    private final float[][] centroids;
    private final List<Set<UUID>> lists;
    private final Map<UUID, Integer> assignments = new HashMap<>();
    private final int trainedSize;

    private IvfClusters(float[][] centroids, int trainedSize) {
        this.centroids = centroids;
        this.trainedSize = trainedSize;
        this.lists = new ArrayList<>(centroids.length);
        for (int i = 0; i < centroids.length; i++) {
            lists.add(new LinkedHashSet<>());
        }
    }

    static IvfClusters train(Map<UUID, float[]> vectors, int maxLists) {
        List<UUID> ids = new ArrayList<>(vectors.keySet());
        ids.sort(Comparator.comparing(UUID::toString));
        int listCount = Math.max(1, Math.min(maxLists, (int) Math.sqrt(ids.size())));

        float[][] centroids = new float[listCount][];
        for (int i = 0; i < listCount; i++) {
            centroids[i] = vectors.get(ids.get((int) ((long) i * ids.size() / listCount))).clone();
        }

        int dimension = centroids[0].length;
        for (int round = 0; round < TRAINING_ROUNDS; round++) {
            double[][] sums = new double[listCount][dimension];
            int[] counts = new int[listCount];
            for (UUID id : ids) {
                float[] vector = vectors.get(id);
                int nearest = nearest(centroids, vector);
                counts[nearest]++;
                for (int d = 0; d < dimension; d++) {
                    sums[nearest][d] += vector[d];
                }
            }
            for (int c = 0; c < listCount; c++) {
                if (counts[c] == 0) {
                    continue;
                }
                float[] mean = new float[dimension];
                for (int d = 0; d < dimension; d++) {
                    mean[d] = (float) (sums[c][d] / counts[c]);
                }
                centroids[c] = VectorMath.normalized(mean);
            }
        }

        IvfClusters clusters = new IvfClusters(centroids, ids.size());
        for (UUID id : ids) {
            clusters.assign(id, vectors.get(id));
        }
        return clusters;
    }

    void assign(UUID id, float[] unitVector) {
        remove(id);
        int nearest = nearest(centroids, unitVector);
        lists.get(nearest).add(id);
        assignments.put(id, nearest);
    }

    void remove(UUID id) {
        Integer list = assignments.remove(id);
        if (list != null) {
            lists.get(list).remove(id);
        }
    }

    Set<UUID> candidates(float[] unitQuery, int probes) {
        List<Integer> order = new ArrayList<>(centroids.length);
        for (int i = 0; i < centroids.length; i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer c) -> VectorMath.dot(centroids[c], unitQuery)).reversed()
                .thenComparing(c -> c));
        Set<UUID> candidates = new LinkedHashSet<>();
        for (int i = 0; i < Math.min(probes, order.size()); i++) {
            candidates.addAll(lists.get(order.get(i)));
        }
        return candidates;
    }

    int trainedSize() {
        return trainedSize;
    }

    int listCount() {
        return centroids.length;
    }

    private static int nearest(float[][] centroids, float[] vector) {
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double score = VectorMath.dot(centroids[c], vector);
            if (score > bestScore) {
                bestScore = score;
                best = c;
            }
        }
        return best;
    }
}
