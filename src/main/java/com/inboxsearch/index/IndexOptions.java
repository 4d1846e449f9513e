package com.inboxsearch.index;

import com.inboxsearch.runtime.AppConfig;
import com.inboxsearch.runtime.ConfigurationException;

/**
 * Partitions smaller than {@code exactSearchThreshold} are scanned exhaustively; larger ones are
 * clustered into at most {@code lists} inverted lists and searched by probing the {@code probes}
 * closest centroids. Clusters are retrained once a partition grows by {@code retrainGrowthFactor}.
 */
public record IndexOptions(int exactSearchThreshold, int lists, int probes, double retrainGrowthFactor) {
    public IndexOptions {
        if (exactSearchThreshold < 0 || lists < 1 || probes < 1 || retrainGrowthFactor <= 1.0) {
            throw new ConfigurationException("invalid index options: threshold=%d lists=%d probes=%d growth=%s"
                    .formatted(exactSearchThreshold, lists, probes, retrainGrowthFactor));
        }
    }

    public static IndexOptions defaults() {
        return new IndexOptions(2000, 100, 10, 2.0);
    }

    public static IndexOptions fromConfig(AppConfig.IndexConfig config) {
        return new IndexOptions(config.getExactSearchThreshold(), config.getLists(), config.getProbes(), config.getRetrainGrowthFactor());
    }
}
