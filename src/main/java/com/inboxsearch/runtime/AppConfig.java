package com.inboxsearch.runtime;

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IndexConfig index = new IndexConfig();
    private SyncConfig sync = new SyncConfig();
    private SearchConfig search = new SearchConfig();
    private IdentityConfig identity = new IdentityConfig();
    private StorageConfig storage = new StorageConfig();

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync == null ? new SyncConfig() : sync;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public IdentityConfig getIdentity() {
        return identity;
    }

    public void setIdentity(IdentityConfig identity) {
        this.identity = identity == null ? new IdentityConfig() : identity;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public AppConfig validate() {
        if (chunking.getOverlapChars() < 0 || chunking.getMaxChunkChars() <= chunking.getOverlapChars()) {
            throw new ConfigurationException("chunking requires maxChunkChars > overlapChars >= 0");
        }
        if (chunking.getBoundaryLookback() < 0) {
            throw new ConfigurationException("chunking.boundaryLookback must be >= 0");
        }
        if (embedding.getDimension() <= 0 || embedding.getBatchSize() <= 0) {
            throw new ConfigurationException("embedding dimension and batchSize must be > 0");
        }
        if (embedding.getMaxAttempts() < 1 || embedding.getInitialBackoffMs() < 0
                || embedding.getMaxBackoffMs() < embedding.getInitialBackoffMs()) {
            throw new ConfigurationException("embedding retry settings are invalid");
        }
        if (index.getExactSearchThreshold() < 0 || index.getLists() < 1 || index.getProbes() < 1
                || index.getRetrainGrowthFactor() <= 1.0) {
            throw new ConfigurationException("index settings are invalid");
        }
        if (sync.getFetchMaxAttempts() < 1 || sync.getParallelism() < 1 || sync.getPendingReembedLimit() < 0
                || sync.getPageSize() < 1) {
            throw new ConfigurationException("sync settings are invalid");
        }
        if (search.getDefaultMatchCount() < 1) {
            throw new ConfigurationException("search.defaultMatchCount must be >= 1");
        }
        return this;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxChunkChars = 800;
        private int overlapChars = 100;
        private int boundaryLookback = 120;

        public int getMaxChunkChars() {
            return maxChunkChars;
        }

        public void setMaxChunkChars(int maxChunkChars) {
            this.maxChunkChars = maxChunkChars;
        }

        public int getOverlapChars() {
            return overlapChars;
        }

        public void setOverlapChars(int overlapChars) {
            this.overlapChars = overlapChars;
        }

        public int getBoundaryLookback() {
            return boundaryLookback;
        }

        public void setBoundaryLookback(int boundaryLookback) {
            this.boundaryLookback = boundaryLookback;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "hashing";
        private String endpoint;
        private String model = "text-embedding-3-small";
        private String apiKeyEnv = "INBOXSEARCH_EMBEDDING_API_KEY";
        private int dimension = 1536;
        private int batchSize = 64;
        private int maxAttempts = 4;
        private long initialBackoffMs = 250;
        private long maxBackoffMs = 8000;
        private long callTimeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private int exactSearchThreshold = 2000;
        private int lists = 100;
        private int probes = 10;
        private double retrainGrowthFactor = 2.0;

        public int getExactSearchThreshold() {
            return exactSearchThreshold;
        }

        public void setExactSearchThreshold(int exactSearchThreshold) {
            this.exactSearchThreshold = exactSearchThreshold;
        }

        public int getLists() {
            return lists;
        }

        public void setLists(int lists) {
            this.lists = lists;
        }

        public int getProbes() {
            return probes;
        }

        public void setProbes(int probes) {
            this.probes = probes;
        }

        public double getRetrainGrowthFactor() {
            return retrainGrowthFactor;
        }

        public void setRetrainGrowthFactor(double retrainGrowthFactor) {
            this.retrainGrowthFactor = retrainGrowthFactor;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfig {
        private long fetchTimeoutMs = 30000;
        private int fetchMaxAttempts = 3;
        private int parallelism = 4;
        private int pendingReembedLimit = 256;
        private int pageSize = 50;

        public long getFetchTimeoutMs() {
            return fetchTimeoutMs;
        }

        public void setFetchTimeoutMs(long fetchTimeoutMs) {
            this.fetchTimeoutMs = fetchTimeoutMs;
        }

        public int getFetchMaxAttempts() {
            return fetchMaxAttempts;
        }

        public void setFetchMaxAttempts(int fetchMaxAttempts) {
            this.fetchMaxAttempts = fetchMaxAttempts;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public int getPendingReembedLimit() {
            return pendingReembedLimit;
        }

        public void setPendingReembedLimit(int pendingReembedLimit) {
            this.pendingReembedLimit = pendingReembedLimit;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int defaultMatchCount = 10;
        private double defaultSimilarityThreshold = 0.7;

        public int getDefaultMatchCount() {
            return defaultMatchCount;
        }

        public void setDefaultMatchCount(int defaultMatchCount) {
            this.defaultMatchCount = defaultMatchCount;
        }

        public double getDefaultSimilarityThreshold() {
            return defaultSimilarityThreshold;
        }

        public void setDefaultSimilarityThreshold(double defaultSimilarityThreshold) {
            this.defaultSimilarityThreshold = defaultSimilarityThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IdentityConfig {
        private Map<String, String> tokens = new HashMap<>();

        public Map<String, String> getTokens() {
            return tokens;
        }

        public void setTokens(Map<String, String> tokens) {
            this.tokens = tokens == null ? new HashMap<>() : tokens;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String dataDir = ".inboxsearch";
        private String sourceDir = ".inboxsearch/sources";

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public String getSourceDir() {
            return sourceDir;
        }

        public void setSourceDir(String sourceDir) {
            this.sourceDir = sourceDir;
        }
    }
}
