package com.inboxsearch.ingest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.inboxsearch.runtime.AppConfig;
import com.inboxsearch.runtime.ConfigurationException;

/**
 * Batches texts into provider calls, retries transient failures and isolates permanently rejected items.
 *
 * <p>The result list is aligned with the input. Either every position carries an outcome, or the call
 * fails as a whole with {@link ProviderUnavailableException}.</p>
 */
public class EmbeddingGateway implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final EmbeddingProvider provider;
    private final int dimension;
    private final int batchSize;
    private final RetryPolicy retryPolicy;
    private final long callTimeoutMs;
    private final ExecutorService callExecutor;

    public EmbeddingGateway(EmbeddingProvider provider, int dimension, int batchSize, RetryPolicy retryPolicy, long callTimeoutMs) {
        if (dimension <= 0 || batchSize <= 0) {
            throw new ConfigurationException("embedding dimension and batch size must be > 0");
        }
        this.provider = provider;
        this.dimension = dimension;
        this.batchSize = batchSize;
        this.retryPolicy = retryPolicy;
        this.callTimeoutMs = callTimeoutMs;
        this.callExecutor = callTimeoutMs > 0 ? TimeLimitedCall.daemonExecutor("embedding-call") : null;
    }

    public static EmbeddingGateway fromConfig(EmbeddingProvider provider, AppConfig.EmbeddingConfig config) {
        RetryPolicy retryPolicy = new RetryPolicy(config.getMaxAttempts(), config.getInitialBackoffMs(), config.getMaxBackoffMs());
        return new EmbeddingGateway(provider, config.getDimension(), config.getBatchSize(), retryPolicy, config.getCallTimeoutMs());
    }

    public List<EmbeddingOutcome> embed(List<String> texts) {
        EmbeddingOutcome[] outcomes = new EmbeddingOutcome[texts.size()];
        for (int start = 0; start < texts.size(); start += batchSize) {
            int end = Math.min(texts.size(), start + batchSize);
            embedRange(texts, start, end, outcomes);
        }
        return Arrays.asList(outcomes);
    }

    public float[] embedQuery(String text) {
        EmbeddingOutcome outcome = embed(List.of(text)).get(0);
        if (!outcome.isEmbedded()) {
            throw new EmbeddingRejectedException("query text rejected: " + outcome.error(), 0);
        }
        return outcome.vector();
    }

    public int dimension() {
        return dimension;
    }

    public String providerVersion() {
        return provider.version();
    }

    private void embedRange(List<String> texts, int start, int end, EmbeddingOutcome[] outcomes) {
        if (start >= end) {
            return;
        }
        List<String> batch = new ArrayList<>(texts.subList(start, end));
        try {
            List<float[]> vectors = retryPolicy.execute("embedding", () -> callProvider(batch));
            for (int i = 0; i < vectors.size(); i++) {
                outcomes[start + i] = checkDimension(vectors.get(i), start + i);
            }
        } catch (EmbeddingRejectedException e) {
            if (batch.size() == 1) {
                log.warn("embedding.rejected position={} reason={}", start, e.getMessage());
                outcomes[start] = EmbeddingOutcome.rejected(e.getMessage());
                return;
            }
            int offending = e.itemIndex();
            if (offending >= 0 && offending < batch.size()) {
                log.warn("embedding.rejected position={} reason={}", start + offending, e.getMessage());
                outcomes[start + offending] = EmbeddingOutcome.rejected(e.getMessage());
                embedRange(texts, start, start + offending, outcomes);
                embedRange(texts, start + offending + 1, end, outcomes);
                return;
            }
            int middle = start + (end - start) / 2;
            log.debug("embedding.bisect start={} end={} reason={}", start, end, e.getMessage());
            embedRange(texts, start, middle, outcomes);
            embedRange(texts, middle, end, outcomes);
        }
    }

    private List<float[]> callProvider(List<String> batch) {
        List<float[]> vectors = TimeLimitedCall.call(callExecutor, callTimeoutMs, "embedding", () -> provider.embed(batch));
        if (vectors == null || vectors.size() != batch.size()) {
            throw new TransientProviderException("provider returned %d vectors for %d inputs"
                    .formatted(vectors == null ? 0 : vectors.size(), batch.size()));
        }
        return vectors;
    }

    private EmbeddingOutcome checkDimension(float[] vector, int position) {
        if (vector == null || vector.length != dimension) {
            String reason = "dimension mismatch: expected %d, got %d".formatted(dimension, vector == null ? 0 : vector.length);
            log.warn("embedding.rejected position={} reason={}", position, reason);
            return EmbeddingOutcome.rejected(reason);
        }
        return EmbeddingOutcome.embedded(vector);
    }

    @Override
    public void close() {
        if (callExecutor != null) {
            callExecutor.shutdownNow();
        }
    }
}
