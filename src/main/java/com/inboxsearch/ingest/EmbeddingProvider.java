package com.inboxsearch.ingest;

import java.util.List;

/**
 * Remote or local text embedding model. Implementations signal retryable failures with
 * {@link TransientProviderException} and inputs the model refuses with {@link EmbeddingRejectedException}.
 */
public interface EmbeddingProvider {
    List<float[]> embed(List<String> texts);

    int dimension();

    default String version() {
        return "unversioned";
    }
}
