package com.inboxsearch.ingest;

import java.time.Duration;
import java.util.Locale;

import com.inboxsearch.runtime.AppConfig;
import com.inboxsearch.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String provider = config.getProvider() == null ? "hashing" : config.getProvider().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "hashing":
                return new HashingEmbeddingProvider(config.getDimension());
            case "http":
                if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
                    throw new ConfigurationException("embedding.endpoint is required for the http provider");
                }
                String apiKey = config.getApiKeyEnv() == null ? null : System.getenv(config.getApiKeyEnv());
                OkHttpClient client = httpClient.newBuilder()
                        .callTimeout(Duration.ofMillis(Math.max(0, config.getCallTimeoutMs())))
                        .build();
                return new HttpEmbeddingProvider(client, config.getEndpoint(), config.getModel(), apiKey, config.getDimension());
            default:
                throw new ConfigurationException("unknown embedding provider: " + config.getProvider());
        }
    }
}
