package com.inboxsearch.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;

class HttpEmbeddingProviderTest {

    private final HttpEmbeddingProvider provider = new HttpEmbeddingProvider(
            new OkHttpClient(), "http://localhost:1/embeddings", "test-model", null, 2);

    @Test
    void shouldOrderVectorsByResponseIndex() throws Exception {
        String payload = """
                {"data": [
                  {"index": 1, "embedding": [0.5, 0.25]},
                  {"index": 0, "embedding": [1.0, 0.0]}
                ]}
                """;

        List<float[]> vectors = provider.parseVectors(payload, 2);

        assertArrayEquals(new float[] { 1.0f, 0.0f }, vectors.get(0));
        assertArrayEquals(new float[] { 0.5f, 0.25f }, vectors.get(1));
    }

    @Test
    void shouldTreatIncompleteResponseAsTransient() {
        assertThrows(TransientProviderException.class,
                () -> provider.parseVectors("{\"data\": [{\"index\": 0, \"embedding\": [1.0, 0.0]}]}", 2));
        assertThrows(TransientProviderException.class, () -> provider.parseVectors("{\"error\": \"busy\"}", 1));
    }

    @Test
    void shouldTreatAuthenticationAndEndpointErrorsAsUnavailable() {
        for (int code : new int[] { 401, 403, 404 }) {
            AtomicInteger calls = new AtomicInteger();
            HttpEmbeddingProvider failing = providerAnswering(code, calls);
            EmbeddingGateway gateway = new EmbeddingGateway(failing, 2, 8, RetryPolicy.noBackoff(3), 0);

            assertThrows(ProviderUnavailableException.class,
                    () -> gateway.embed(List.of("a", "b", "c", "d", "e", "f", "g", "h")), "HTTP " + code);
            assertEquals(1, calls.get(), "HTTP " + code);
        }
    }

    @Test
    void shouldRejectInputOnClientErrors() {
        for (int code : new int[] { 400, 413, 422 }) {
            HttpEmbeddingProvider failing = providerAnswering(code, new AtomicInteger());

            assertThrows(EmbeddingRejectedException.class, () -> failing.embed(List.of("a")), "HTTP " + code);
        }
    }

    @Test
    void shouldRetryRateLimitsAsTransient() {
        HttpEmbeddingProvider failing = providerAnswering(429, new AtomicInteger());

        assertThrows(TransientProviderException.class, () -> failing.embed(List.of("a")));
    }

    @Test
    void shouldReportModelInVersion() {
        assertEquals("http-test-model", provider.version());
    }

    private static HttpEmbeddingProvider providerAnswering(int code, AtomicInteger calls) {
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    calls.incrementAndGet();
                    return new Response.Builder()
                            .request(chain.request())
                            .protocol(Protocol.HTTP_1_1)
                            .code(code)
                            .message("status " + code)
                            .body(ResponseBody.create("{\"error\": \"status " + code + "\"}", MediaType.parse("application/json")))
                            .build();
                })
                .build();
        return new HttpEmbeddingProvider(client, "http://localhost:1/embeddings", "test-model", "key", 2);
    }
}
