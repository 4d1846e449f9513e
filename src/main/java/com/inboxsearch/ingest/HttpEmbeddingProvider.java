package com.inboxsearch.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * OpenAI-compatible {@code /embeddings} endpoint: {@code {"model", "input": [...]}} in,
 * {@code {"data": [{"index", "embedding"}]}} out.
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public HttpEmbeddingProvider(OkHttpClient httpClient, String endpoint, String model, String apiKey, int dimension) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        Request request = buildRequest(texts);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body == null ? "" : body.string();
            int code = response.code();
            if (code == 408 || code == 429 || code >= 500) {
                throw new TransientProviderException("embedding provider returned HTTP " + code);
            }
            // credentials or endpoint are wrong; no input is at fault, so the chunks must stay pending
            if (code == 401 || code == 403 || code == 404) {
                throw new ProviderUnavailableException("embedding provider refused the request: HTTP " + code);
            }
            if (!response.isSuccessful()) {
                throw new EmbeddingRejectedException("embedding provider rejected input: HTTP " + code + " " + abbreviate(payload));
            }
            return parseVectors(payload, texts.size());
        } catch (IOException e) {
            throw new TransientProviderException("embedding provider call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "http-" + model;
    }

    List<float[]> parseVectors(String payload, int expected) throws IOException {
        JsonNode data = mapper.readTree(payload).path("data");
        if (!data.isArray()) {
            throw new TransientProviderException("embedding response has no data array");
        }
        List<float[]> vectors = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            vectors.add(null);
        }
        for (int position = 0; position < data.size(); position++) {
            JsonNode item = data.get(position);
            int index = item.path("index").asInt(position);
            JsonNode vectorNode = item.path("embedding");
            if (index < 0 || index >= expected || !vectorNode.isArray()) {
                throw new TransientProviderException("malformed embedding entry at position " + position);
            }
            float[] vector = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
            vectors.set(index, vector);
        }
        if (vectors.contains(null)) {
            throw new TransientProviderException("embedding response is missing entries");
        }
        return vectors;
    }

    private Request buildRequest(List<String> texts) {
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "input", texts));
            Request.Builder builder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            return builder.build();
        } catch (IOException e) {
            throw new EmbeddingRejectedException("input could not be serialized: " + e.getMessage());
        }
    }

    private static String abbreviate(String value) {
        return value.length() > 200 ? value.substring(0, 200) + "..." : value;
    }
}
