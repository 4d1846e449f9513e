package com.inboxsearch.ingest;

public record EmbeddingOutcome(float[] vector, String error) {
    public static EmbeddingOutcome embedded(float[] vector) {
        return new EmbeddingOutcome(vector, null);
    }

    public static EmbeddingOutcome rejected(String error) {
        return new EmbeddingOutcome(null, error);
    }

    public boolean isEmbedded() {
        return vector != null;
    }
}
