package com.inboxsearch.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

public record Chunk(
        UUID id,
        UUID ownerId,
        UUID messageId,
        int chunkIndex,
        String content,
        float[] embedding,
        EmbeddingState embeddingState,
        String embeddingError,
        Instant createdAt,
        Instant updatedAt) {

    public Chunk {
        if ((embedding != null) != (embeddingState == EmbeddingState.EMBEDDED)) {
            throw new IllegalArgumentException("embedding must be present iff state is EMBEDDED, state=" + embeddingState);
        }
    }

    public static UUID idFor(UUID messageId, int chunkIndex) {
        return UUID.nameUUIDFromBytes((messageId + "#" + chunkIndex).getBytes(StandardCharsets.UTF_8));
    }

    public Chunk withEmbedding(float[] vector, Instant now) {
        return new Chunk(id, ownerId, messageId, chunkIndex, content, vector, EmbeddingState.EMBEDDED, null, createdAt, now);
    }

    public Chunk withoutEmbedding(EmbeddingState state, String error, Instant now) {
        return new Chunk(id, ownerId, messageId, chunkIndex, content, null, state, error, createdAt, now);
    }
}
