package com.inboxsearch.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A stored message. {@code dedupKey} equals {@code externalId} when the source supplies one,
 * otherwise it is a content fingerprint.
 */
public record Message(
        UUID id,
        UUID ownerId,
        UUID conversationId,
        String externalId,
        String dedupKey,
        String senderId,
        Instant sentAt,
        String body,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt) {

    public Message {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
