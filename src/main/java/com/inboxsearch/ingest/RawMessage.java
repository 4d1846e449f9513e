package com.inboxsearch.ingest;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A message as delivered by a source. {@code cursor}, when present, is the position just after this
 * message and lets a sync resume mid-page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawMessage(
        String externalId,
        String conversationExternalId,
        String conversationTitle,
        List<String> participants,
        String senderId,
        Instant sentAt,
        String body,
        Map<String, Object> metadata,
        String cursor) {

    public RawMessage {
        participants = participants == null ? List.of() : participants.stream().filter(Objects::nonNull).toList();
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
