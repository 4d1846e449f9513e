package com.inboxsearch.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record Conversation(
        UUID id,
        UUID ownerId,
        String externalId,
        String title,
        List<String> participants,
        Instant lastActivityAt,
        Instant createdAt,
        Instant updatedAt) {

    public Conversation {
        participants = participants == null ? List.of() : participants.stream().filter(Objects::nonNull).toList();
    }

    public Conversation touch(String newTitle, List<String> newParticipants, Instant activityAt, Instant now) {
        Instant latest = lastActivityAt;
        if (activityAt != null && (latest == null || activityAt.isAfter(latest))) {
            latest = activityAt;
        }
        return new Conversation(
                id,
                ownerId,
                externalId,
                newTitle == null || newTitle.isBlank() ? title : newTitle,
                newParticipants == null || newParticipants.isEmpty() ? participants : newParticipants,
                latest,
                createdAt,
                now);
    }
}
