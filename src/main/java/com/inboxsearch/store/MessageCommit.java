package com.inboxsearch.store;

import java.util.List;
import java.util.Objects;

import com.inboxsearch.model.Chunk;
import com.inboxsearch.model.Message;

/**
 * A message ready to be stored. The message's conversation id is assigned by the store from
 * {@code conversationExternalId}.
 */
public record MessageCommit(
        String conversationExternalId,
        String conversationTitle,
        List<String> participants,
        Message message,
        List<Chunk> chunks) {

    public MessageCommit {
        if (conversationExternalId == null || conversationExternalId.isBlank()) {
            throw new IllegalArgumentException("conversationExternalId is required");
        }
        participants = participants == null ? List.of() : participants.stream().filter(Objects::nonNull).toList();
        chunks = List.copyOf(chunks);
    }
}
