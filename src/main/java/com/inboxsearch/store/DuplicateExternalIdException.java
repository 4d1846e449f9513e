package com.inboxsearch.store;

import java.util.UUID;

public class DuplicateExternalIdException extends RuntimeException {
    private final UUID existingMessageId;

    public DuplicateExternalIdException(String dedupKey, UUID existingMessageId) {
        super("message already stored for key " + dedupKey);
        this.existingMessageId = existingMessageId;
    }

    public UUID existingMessageId() {
        return existingMessageId;
    }
}
