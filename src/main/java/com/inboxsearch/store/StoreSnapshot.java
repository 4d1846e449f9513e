package com.inboxsearch.store;

import java.util.List;

import com.inboxsearch.model.Chunk;
import com.inboxsearch.model.Conversation;
import com.inboxsearch.model.Message;

public record StoreSnapshot(List<Conversation> conversations, List<Message> messages, List<Chunk> chunks) {
    public StoreSnapshot {
        conversations = conversations == null ? List.of() : conversations;
        messages = messages == null ? List.of() : messages;
        chunks = chunks == null ? List.of() : chunks;
    }
}
