package com.inboxsearch.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.inboxsearch.identity.Principal;
import com.inboxsearch.model.Chunk;
import com.inboxsearch.model.Conversation;
import com.inboxsearch.model.EmbeddingState;
import com.inboxsearch.model.Message;

/**
 * Owner-scoped persistence for conversations, messages and chunks. Ids that belong to a different
 * owner behave exactly like ids that do not exist.
 */
public interface MessageStore {
    Optional<Message> findMessageByDedupKey(Principal owner, String dedupKey);

    Optional<Message> findMessage(Principal owner, UUID messageId);

    Optional<Conversation> findConversation(Principal owner, UUID conversationId);

    Optional<Conversation> findConversationByExternalId(Principal owner, String externalId);

    List<Conversation> conversations(Principal owner);

    /**
     * Atomically finds or creates the conversation, then inserts the message and its chunks.
     *
     * @throws DuplicateExternalIdException when a message with the same dedup key is already stored
     */
    Message commit(Principal owner, MessageCommit commit);

    List<Chunk> chunksForMessage(Principal owner, UUID messageId);

    Optional<Chunk> findChunk(Principal owner, UUID chunkId);

    List<Chunk> chunksInState(Principal owner, EmbeddingState state, int limit);

    /** Replaces the embedding columns of an existing chunk; other columns keep their stored values. */
    void updateChunk(Principal owner, Chunk chunk);

    /** Deletes the conversation with its messages and chunks, returning the removed chunk ids. */
    List<UUID> deleteConversation(Principal owner, UUID conversationId);

    /** Deletes the message with its chunks, returning the removed chunk ids. */
    List<UUID> deleteMessage(Principal owner, UUID messageId);

    int messageCount(Principal owner);

    int chunkCount(Principal owner);

    Set<Principal> owners();
}
