package com.inboxsearch.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.inboxsearch.identity.Principal;
import com.inboxsearch.model.Chunk;
import com.inboxsearch.model.Conversation;
import com.inboxsearch.model.EmbeddingState;
import com.inboxsearch.model.Message;

class InMemoryMessageStoreTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final InMemoryMessageStore store = new InMemoryMessageStore(clock);
    private final Principal alice = new Principal(UUID.randomUUID());
    private final Principal bob = new Principal(UUID.randomUUID());

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateConversationOnFirstCommitAndReuseIt() {
        Message first = store.commit(alice, commit(alice, "thread-1", "k1", Instant.parse("2024-04-01T10:00:00Z"), 2));
        Message second = store.commit(alice, commit(alice, "thread-1", "k2", Instant.parse("2024-04-03T10:00:00Z"), 1));

        assertEquals(first.conversationId(), second.conversationId());
        Conversation conversation = store.findConversationByExternalId(alice, "thread-1").orElseThrow();
        assertEquals(Instant.parse("2024-04-03T10:00:00Z"), conversation.lastActivityAt());
        assertEquals(2, store.messageCount(alice));
        assertEquals(3, store.chunkCount(alice));
        assertEquals(List.of(0, 1), store.chunksForMessage(alice, first.id()).stream().map(Chunk::chunkIndex).toList());
    }

    @Test
    void shouldRejectSecondCommitWithSameDedupKey() {
        Message stored = store.commit(alice, commit(alice, "thread-1", "k1", NOW, 1));

        DuplicateExternalIdException duplicate = assertThrows(DuplicateExternalIdException.class,
                () -> store.commit(alice, commit(alice, "thread-1", "k1", NOW, 1)));

        assertEquals(stored.id(), duplicate.existingMessageId());
        assertEquals(1, store.messageCount(alice));
    }

    @Test
    void shouldLeaveNoRowsWhenChunkIndexesCollide() {
        MessageCommit valid = commit(alice, "thread-1", "k1", NOW, 2);
        UUID messageId = valid.message().id();
        List<Chunk> colliding = List.of(
                valid.chunks().get(0),
                new Chunk(UUID.randomUUID(), alice.id(), messageId, 0, "again", null, EmbeddingState.PENDING, null, NOW, NOW));
        MessageCommit broken = new MessageCommit("thread-1", "Title thread-1", List.of("ana"), valid.message(), colliding);

        assertThrows(IllegalArgumentException.class, () -> store.commit(alice, broken));

        assertEquals(0, store.messageCount(alice));
        assertEquals(0, store.chunkCount(alice));
        assertTrue(store.findConversationByExternalId(alice, "thread-1").isEmpty());
        assertTrue(store.findMessageByDedupKey(alice, "k1").isEmpty());
        Message stored = store.commit(alice, valid);
        assertEquals(2, store.chunksForMessage(alice, stored.id()).size());
    }

    @Test
    void shouldKeepOwnersApart() {
        Message aliceMessage = store.commit(alice, commit(alice, "thread-1", "k1", NOW, 1));
        store.commit(bob, commit(bob, "thread-1", "k1", NOW, 1));

        assertTrue(store.findMessage(bob, aliceMessage.id()).isEmpty());
        assertTrue(store.chunksForMessage(bob, aliceMessage.id()).isEmpty());
        assertTrue(store.deleteMessage(bob, aliceMessage.id()).isEmpty());
        assertEquals(1, store.messageCount(alice));
        assertEquals(1, store.messageCount(bob));
        assertEquals(2, store.owners().size());
    }

    @Test
    void shouldRefuseRowsOwnedBySomeoneElse() {
        assertThrows(IllegalArgumentException.class, () -> store.commit(bob, commit(alice, "thread-1", "k1", NOW, 1)));

        Message stored = store.commit(alice, commit(alice, "thread-1", "k1", NOW, 1));
        Chunk chunk = store.chunksForMessage(alice, stored.id()).get(0);
        Chunk forged = new Chunk(chunk.id(), bob.id(), chunk.messageId(), 0, "x", null, EmbeddingState.PENDING, null, NOW, NOW);
        assertThrows(IllegalArgumentException.class, () -> store.updateChunk(bob, forged));
        assertThrows(IllegalArgumentException.class, () -> store.updateChunk(alice, forged));
    }

    @Test
    void shouldCascadeConversationDelete() {
        Message first = store.commit(alice, commit(alice, "thread-1", "k1", NOW, 2));
        store.commit(alice, commit(alice, "thread-1", "k2", NOW, 3));
        store.commit(alice, commit(alice, "thread-2", "k3", NOW, 1));

        List<UUID> removed = store.deleteConversation(alice, first.conversationId());

        assertEquals(5, removed.size());
        assertEquals(1, store.messageCount(alice));
        assertEquals(1, store.chunkCount(alice));
        assertTrue(store.findMessageByDedupKey(alice, "k1").isEmpty());
        assertTrue(store.findConversationByExternalId(alice, "thread-1").isEmpty());
        assertTrue(store.deleteConversation(alice, first.conversationId()).isEmpty());
    }

    @Test
    void shouldUpdateOnlyEmbeddingColumns() {
        Message stored = store.commit(alice, commit(alice, "thread-1", "k1", NOW, 1));
        Chunk pending = store.chunksInState(alice, EmbeddingState.PENDING, 10).get(0);

        store.updateChunk(alice, pending.withEmbedding(new float[] {0.5f, 0.5f}, NOW));

        Chunk updated = store.findChunk(alice, pending.id()).orElseThrow();
        assertEquals(EmbeddingState.EMBEDDED, updated.embeddingState());
        assertEquals(pending.content(), updated.content());
        assertEquals(stored.id(), updated.messageId());
        assertTrue(store.chunksInState(alice, EmbeddingState.PENDING, 10).isEmpty());
    }

    @Test
    void shouldRestoreSnapshot() throws Exception {
        Message message = store.commit(alice, commit(alice, "thread-1", "k1", NOW, 2));
        Chunk first = store.chunksForMessage(alice, message.id()).get(0);
        store.updateChunk(alice, first.withEmbedding(new float[] {0.25f, 0.75f}, NOW));
        store.commit(bob, commit(bob, "thread-9", "k9", NOW, 1));
        Path snapshot = tempDir.resolve("data/messages.json");

        store.save(snapshot);
        InMemoryMessageStore restored = InMemoryMessageStore.load(snapshot, clock);

        assertEquals(message, restored.findMessageByDedupKey(alice, "k1").orElseThrow());
        assertArrayEquals(new float[] {0.25f, 0.75f}, restored.findChunk(alice, first.id()).orElseThrow().embedding());
        assertEquals(2, restored.chunkCount(alice));
        assertEquals(1, restored.messageCount(bob));
        assertThrows(DuplicateExternalIdException.class,
                () -> restored.commit(alice, commit(alice, "thread-1", "k1", NOW, 1)));
    }

    @Test
    void shouldLoadEmptyStoreWhenSnapshotIsMissing() throws Exception {
        InMemoryMessageStore restored = InMemoryMessageStore.load(tempDir.resolve("missing.json"), clock);

        assertTrue(restored.owners().isEmpty());
    }

    private static MessageCommit commit(Principal owner, String conversation, String dedupKey, Instant sentAt, int chunkCount) {
        UUID messageId = UUID.randomUUID();
        Message message = new Message(messageId, owner.id(), null, dedupKey, dedupKey, "ana", sentAt, "body " + dedupKey,
                Map.of("channel", "inbox"), NOW, NOW);
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < chunkCount; i++) {
            chunks.add(new Chunk(Chunk.idFor(messageId, i), owner.id(), messageId, i, "part " + i, null,
                    EmbeddingState.PENDING, null, NOW, NOW));
        }
        return new MessageCommit(conversation, "Title " + conversation, List.of("ana", "bo"), message, chunks);
    }
}
