package com.inboxsearch.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.inboxsearch.identity.Principal;
import com.inboxsearch.model.Chunk;
import com.inboxsearch.model.Conversation;
import com.inboxsearch.model.EmbeddingState;
import com.inboxsearch.model.Message;

/**
 * Keeps each owner's rows in a separate, individually locked partition. Can be saved to and loaded
 * from a JSON snapshot.
 */
public class InMemoryMessageStore implements MessageStore {
    private final Map<UUID, OwnerRows> partitions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMessageStore() {
        this(Clock.systemUTC());
    }

    public InMemoryMessageStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Message> findMessageByDedupKey(Principal owner, String dedupKey) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return Optional.empty();
        }
        synchronized (rows) {
            UUID messageId = rows.messageIdsByDedupKey.get(dedupKey);
            return Optional.ofNullable(messageId == null ? null : rows.messages.get(messageId));
        }
    }

    @Override
    public Optional<Message> findMessage(Principal owner, UUID messageId) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return Optional.empty();
        }
        synchronized (rows) {
            return Optional.ofNullable(rows.messages.get(messageId));
        }
    }

    @Override
    public Optional<Conversation> findConversation(Principal owner, UUID conversationId) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return Optional.empty();
        }
        synchronized (rows) {
            return Optional.ofNullable(rows.conversations.get(conversationId));
        }
    }

    @Override
    public Optional<Conversation> findConversationByExternalId(Principal owner, String externalId) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return Optional.empty();
        }
        synchronized (rows) {
            UUID conversationId = rows.conversationIdsByExternalId.get(externalId);
            return Optional.ofNullable(conversationId == null ? null : rows.conversations.get(conversationId));
        }
    }

    @Override
    public List<Conversation> conversations(Principal owner) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return rows.conversations.values().stream()
                    .sorted(Comparator.comparing(Conversation::lastActivityAt, Comparator.nullsLast(Comparator.reverseOrder())))
                    .toList();
        }
    }

    @Override
    public Message commit(Principal owner, MessageCommit commit) {
        Message draft = commit.message();
        requireOwned(owner, draft.ownerId(), "message");
        Map<Integer, Chunk> byIndex = new LinkedHashMap<>();
        for (Chunk chunk : commit.chunks()) {
            requireOwned(owner, chunk.ownerId(), "chunk");
            if (!chunk.messageId().equals(draft.id())) {
                throw new IllegalArgumentException("chunk " + chunk.id() + " does not belong to message " + draft.id());
            }
            if (byIndex.put(chunk.chunkIndex(), chunk) != null) {
                throw new IllegalArgumentException("duplicate chunk index " + chunk.chunkIndex());
            }
        }

        OwnerRows rows = partitions.computeIfAbsent(owner.id(), unused -> new OwnerRows());
        synchronized (rows) {
            UUID existing = rows.messageIdsByDedupKey.get(draft.dedupKey());
            if (existing != null) {
                throw new DuplicateExternalIdException(draft.dedupKey(), existing);
            }
            Instant now = clock.instant();
            Conversation conversation = upsertConversation(rows, owner, commit, draft.sentAt(), now);
            Message stored = new Message(
                    draft.id(),
                    owner.id(),
                    conversation.id(),
                    draft.externalId(),
                    draft.dedupKey(),
                    draft.senderId(),
                    draft.sentAt(),
                    draft.body(),
                    draft.metadata(),
                    draft.createdAt() == null ? now : draft.createdAt(),
                    now);
            rows.messages.put(stored.id(), stored);
            rows.messageIdsByDedupKey.put(stored.dedupKey(), stored.id());
            for (Chunk chunk : byIndex.values()) {
                rows.chunks.put(chunk.id(), chunk);
            }
            rows.chunkIdsByMessage.put(stored.id(), byIndex.values().stream().map(Chunk::id).collect(Collectors.toList()));
            return stored;
        }
    }

    @Override
    public List<Chunk> chunksForMessage(Principal owner, UUID messageId) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return rows.chunkIdsByMessage.getOrDefault(messageId, List.of()).stream()
                    .map(rows.chunks::get)
                    .sorted(Comparator.comparingInt(Chunk::chunkIndex))
                    .toList();
        }
    }

    @Override
    public Optional<Chunk> findChunk(Principal owner, UUID chunkId) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return Optional.empty();
        }
        synchronized (rows) {
            return Optional.ofNullable(rows.chunks.get(chunkId));
        }
    }

    @Override
    public List<Chunk> chunksInState(Principal owner, EmbeddingState state, int limit) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return rows.chunks.values().stream()
                    .filter(chunk -> chunk.embeddingState() == state)
                    .sorted(Comparator.comparing(Chunk::createdAt).thenComparing(chunk -> chunk.id().toString()))
                    .limit(limit)
                    .toList();
        }
    }

    @Override
    public void updateChunk(Principal owner, Chunk chunk) {
        requireOwned(owner, chunk.ownerId(), "chunk");
        OwnerRows rows = existing(owner);
        if (rows == null) {
            throw new IllegalArgumentException("unknown chunk " + chunk.id());
        }
        synchronized (rows) {
            Chunk stored = rows.chunks.get(chunk.id());
            if (stored == null) {
                throw new IllegalArgumentException("unknown chunk " + chunk.id());
            }
            rows.chunks.put(chunk.id(), new Chunk(
                    stored.id(),
                    stored.ownerId(),
                    stored.messageId(),
                    stored.chunkIndex(),
                    stored.content(),
                    chunk.embedding(),
                    chunk.embeddingState(),
                    chunk.embeddingError(),
                    stored.createdAt(),
                    clock.instant()));
        }
    }

    @Override
    public List<UUID> deleteConversation(Principal owner, UUID conversationId) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            Conversation conversation = rows.conversations.remove(conversationId);
            if (conversation == null) {
                return List.of();
            }
            rows.conversationIdsByExternalId.remove(conversation.externalId());
            List<UUID> messageIds = rows.messages.values().stream()
                    .filter(message -> message.conversationId().equals(conversationId))
                    .map(Message::id)
                    .toList();
            List<UUID> removedChunks = new ArrayList<>();
            for (UUID messageId : messageIds) {
                removedChunks.addAll(removeMessage(rows, messageId));
            }
            return removedChunks;
        }
    }

    @Override
    public List<UUID> deleteMessage(Principal owner, UUID messageId) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return removeMessage(rows, messageId);
        }
    }

    @Override
    public int messageCount(Principal owner) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return 0;
        }
        synchronized (rows) {
            return rows.messages.size();
        }
    }

    @Override
    public int chunkCount(Principal owner) {
        OwnerRows rows = existing(owner);
        if (rows == null) {
            return 0;
        }
        synchronized (rows) {
            return rows.chunks.size();
        }
    }

    @Override
    public Set<Principal> owners() {
        return partitions.keySet().stream().map(Principal::new).collect(Collectors.toSet());
    }

    public void save(Path path) throws IOException {
        List<Conversation> conversations = new ArrayList<>();
        List<Message> messages = new ArrayList<>();
        List<Chunk> chunks = new ArrayList<>();
        for (OwnerRows rows : partitions.values()) {
            synchronized (rows) {
                conversations.addAll(rows.conversations.values());
                messages.addAll(rows.messages.values());
                chunks.addAll(rows.chunks.values());
            }
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        snapshotMapper().writerWithDefaultPrettyPrinter().writeValue(path.toFile(), new StoreSnapshot(conversations, messages, chunks));
    }

    public static InMemoryMessageStore load(Path path, Clock clock) throws IOException {
        InMemoryMessageStore store = new InMemoryMessageStore(clock);
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return store;
        }
        StoreSnapshot snapshot = snapshotMapper().readValue(path.toFile(), StoreSnapshot.class);
        for (Conversation conversation : snapshot.conversations()) {
            OwnerRows rows = store.partitions.computeIfAbsent(conversation.ownerId(), unused -> new OwnerRows());
            rows.conversations.put(conversation.id(), conversation);
            rows.conversationIdsByExternalId.put(conversation.externalId(), conversation.id());
        }
        for (Message message : snapshot.messages()) {
            OwnerRows rows = store.partitions.computeIfAbsent(message.ownerId(), unused -> new OwnerRows());
            if (!rows.conversations.containsKey(message.conversationId())) {
                throw new IOException("snapshot message " + message.id() + " references a conversation of another owner");
            }
            rows.messages.put(message.id(), message);
            rows.messageIdsByDedupKey.put(message.dedupKey(), message.id());
        }
        for (Chunk chunk : snapshot.chunks()) {
            OwnerRows rows = store.partitions.computeIfAbsent(chunk.ownerId(), unused -> new OwnerRows());
            if (!rows.messages.containsKey(chunk.messageId())) {
                throw new IOException("snapshot chunk " + chunk.id() + " references a message of another owner");
            }
            rows.chunks.put(chunk.id(), chunk);
            rows.chunkIdsByMessage.computeIfAbsent(chunk.messageId(), unused -> new ArrayList<>()).add(chunk.id());
        }
        return store;
    }

    private static ObjectMapper snapshotMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    private Conversation upsertConversation(OwnerRows rows, Principal owner, MessageCommit commit, Instant sentAt, Instant now) {
        UUID conversationId = rows.conversationIdsByExternalId.get(commit.conversationExternalId());
        Conversation conversation;
        if (conversationId == null) {
            conversation = new Conversation(
                    UUID.randomUUID(),
                    owner.id(),
                    commit.conversationExternalId(),
                    commit.conversationTitle(),
                    commit.participants(),
                    sentAt,
                    now,
                    now);
            rows.conversationIdsByExternalId.put(conversation.externalId(), conversation.id());
        } else {
            conversation = rows.conversations.get(conversationId)
                    .touch(commit.conversationTitle(), commit.participants(), sentAt, now);
        }
        rows.conversations.put(conversation.id(), conversation);
        return conversation;
    }

    private static List<UUID> removeMessage(OwnerRows rows, UUID messageId) {
        Message message = rows.messages.remove(messageId);
        if (message == null) {
            return List.of();
        }
        rows.messageIdsByDedupKey.remove(message.dedupKey());
        List<UUID> chunkIds = rows.chunkIdsByMessage.remove(messageId);
        if (chunkIds == null) {
            return List.of();
        }
        chunkIds.forEach(rows.chunks::remove);
        return List.copyOf(chunkIds);
    }

    private OwnerRows existing(Principal owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner is required");
        }
        return partitions.get(owner.id());
    }

    private static void requireOwned(Principal owner, UUID ownerId, String entity) {
        if (!owner.id().equals(ownerId)) {
            throw new IllegalArgumentException(entity + " is not owned by " + owner);
        }
    }

    private static final class OwnerRows {
        private final Map<UUID, Conversation> conversations = new HashMap<>();
        private final Map<String, UUID> conversationIdsByExternalId = new HashMap<>();
        private final Map<UUID, Message> messages = new HashMap<>();
        private final Map<String, UUID> messageIdsByDedupKey = new HashMap<>();
        private final Map<UUID, Chunk> chunks = new HashMap<>();
        private final Map<UUID, List<UUID>> chunkIdsByMessage = new HashMap<>();
    }
}
