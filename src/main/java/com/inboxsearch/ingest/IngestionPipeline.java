package com.inboxsearch.ingest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.inboxsearch.identity.Principal;
import com.inboxsearch.index.DimensionMismatchException;
import com.inboxsearch.index.VectorIndex;
import com.inboxsearch.model.Chunk;
import com.inboxsearch.model.EmbeddingState;
import com.inboxsearch.model.Message;
import com.inboxsearch.store.DuplicateExternalIdException;
import com.inboxsearch.store.MessageCommit;
import com.inboxsearch.store.MessageStore;

/**
 * Turns one raw message into stored, embedded and indexed chunks. The store commit is the single
 * point where a message becomes visible; index writes follow it and are repeated on replay.
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final MessageStore store;
    private final VectorIndex index;
    private final Chunker chunker;
    private final EmbeddingGateway gateway;
    private final Clock clock;

    public IngestionPipeline(MessageStore store, VectorIndex index, Chunker chunker, EmbeddingGateway gateway, Clock clock) {
        this.store = store;
        this.index = index;
        this.chunker = chunker;
        this.gateway = gateway;
        this.clock = clock;
    }

    public UnitResult ingest(Principal owner, RawMessage raw) {
        if (raw.conversationExternalId() == null || raw.conversationExternalId().isBlank()) {
            log.warn("ingest.skipped owner={} externalId={} reason=missing-conversation", owner, raw.externalId());
            return UnitResult.skipped();
        }
        String dedupKey = dedupKey(raw);
        Message existing = store.findMessageByDedupKey(owner, dedupKey).orElse(null);
        if (existing != null) {
            log.debug("ingest.duplicate owner={} key={}", owner, dedupKey);
            reindex(owner, existing.id());
            return UnitResult.duplicate(existing.id());
        }

        Instant now = clock.instant();
        UUID messageId = messageId(owner, dedupKey);
        List<String> texts = chunker.chunk(raw.body());
        List<EmbeddingOutcome> outcomes = null;
        String pendingReason = null;
        if (!texts.isEmpty()) {
            try {
                outcomes = gateway.embed(texts);
            } catch (ProviderUnavailableException e) {
                pendingReason = e.getMessage();
                log.warn("ingest.embedding.deferred owner={} message={} chunks={} reason={}", owner, messageId, texts.size(), pendingReason);
            }
        }

        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            UUID chunkId = Chunk.idFor(messageId, i);
            Chunk chunk = new Chunk(chunkId, owner.id(), messageId, i, texts.get(i), null, EmbeddingState.PENDING, pendingReason, now, now);
            if (outcomes != null) {
                EmbeddingOutcome outcome = outcomes.get(i);
                chunk = outcome.isEmbedded()
                        ? chunk.withEmbedding(outcome.vector(), now)
                        : chunk.withoutEmbedding(EmbeddingState.REJECTED, outcome.error(), now);
            }
            chunks.add(chunk);
        }

        Message draft = new Message(
                messageId,
                owner.id(),
                null,
                blankToNull(raw.externalId()),
                dedupKey,
                raw.senderId(),
                raw.sentAt(),
                raw.body() == null ? "" : raw.body(),
                raw.metadata(),
                now,
                now);
        try {
            store.commit(owner, new MessageCommit(
                    raw.conversationExternalId(),
                    raw.conversationTitle(),
                    raw.participants(),
                    draft,
                    chunks));
        } catch (DuplicateExternalIdException e) {
            log.debug("ingest.duplicate owner={} key={} detectedAt=commit", owner, dedupKey);
            reindex(owner, e.existingMessageId());
            return UnitResult.duplicate(e.existingMessageId());
        }

        int embedded = 0;
        int pending = 0;
        int rejected = 0;
        for (Chunk chunk : chunks) {
            switch (chunk.embeddingState()) {
                case EMBEDDED -> {
                    if (indexChunk(owner, chunk)) {
                        embedded++;
                    } else {
                        rejected++;
                    }
                }
                case PENDING -> pending++;
                case REJECTED -> rejected++;
            }
        }
        log.debug("ingest.committed owner={} message={} embedded={} pending={} rejected={}", owner, messageId, embedded, pending, rejected);
        return new UnitResult(UnitResult.Outcome.INGESTED, messageId, embedded, pending, rejected);
    }

    /**
     * Retries embedding for chunks left pending by an earlier provider outage.
     *
     * @return the number of chunks that are now embedded and indexed
     */
    public int reembedPending(Principal owner, int limit) {
        if (limit <= 0) {
            return 0;
        }
        List<Chunk> pending = store.chunksInState(owner, EmbeddingState.PENDING, limit);
        if (pending.isEmpty()) {
            return 0;
        }
        List<EmbeddingOutcome> outcomes;
        try {
            outcomes = gateway.embed(pending.stream().map(Chunk::content).toList());
        } catch (ProviderUnavailableException e) {
            log.warn("ingest.reembed.deferred owner={} chunks={} reason={}", owner, pending.size(), e.getMessage());
            return 0;
        }
        Instant now = clock.instant();
        int embedded = 0;
        for (int i = 0; i < pending.size(); i++) {
            EmbeddingOutcome outcome = outcomes.get(i);
            Chunk chunk = pending.get(i);
            if (!outcome.isEmbedded()) {
                store.updateChunk(owner, chunk.withoutEmbedding(EmbeddingState.REJECTED, outcome.error(), now));
                continue;
            }
            Chunk updated = chunk.withEmbedding(outcome.vector(), now);
            store.updateChunk(owner, updated);
            if (indexChunk(owner, updated)) {
                embedded++;
            }
        }
        log.info("ingest.reembed owner={} attempted={} embedded={}", owner, pending.size(), embedded);
        return embedded;
    }

    /** Re-applies a stored message's embedded chunks to the index without calling the provider. */
    public void reindex(Principal owner, UUID messageId) {
        for (Chunk chunk : store.chunksForMessage(owner, messageId)) {
            if (chunk.embeddingState() == EmbeddingState.EMBEDDED) {
                indexChunk(owner, chunk);
            }
        }
    }

    public static String dedupKey(RawMessage raw) {
        if (raw.externalId() != null && !raw.externalId().isBlank()) {
            return raw.externalId();
        }
        String material = String.join("\u0000",
                String.valueOf(raw.conversationExternalId()),
                String.valueOf(raw.senderId()),
                String.valueOf(raw.sentAt()),
                String.valueOf(raw.body()));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "sha256:" + HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    static UUID messageId(Principal owner, String dedupKey) {
        return UUID.nameUUIDFromBytes((owner.id() + "/" + dedupKey).getBytes(StandardCharsets.UTF_8));
    }

    private boolean indexChunk(Principal owner, Chunk chunk) {
        try {
            index.upsert(owner, chunk.id(), chunk.embedding());
            return true;
        } catch (DimensionMismatchException e) {
            log.warn("ingest.chunk.skipped owner={} chunk={} reason={}", owner, chunk.id(), e.getMessage());
            store.updateChunk(owner, chunk.withoutEmbedding(EmbeddingState.REJECTED, e.getMessage(), clock.instant()));
            return false;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
