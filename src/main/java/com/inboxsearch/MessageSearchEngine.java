package com.inboxsearch;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.inboxsearch.identity.IdentityResolver;
import com.inboxsearch.identity.Principal;
import com.inboxsearch.index.DimensionMismatchException;
import com.inboxsearch.index.ScoredChunk;
import com.inboxsearch.index.VectorIndex;
import com.inboxsearch.ingest.EmbeddingGateway;
import com.inboxsearch.model.Chunk;
import com.inboxsearch.model.EmbeddingState;
import com.inboxsearch.model.SyncState;
import com.inboxsearch.runtime.AppConfig;
import com.inboxsearch.store.MessageStore;
import com.inboxsearch.sync.SyncReport;
import com.inboxsearch.sync.SyncService;

/**
 * Entry point for callers holding a credential. The credential is resolved to a principal before any
 * component is touched, and that principal scopes every read and write.
 */
public class MessageSearchEngine {
    private static final Logger log = LoggerFactory.getLogger(MessageSearchEngine.class);

    private final IdentityResolver identityResolver;
    private final MessageStore store;
    private final VectorIndex index;
    private final EmbeddingGateway gateway;
    private final SyncService syncService;
    private final AppConfig.SearchConfig searchDefaults;

    public MessageSearchEngine(
            IdentityResolver identityResolver,
            MessageStore store,
            VectorIndex index,
            EmbeddingGateway gateway,
            SyncService syncService,
            AppConfig.SearchConfig searchDefaults) {
        this.identityResolver = identityResolver;
        this.store = store;
        this.index = index;
        this.gateway = gateway;
        this.syncService = syncService;
        this.searchDefaults = searchDefaults;
    }

    public SyncReport runSync(String credential, String source) {
        return syncService.runSync(identityResolver.resolve(credential), source);
    }

    public SyncState getSyncStatus(String credential, String source) {
        return syncService.getSyncStatus(identityResolver.resolve(credential), source);
    }

    public List<SearchResult> search(String credential, String queryText) {
        return search(credential, queryText, searchDefaults.getDefaultMatchCount(), searchDefaults.getDefaultSimilarityThreshold());
    }

    public List<SearchResult> search(String credential, String queryText, int k, double similarityThreshold) {
        Principal owner = identityResolver.resolve(credential);
        if (queryText == null || queryText.isBlank()) {
            return List.of();
        }
        return searchAs(owner, gateway.embedQuery(queryText), k, similarityThreshold);
    }

    public List<SearchResult> search(String credential, float[] queryVector, int k, double similarityThreshold) {
        return searchAs(identityResolver.resolve(credential), queryVector, k, similarityThreshold);
    }

    public int deleteConversation(String credential, UUID conversationId) {
        Principal owner = identityResolver.resolve(credential);
        List<UUID> removed = store.deleteConversation(owner, conversationId);
        index.removeAll(owner, removed);
        return removed.size();
    }

    public int deleteMessage(String credential, UUID messageId) {
        Principal owner = identityResolver.resolve(credential);
        List<UUID> removed = store.deleteMessage(owner, messageId);
        index.removeAll(owner, removed);
        return removed.size();
    }

    /**
     * Loads every stored embedding into the index, e.g. after a restart. A chunk whose embedding no
     * longer fits the index dimension is marked rejected and left out.
     */
    public int rebuildIndex() {
        int indexed = 0;
        int rejected = 0;
        for (Principal owner : store.owners()) {
            for (Chunk chunk : store.chunksInState(owner, EmbeddingState.EMBEDDED, Integer.MAX_VALUE)) {
                try {
                    index.upsert(owner, chunk.id(), chunk.embedding());
                    indexed++;
                } catch (DimensionMismatchException e) {
                    log.warn("index.rebuild.chunk.skipped owner={} chunk={} reason={}", owner, chunk.id(), e.getMessage());
                    // the store stamps updatedAt itself
                    store.updateChunk(owner, chunk.withoutEmbedding(EmbeddingState.REJECTED, e.getMessage(), chunk.updatedAt()));
                    rejected++;
                }
            }
        }
        log.info("index.rebuilt owners={} chunks={} rejected={}", store.owners().size(), indexed, rejected);
        return indexed;
    }

    private List<SearchResult> searchAs(Principal owner, float[] queryVector, int k, double similarityThreshold) {
        List<ScoredChunk> scored = index.search(owner, queryVector, k, similarityThreshold);
        List<SearchResult> results = new ArrayList<>(scored.size());
        for (ScoredChunk hit : scored) {
            store.findChunk(owner, hit.chunkId()).ifPresent(chunk -> results.add(
                    new SearchResult(chunk.id(), chunk.messageId(), chunk.content(), hit.similarity())));
        }
        return results;
    }
}
