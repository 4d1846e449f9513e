package com.inboxsearch.sync;

import com.inboxsearch.model.SyncState;
import com.inboxsearch.model.SyncStatus;

public record SyncReport(
        SyncState state,
        int fetched,
        int ingested,
        int duplicates,
        int skipped,
        int chunksEmbedded,
        int chunksPending,
        int chunksRejected,
        int reembedded) {

    public boolean succeeded() {
        return state.lastError() == null && state.status() == SyncStatus.IDLE;
    }

    public int chunksWritten() {
        return chunksEmbedded + chunksPending + chunksRejected;
    }
}
