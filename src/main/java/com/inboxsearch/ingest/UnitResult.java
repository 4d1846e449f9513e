package com.inboxsearch.ingest;

import java.util.UUID;

/**
 * Outcome of ingesting one message. Chunk counts are zero for duplicates and skipped messages.
 */
public record UnitResult(Outcome outcome, UUID messageId, int chunksEmbedded, int chunksPending, int chunksRejected) {
    public enum Outcome {
        INGESTED,
        DUPLICATE,
        SKIPPED
    }

    static UnitResult duplicate(UUID messageId) {
        return new UnitResult(Outcome.DUPLICATE, messageId, 0, 0, 0);
    }

    static UnitResult skipped() {
        return new UnitResult(Outcome.SKIPPED, null, 0, 0, 0);
    }

    public int chunksWritten() {
        return chunksEmbedded + chunksPending + chunksRejected;
    }
}
