package com.inboxsearch.index;

import java.util.Comparator;
import java.util.UUID;

public record ScoredChunk(UUID chunkId, double similarity) {
    public static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::similarity).reversed()
            .thenComparing(scored -> scored.chunkId().toString());
}
