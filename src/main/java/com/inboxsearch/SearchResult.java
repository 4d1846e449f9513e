package com.inboxsearch;

import java.util.UUID;

public record SearchResult(UUID chunkId, UUID messageId, String content, double similarity) {
}
