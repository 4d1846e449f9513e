package com.inboxsearch.ingest;

import java.util.List;

public record FetchPage(List<RawMessage> messages, String nextCursor, boolean hasMore) {
    public FetchPage {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static FetchPage empty(String cursor) {
        return new FetchPage(List.of(), cursor, false);
    }
}
