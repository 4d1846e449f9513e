package com.inboxsearch.sync;

import java.util.Objects;

import com.inboxsearch.identity.Principal;

record SyncKey(Principal owner, String source) {
    SyncKey {
        Objects.requireNonNull(owner, "owner");
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
    }
}
