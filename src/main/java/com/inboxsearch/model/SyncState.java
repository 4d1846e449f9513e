package com.inboxsearch.model;

import java.time.Instant;
import java.util.UUID;

public record SyncState(
        UUID id,
        UUID ownerId,
        String source,
        String cursor,
        SyncStatus status,
        String lastError,
        Instant lastSyncedAt,
        Instant updatedAt) {

    public static SyncState initial(UUID ownerId, String source, Instant now) {
        return new SyncState(UUID.randomUUID(), ownerId, source, null, SyncStatus.IDLE, null, null, now);
    }

    public SyncState running(Instant now) {
        return new SyncState(id, ownerId, source, cursor, SyncStatus.RUNNING, lastError, lastSyncedAt, now);
    }

    public SyncState checkpoint(String newCursor, Instant now) {
        return new SyncState(id, ownerId, source, newCursor, status, lastError, lastSyncedAt, now);
    }

    public SyncState succeeded(String newCursor, Instant now) {
        return new SyncState(id, ownerId, source, newCursor, SyncStatus.IDLE, null, now, now);
    }

    public SyncState failed(String error, Instant now) {
        return new SyncState(id, ownerId, source, cursor, SyncStatus.ERROR, error, lastSyncedAt, now);
    }
}
