package com.inboxsearch.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.inboxsearch.identity.Principal;
import com.inboxsearch.model.SyncState;
import com.inboxsearch.model.SyncStatus;

class SyncStateTrackerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final SyncStateTracker tracker = new SyncStateTracker(clock);
    private final Principal owner = new Principal(UUID.randomUUID());

    @TempDir
    Path tempDir;

    @Test
    void shouldReportIdleBeforeFirstSync() {
        SyncState state = tracker.snapshot(owner, "linkedin");

        assertEquals(SyncStatus.IDLE, state.status());
        assertNull(state.cursor());
        assertNull(state.lastSyncedAt());
    }

    @Test
    void shouldMoveThroughRunningToIdle() {
        tracker.begin(owner, "linkedin");
        tracker.checkpoint(owner, "linkedin", "c1");
        assertEquals(SyncStatus.RUNNING, tracker.snapshot(owner, "linkedin").status());
        assertNull(tracker.snapshot(owner, "linkedin").lastSyncedAt());

        SyncState done = tracker.complete(owner, "linkedin", "c2");

        assertEquals(SyncStatus.IDLE, done.status());
        assertEquals("c2", done.cursor());
        assertEquals(NOW, done.lastSyncedAt());
        assertNull(done.lastError());
    }

    @Test
    void shouldRejectSecondBeginWhileRunning() {
        tracker.begin(owner, "linkedin");

        assertThrows(SyncAlreadyRunningException.class, () -> tracker.begin(owner, "linkedin"));
        tracker.begin(owner, "gmail");
        tracker.begin(new Principal(UUID.randomUUID()), "linkedin");
    }

    @Test
    void shouldKeepCheckpointedCursorOnFailureAndAllowRestart() {
        tracker.begin(owner, "linkedin");
        tracker.checkpoint(owner, "linkedin", "c5");

        SyncState failed = tracker.fail(owner, "linkedin", "fetch: connection reset");

        assertEquals(SyncStatus.ERROR, failed.status());
        assertEquals("c5", failed.cursor());
        assertEquals("fetch: connection reset", failed.lastError());
        assertEquals(SyncStatus.RUNNING, tracker.begin(owner, "linkedin").status());
        assertEquals(SyncStatus.IDLE, tracker.complete(owner, "linkedin", "c6").status());
        assertNull(tracker.snapshot(owner, "linkedin").lastError());
    }

    @Test
    void shouldRejectTransitionsWithoutRunningSync() {
        assertThrows(IllegalStateException.class, () -> tracker.checkpoint(owner, "linkedin", "c1"));

        tracker.begin(owner, "linkedin");
        tracker.complete(owner, "linkedin", "c1");

        assertThrows(IllegalStateException.class, () -> tracker.complete(owner, "linkedin", "c2"));
        assertThrows(IllegalStateException.class, () -> tracker.fail(owner, "linkedin", "late"));
        assertEquals("c1", tracker.snapshot(owner, "linkedin").cursor());
    }

    @Test
    void shouldRecoverInterruptedSyncAsErrorOnLoad() throws Exception {
        Principal other = new Principal(UUID.randomUUID());
        tracker.begin(owner, "linkedin");
        tracker.checkpoint(owner, "linkedin", "c3");
        tracker.begin(other, "linkedin");
        tracker.complete(other, "linkedin", "c9");
        Path file = tempDir.resolve("sync-state.json");

        tracker.save(file);
        assertTrue(Files.readString(file).contains("\"running\""));
        SyncStateTracker restored = SyncStateTracker.load(file, clock);

        SyncState interrupted = restored.snapshot(owner, "linkedin");
        assertEquals(SyncStatus.ERROR, interrupted.status());
        assertEquals("c3", interrupted.cursor());
        assertTrue(interrupted.lastError().startsWith("interrupted"));
        assertEquals(SyncStatus.IDLE, restored.snapshot(other, "linkedin").status());
        assertEquals(SyncStatus.RUNNING, restored.begin(owner, "linkedin").status());
    }
}
