package com.inboxsearch.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.inboxsearch.identity.Principal;
import com.inboxsearch.model.SyncState;
import com.inboxsearch.model.SyncStatus;

/**
 * Resumable cursor and status per (owner, source).
 *
 * <p>Transitions: {@code idle -> running}, {@code error -> running}, {@code running -> idle},
 * {@code running -> error}. Each transition is applied atomically; a rejected transition leaves the
 * state untouched. A failure keeps the last checkpointed cursor.</p>
 */
public class SyncStateTracker {
    private static final Logger log = LoggerFactory.getLogger(SyncStateTracker.class);

    private final Map<SyncKey, SyncState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public SyncStateTracker(Clock clock) {
        this.clock = clock;
    }

    public SyncState begin(Principal owner, String source) {
        SyncKey key = new SyncKey(owner, source);
        return states.compute(key, (unused, current) -> {
            SyncState state = current == null ? SyncState.initial(owner.id(), source, clock.instant()) : current;
            if (state.status() == SyncStatus.RUNNING) {
                throw new SyncAlreadyRunningException(owner.toString(), source);
            }
            return state.running(clock.instant());
        });
    }

    public SyncState checkpoint(Principal owner, String source, String cursor) {
        return transition(owner, source, "checkpoint", state -> state.checkpoint(cursor, clock.instant()));
    }

    public SyncState complete(Principal owner, String source, String cursor) {
        return transition(owner, source, "complete", state -> state.succeeded(cursor, clock.instant()));
    }

    public SyncState fail(Principal owner, String source, String detail) {
        return transition(owner, source, "fail", state -> state.failed(detail, clock.instant()));
    }

    public SyncState snapshot(Principal owner, String source) {
        SyncKey key = new SyncKey(owner, source);
        SyncState state = states.get(key);
        return state == null ? SyncState.initial(owner.id(), source, clock.instant()) : state;
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper().writerWithDefaultPrettyPrinter().writeValue(path.toFile(), new ArrayList<>(states.values()));
    }

    /**
     * Loads persisted states. A state still marked running belongs to a process that stopped mid-sync;
     * it is restored as an error so the next run may start from its last checkpoint.
     */
    public static SyncStateTracker load(Path path, Clock clock) throws IOException {
        SyncStateTracker tracker = new SyncStateTracker(clock);
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return tracker;
        }
        List<SyncState> loaded = mapper().readValue(path.toFile(), new TypeReference<List<SyncState>>() {
        });
        for (SyncState state : loaded) {
            SyncState restored = state;
            if (state.status() == SyncStatus.RUNNING) {
                log.warn("sync.recovered owner={} source={} cursor={}", state.ownerId(), state.source(), state.cursor());
                restored = state.failed("interrupted: process stopped while running", clock.instant());
            }
            tracker.states.put(new SyncKey(new Principal(state.ownerId()), state.source()), restored);
        }
        return tracker;
    }

    private SyncState transition(Principal owner, String source, String operation, UnaryOperator<SyncState> change) {
        SyncKey key = new SyncKey(owner, source);
        SyncState updated = states.computeIfPresent(key, (unused, current) -> {
            if (current.status() != SyncStatus.RUNNING) {
                throw new IllegalStateException(operation + " requires a running sync, was " + current.status().wireName());
            }
            return change.apply(current);
        });
        if (updated == null) {
            throw new IllegalStateException(operation + " requires a running sync, none started for " + source);
        }
        return updated;
    }

    private static ObjectMapper mapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }
}
