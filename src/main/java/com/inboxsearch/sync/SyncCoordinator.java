package com.inboxsearch.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.inboxsearch.identity.Principal;
import com.inboxsearch.runtime.ConfigurationException;

/**
 * Runs syncs for many owners in parallel. Work for one (owner, source) never overlaps: a second
 * submission while the first is active is rejected with {@link SyncAlreadyRunningException}.
 */
public class SyncCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncCoordinator.class);

    private final SyncService syncService;
    private final ExecutorService executor;
    private final Map<SyncKey, CancellationToken> active = new ConcurrentHashMap<>();

    public SyncCoordinator(SyncService syncService, int parallelism) {
        if (parallelism < 1) {
            throw new ConfigurationException("parallelism must be >= 1");
        }
        this.syncService = syncService;
        this.executor = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "sync-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletableFuture<SyncReport> submit(Principal owner, String source) {
        SyncKey key = new SyncKey(owner, source);
        CancellationToken token = new CancellationToken();
        if (active.putIfAbsent(key, token) != null) {
            return CompletableFuture.failedFuture(new SyncAlreadyRunningException(owner.toString(), source));
        }
        try {
            return CompletableFuture
                    .supplyAsync(() -> syncService.runSync(owner, source, token), executor)
                    .whenComplete((report, error) -> active.remove(key, token));
        } catch (RuntimeException e) {
            active.remove(key, token);
            throw e;
        }
    }

    /**
     * Syncs one source for every given owner and waits for all of them. A failure to start one owner's
     * sync does not prevent the others.
     */
    public List<CompletableFuture<SyncReport>> runForOwners(Collection<Principal> owners, String source) {
        List<CompletableFuture<SyncReport>> futures = new ArrayList<>();
        for (Principal owner : owners) {
            futures.add(submit(owner, source));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .exceptionally(error -> null)
                .join();
        return futures;
    }

    public boolean cancel(Principal owner, String source, String reason) {
        CancellationToken token = active.get(new SyncKey(owner, source));
        if (token == null) {
            return false;
        }
        token.cancel(reason);
        log.info("sync.cancel.requested owner={} source={} reason={}", owner, source, reason);
        return true;
    }

    public boolean isActive(Principal owner, String source) {
        return active.containsKey(new SyncKey(owner, source));
    }

    @Override
    public void close() throws InterruptedException {
        active.values().forEach(token -> token.cancel("shutdown"));
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }
}
