package com.inboxsearch.sync;

import java.util.Objects;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.inboxsearch.identity.Principal;
import com.inboxsearch.ingest.FetchPage;
import com.inboxsearch.ingest.IngestionPipeline;
import com.inboxsearch.ingest.MessageSourceFetcher;
import com.inboxsearch.ingest.RawMessage;
import com.inboxsearch.ingest.RetryPolicy;
import com.inboxsearch.ingest.TimeLimitedCall;
import com.inboxsearch.ingest.UnitResult;
import com.inboxsearch.model.SyncState;
import com.inboxsearch.runtime.AppConfig;

/**
 * Runs one sync for an (owner, source): fetch pages from the stored cursor, ingest each message as an
 * independent unit, checkpoint the cursor after every committed unit and page, and finish in
 * {@code idle} or {@code error}.
 */
public class SyncService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final MessageSourceFetcher fetcher;
    private final IngestionPipeline pipeline;
    private final SyncStateTracker tracker;
    private final RetryPolicy fetchRetryPolicy;
    private final long fetchTimeoutMs;
    private final int pendingReembedLimit;
    private final ExecutorService fetchExecutor;

    public SyncService(
            MessageSourceFetcher fetcher,
            IngestionPipeline pipeline,
            SyncStateTracker tracker,
            RetryPolicy fetchRetryPolicy,
            long fetchTimeoutMs,
            int pendingReembedLimit) {
        this.fetcher = fetcher;
        this.pipeline = pipeline;
        this.tracker = tracker;
        this.fetchRetryPolicy = fetchRetryPolicy;
        this.fetchTimeoutMs = fetchTimeoutMs;
        this.pendingReembedLimit = pendingReembedLimit;
        this.fetchExecutor = fetchTimeoutMs > 0 ? TimeLimitedCall.daemonExecutor("source-fetch") : null;
    }

    public static SyncService fromConfig(
            MessageSourceFetcher fetcher,
            IngestionPipeline pipeline,
            SyncStateTracker tracker,
            AppConfig config) {
        AppConfig.SyncConfig sync = config.getSync();
        RetryPolicy fetchRetry = new RetryPolicy(
                sync.getFetchMaxAttempts(),
                config.getEmbedding().getInitialBackoffMs(),
                config.getEmbedding().getMaxBackoffMs());
        return new SyncService(fetcher, pipeline, tracker, fetchRetry, sync.getFetchTimeoutMs(), sync.getPendingReembedLimit());
    }

    public SyncReport runSync(Principal owner, String source) {
        return runSync(owner, source, CancellationToken.none());
    }

    /**
     * @throws SyncAlreadyRunningException when a sync for the same owner and source is in progress
     */
    public SyncReport runSync(Principal owner, String source, CancellationToken cancellation) {
        SyncState started = tracker.begin(owner, source);
        log.info("sync.started owner={} source={} cursor={}", owner, source, started.cursor());
        Progress progress = new Progress();
        String cursor = started.cursor();
        try {
            progress.reembedded = pipeline.reembedPending(owner, pendingReembedLimit);
            boolean hasMore = true;
            while (hasMore) {
                cancellation.throwIfCancelled();
                FetchPage page = fetch(owner, source, cursor);
                for (RawMessage raw : page.messages()) {
                    cancellation.throwIfCancelled();
                    progress.record(pipeline.ingest(owner, raw));
                    if (raw.cursor() != null) {
                        cursor = raw.cursor();
                        tracker.checkpoint(owner, source, cursor);
                    }
                }
                String previous = cursor;
                if (page.nextCursor() != null) {
                    cursor = page.nextCursor();
                }
                tracker.checkpoint(owner, source, cursor);
                if (page.hasMore() && page.messages().isEmpty() && Objects.equals(previous, cursor)) {
                    throw new IllegalStateException("source reported more messages without advancing cursor " + cursor);
                }
                hasMore = page.hasMore();
            }
            SyncState finished = tracker.complete(owner, source, cursor);
            log.info("sync.completed owner={} source={} cursor={} fetched={} ingested={} duplicates={} pending={} rejected={}",
                    owner, source, cursor, progress.fetched, progress.ingested, progress.duplicates,
                    progress.chunksPending, progress.chunksRejected);
            return progress.report(finished);
        } catch (SyncCancelledException e) {
            SyncState failed = tracker.fail(owner, source, e.getMessage());
            log.warn("sync.cancelled owner={} source={} cursor={} reason={}", owner, source, failed.cursor(), e.getMessage());
            return progress.report(failed);
        } catch (RuntimeException e) {
            SyncState failed = tracker.fail(owner, source, describe(e));
            log.error("sync.failed owner={} source={} cursor={} reason={}", owner, source, failed.cursor(), e.getMessage(), e);
            return progress.report(failed);
        } catch (Error e) {
            tracker.fail(owner, source, describe(e));
            throw e;
        }
    }

    public SyncState getSyncStatus(Principal owner, String source) {
        return tracker.snapshot(owner, source);
    }

    private FetchPage fetch(Principal owner, String source, String cursor) {
        return fetchRetryPolicy.execute("fetch", () -> TimeLimitedCall.call(
                fetchExecutor,
                fetchTimeoutMs,
                "fetch",
                () -> fetcher.fetch(owner, source, cursor)));
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    @Override
    public void close() {
        if (fetchExecutor != null) {
            fetchExecutor.shutdownNow();
        }
    }

    private static final class Progress {
        private int fetched;
        private int ingested;
        private int duplicates;
        private int skipped;
        private int chunksEmbedded;
        private int chunksPending;
        private int chunksRejected;
        private int reembedded;

        void record(UnitResult result) {
            fetched++;
            switch (result.outcome()) {
                case INGESTED -> ingested++;
                case DUPLICATE -> duplicates++;
                case SKIPPED -> skipped++;
            }
            chunksEmbedded += result.chunksEmbedded();
            chunksPending += result.chunksPending();
            chunksRejected += result.chunksRejected();
        }

        SyncReport report(SyncState state) {
            return new SyncReport(state, fetched, ingested, duplicates, skipped, chunksEmbedded, chunksPending, chunksRejected, reembedded);
        }
    }
}
