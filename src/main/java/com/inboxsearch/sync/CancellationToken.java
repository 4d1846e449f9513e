package com.inboxsearch.sync;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag, checked by a sync between message units.
 */
public class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why == null || why.isBlank() ? "requested" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    void throwIfCancelled() {
        String why = reason.get();
        if (why != null) {
            throw new SyncCancelledException(why);
        }
    }
}
