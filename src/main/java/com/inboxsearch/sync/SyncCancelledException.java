package com.inboxsearch.sync;

public class SyncCancelledException extends RuntimeException {
    public SyncCancelledException(String reason) {
        super("cancelled: " + reason);
    }
}
