package com.inboxsearch.sync;

public class SyncAlreadyRunningException extends IllegalStateException {
    public SyncAlreadyRunningException(String owner, String source) {
        super("sync already running for owner=" + owner + " source=" + source);
    }
}
