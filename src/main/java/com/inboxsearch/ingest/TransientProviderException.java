package com.inboxsearch.ingest;

/**
 * Rate limit, timeout or I/O failure talking to an external provider. Safe to retry.
 */
public class TransientProviderException extends RuntimeException {
    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
