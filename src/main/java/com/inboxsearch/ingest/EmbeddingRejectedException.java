package com.inboxsearch.ingest;

/**
 * The provider refused the input permanently. {@code itemIndex} is the offending position within the
 * submitted batch when the provider reports it, or -1 when it only rejects the batch as a whole.
 */
public class EmbeddingRejectedException extends RuntimeException {
    private final int itemIndex;

    public EmbeddingRejectedException(String message) {
        this(message, -1);
    }

    public EmbeddingRejectedException(String message, int itemIndex) {
        super(message);
        this.itemIndex = itemIndex;
    }

    public int itemIndex() {
        return itemIndex;
    }
}
