package com.inboxsearch.model;

public enum EmbeddingState {
    EMBEDDED,
    /** Provider was unavailable; retried on a later sync. */
    PENDING,
    /** Provider rejected the text or returned an unusable vector; never retried. */
    REJECTED
}
