package com.inboxsearch.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncStatus {
    IDLE,
    RUNNING,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncStatus fromWireName(String value) {
        return SyncStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
