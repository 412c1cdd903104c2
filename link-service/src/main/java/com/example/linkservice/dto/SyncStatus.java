package com.example.linkservice.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one sync attempt as shown in the history log.
 */
public enum SyncStatus {
    SUCCESS,
    ERROR,   // fetch failure or at least one failed write
    SKIPPED; // edge cache was clean, nothing touched

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
