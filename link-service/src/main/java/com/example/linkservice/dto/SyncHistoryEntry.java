package com.example.linkservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * Immutable record of one sync attempt.
 * For non-skipped entries synced + failed == total.
 *
 * @param timestamp ISO-8601 UTC instant at which the attempt finished
 * @param error     set only for fetch failures
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncHistoryEntry(
        String timestamp,
        SyncStatus status,
        int synced,
        int failed,
        int total,
        long durationMs,
        String error
) {

    public static SyncHistoryEntry skipped() {
        return SyncHistoryEntry.builder()
                .timestamp(Instant.now().toString())
                .status(SyncStatus.SKIPPED)
                .build();
    }

    public static SyncHistoryEntry fetchFailed(String error, long durationMs) {
        return SyncHistoryEntry.builder()
                .timestamp(Instant.now().toString())
                .status(SyncStatus.ERROR)
                .durationMs(durationMs)
                .error(error)
                .build();
    }

    public static SyncHistoryEntry completed(int synced, int failed, long durationMs) {
        return SyncHistoryEntry.builder()
                .timestamp(Instant.now().toString())
                .status(failed > 0 ? SyncStatus.ERROR : SyncStatus.SUCCESS)
                .synced(synced)
                .failed(failed)
                .total(synced + failed)
                .durationMs(durationMs)
                .build();
    }
}
