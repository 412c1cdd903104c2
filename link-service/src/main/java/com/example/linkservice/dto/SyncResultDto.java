package com.example.linkservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO representing the result of one edge cache sync attempt.
 * Every failure mode is carried here; the sync engine never throws.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResultDto {

    private int synced;
    private int failed;
    private int total;
    private long durationMs;
    private String error;      // configuration absence or fetch failure, never partial writes
    private boolean skipped;   // TRUE if the dirty flag was clean

    public static SyncResultDto notConfigured(String error) {
        return SyncResultDto.builder()
                .error(error)
                .build();
    }

    public static SyncResultDto skippedClean() {
        return SyncResultDto.builder()
                .skipped(true)
                .build();
    }

    public static SyncResultDto fetchFailed(String error, long durationMs) {
        return SyncResultDto.builder()
                .durationMs(durationMs)
                .error(error)
                .build();
    }

    public static SyncResultDto completed(int synced, int failed, long durationMs) {
        return SyncResultDto.builder()
                .synced(synced)
                .failed(failed)
                .total(synced + failed)
                .durationMs(durationMs)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }
}
