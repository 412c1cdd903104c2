package com.example.linkservice.dto;

import java.util.List;

/**
 * Dashboard view of edge sync health, derived on demand from the history log.
 *
 * @param lastSyncTime       timestamp of the newest successful attempt, null if none
 * @param approxCacheSize    total of that same attempt, null if none
 * @param successRatePercent rounded share of successful attempts, null for empty history
 */
public record HealthStatus(
        List<SyncHistoryEntry> history,
        String lastSyncTime,
        Integer approxCacheSize,
        Integer successRatePercent
) {
}
