package com.example.linkservice.service;

import com.example.linkservice.dto.HealthStatus;
import com.example.linkservice.dto.SyncHistoryEntry;
import com.example.linkservice.dto.SyncStatus;

import java.util.List;

/**
 * Turns the sync history into the dashboard health view. Pure function, nothing is stored.
 *
 * Skipped and failed attempts both count against the success rate: a long run of clean,
 * skipped syncs lowers the reported rate.
 */
public final class SyncHealthDeriver {

    private SyncHealthDeriver() {
    }

    /**
     * @param history sync attempts, newest first
     */
    public static HealthStatus deriveHealth(List<SyncHistoryEntry> history) {
        List<SyncHistoryEntry> snapshot = List.copyOf(history);

        SyncHistoryEntry lastSuccess = snapshot.stream()
                .filter(entry -> entry.status() == SyncStatus.SUCCESS)
                .findFirst()
                .orElse(null);

        Integer successRatePercent = null;
        if (!snapshot.isEmpty()) {
            long successes = snapshot.stream()
                    .filter(entry -> entry.status() == SyncStatus.SUCCESS)
                    .count();
            successRatePercent = (int) Math.round(100.0 * successes / snapshot.size());
        }

        return new HealthStatus(
                snapshot,
                lastSuccess != null ? lastSuccess.timestamp() : null,
                lastSuccess != null ? lastSuccess.total() : null,
                successRatePercent);
    }
}
