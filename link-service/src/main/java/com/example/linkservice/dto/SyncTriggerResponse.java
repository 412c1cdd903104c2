package com.example.linkservice.dto;

/**
 * Body returned by the cron sync endpoint.
 */
public record SyncTriggerResponse(
        int synced,
        int failed,
        int total,
        long durationMs
) {

    public static SyncTriggerResponse from(SyncResultDto result) {
        return new SyncTriggerResponse(
                result.getSynced(),
                result.getFailed(),
                result.getTotal(),
                result.getDurationMs());
    }
}
