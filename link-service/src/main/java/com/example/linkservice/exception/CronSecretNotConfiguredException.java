package com.example.linkservice.exception;

/**
 * Exception thrown when the cron endpoint is called but no shared secret is configured.
 * Maps to HTTP 500: the operator must set edge-sync.cron-secret.
 */
public class CronSecretNotConfiguredException extends RuntimeException {

    public CronSecretNotConfiguredException() {
        super("Cron secret is not configured");
    }
}
