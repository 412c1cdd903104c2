package com.example.linkservice.exception;

/**
 * Exception thrown at the HTTP boundary when a sync attempt could not read the link table.
 * Maps to HTTP 500.
 */
public class SyncFailedException extends RuntimeException {

    public SyncFailedException(String message) {
        super(message);
    }
}
