package com.example.linkservice.exception;

/**
 * Exception thrown when a dependency the request needs is unavailable or not configured.
 * Maps to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    private final String code;

    public ServiceUnavailableException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
