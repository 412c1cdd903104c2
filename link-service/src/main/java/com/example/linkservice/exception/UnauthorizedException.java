package com.example.linkservice.exception;

/**
 * Exception thrown when a caller presents a missing or wrong credential.
 * Maps to HTTP 401.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
