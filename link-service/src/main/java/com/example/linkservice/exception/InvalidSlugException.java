package com.example.linkservice.exception;

/**
 * Exception thrown for a custom slug that is malformed or collides with a reserved path.
 * Maps to HTTP 400.
 */
public class InvalidSlugException extends RuntimeException {

    public InvalidSlugException(String slug) {
        super("Invalid slug: " + slug);
    }

    public InvalidSlugException(String message, Throwable cause) {
        super(message, cause);
    }
}
