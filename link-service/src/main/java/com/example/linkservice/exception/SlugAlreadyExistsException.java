package com.example.linkservice.exception;

/**
 * Exception thrown when a slug is already taken, including by a deleted link.
 * Maps to HTTP 409.
 */
public class SlugAlreadyExistsException extends RuntimeException {

    public SlugAlreadyExistsException(String slug) {
        super("Slug already exists: " + slug);
    }
}
