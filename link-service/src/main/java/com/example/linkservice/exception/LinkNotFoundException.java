package com.example.linkservice.exception;

/**
 * Exception thrown when a link does not exist or was deleted.
 * Maps to HTTP 404.
 */
public class LinkNotFoundException extends RuntimeException {

    public LinkNotFoundException(Long linkId) {
        super("Link not found: " + linkId);
    }
}
