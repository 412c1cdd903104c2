package com.example.linkservice.dto;

/**
 * One key/value pair written to the edge cache. The key is the link slug.
 */
public record EdgeCacheEntry(
        String key,
        EdgeLinkPayload value
) {
}
