package com.example.linkservice.dto;

import java.time.Instant;

/**
 * Redirect record as read from the authoritative store.
 *
 * @param id        link id
 * @param slug      unique short code, used as the edge cache key
 * @param targetUrl destination URL
 * @param expiresAt expiry instant, null when the link never expires
 */
public record RedirectRecord(
        Long id,
        String slug,
        String targetUrl,
        Instant expiresAt
) {
}
