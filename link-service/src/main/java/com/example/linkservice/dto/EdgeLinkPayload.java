package com.example.linkservice.dto;

/**
 * Minimal value stored per slug in the edge cache: only what the redirect worker needs.
 *
 * @param expiresAt epoch milliseconds, null = never expires
 */
public record EdgeLinkPayload(
        Long id,
        String targetUrl,
        Long expiresAt
) {
}
