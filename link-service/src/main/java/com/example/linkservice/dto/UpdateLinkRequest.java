package com.example.linkservice.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Partial update of a short link. Null fields are left unchanged,
 * except expiresAt which is cleared when clearExpiry is true.
 */
public record UpdateLinkRequest(
        @Size(max = 2048)
        String targetUrl,

        @Size(max = 50)
        @Pattern(regexp = "^[A-Za-z0-9_-]*$", message = "Slug may only contain letters, digits, '-' and '_'")
        String slug,

        Instant expiresAt,

        boolean clearExpiry
) {
}
