package com.example.linkservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Request to create a short link. A blank slug gets a generated one.
 */
public record CreateLinkRequest(
        @NotBlank
        @Size(max = 64)
        String userId,

        @NotBlank
        @Size(max = 2048)
        String targetUrl,

        @Size(max = 50)
        @Pattern(regexp = "^[A-Za-z0-9_-]*$", message = "Slug may only contain letters, digits, '-' and '_'")
        String slug,

        Instant expiresAt
) {
}
