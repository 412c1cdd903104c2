package com.example.linkservice.dto;

import lombok.Builder;

import java.time.Instant;

/**
 * Error envelope shared by every endpoint and by the servlet filters that reject requests.
 */
@Builder
public record ErrorResponse(
    Error error,
    String timestamp
) {

    public static ErrorResponse of(String code, String message) {
        return of(code, message, null, null);
    }

    public static ErrorResponse of(String code, String message, String field, Object details) {
        return ErrorResponse.builder()
            .error(Error.builder()
                .code(code)
                .message(message)
                .field(field)
                .details(details)
                .build())
            .timestamp(Instant.now().toString())
            .build();
    }

    @Builder
    public record Error(
        String code,
        String message,
        String field,
        Object details
    ) {}
}
