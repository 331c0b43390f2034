package com.example.chunker.interfaces.api.error;

import java.time.Instant;
import java.util.Map;

/**
 * API-layer DTO used to serialize error payloads.
 *
 * @param details extra attributes such as the rejected file extension, {@code null} when there are none
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {
    public static ErrorResponse of(int status, String error, String message, String path, Map<String, Object> details) {
        return new ErrorResponse(Instant.now(), status, error, message, path, details);
    }
}
