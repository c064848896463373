package org.soulwars.node.http;

import java.time.Instant;

/**
 * Body of every error response.
 *
 * @param timestamp ISO-8601 time the error occurred
 * @param status    HTTP status code
 * @param error     HTTP status message (e.g. "Service Unavailable")
 * @param message   human-readable detail
 */
public record ErrorResponseDto(String timestamp, int status, String error, String message) {

    public static ErrorResponseDto of(int status, String error, String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, message);
    }
}
