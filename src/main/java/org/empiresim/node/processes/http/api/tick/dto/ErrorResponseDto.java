package org.empiresim.node.processes.http.api.tick.dto;

import java.time.Instant;

/**
 * Error body returned by every admin endpoint.
 *
 * @param timestamp ISO-8601 time of the error
 * @param status    HTTP status code
 * @param error     HTTP status text
 * @param message   What went wrong
 */
public record ErrorResponseDto(String timestamp, int status, String error, String message) {

    public static ErrorResponseDto of(final int status, final String error, final String message) {
        return new ErrorResponseDto(Instant.now().toString(), status, error, message);
    }
}
