package org.empiresim.engine.api.resources;

import java.time.Instant;

/**
 * A transient error that did not stop a service or resource.
 *
 * @param timestamp When the error occurred.
 * @param errorType Error code for categorization (e.g. "TICK_REJECTED").
 * @param message   Human-readable message.
 * @param details   Additional context.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
