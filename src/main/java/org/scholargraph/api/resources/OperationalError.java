package org.scholargraph.api.resources;

import java.time.Instant;

/**
 * A failure that a component recovered from but wants to surface for monitoring.
 *
 * @param timestamp When the failure happened.
 * @param errorType A stable category, e.g. {@code CACHE_WRITE_FAILED} or {@code CACHE_CORRUPT}.
 * @param message   Human-readable description.
 * @param details   Additional context such as the affected file or query.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
