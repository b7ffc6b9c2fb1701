package org.otelbuffer.datapipeline.api.services;

import java.time.Instant;

/**
 * A transient error a service survived.
 *
 * @param timestamp when it was recorded
 * @param code      category, e.g. {@code UNSUPPORTED_MESSAGE}
 * @param message   human-readable summary
 * @param details   additional context
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {
}
