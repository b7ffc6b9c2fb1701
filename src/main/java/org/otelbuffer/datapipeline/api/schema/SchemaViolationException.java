package org.otelbuffer.datapipeline.api.schema;

/**
 * Thrown when a row or cell written to a buffer does not match the buffer's schema.
 * <p>
 * This is a programming-contract violation, not a data-quality problem: rows are produced by
 * the record flattener against the same schema the buffer was created with, so a mismatch
 * means a bug in the caller. It is never resolved by an ingestion error policy.
 */
public class SchemaViolationException extends RuntimeException {

    /**
     * Constructs a new SchemaViolationException with the specified detail message.
     *
     * @param message the detail message
     */
    public SchemaViolationException(String message) {
        super(message);
    }

    /**
     * Constructs a new SchemaViolationException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
