package org.otelbuffer.datapipeline.api.ingest;

/**
 * Malformed JSON or protobuf content inside a source whose format was recognized.
 * <p>
 * Intercepted by the ingestion pipeline and resolved according to {@link OnErrorMode}.
 */
public class OtlpParseException extends Exception {

    /**
     * Constructs a new OtlpParseException with the specified detail message.
     *
     * @param message the detail message
     */
    public OtlpParseException(String message) {
        super(message);
    }

    /**
     * Constructs a new OtlpParseException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public OtlpParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
