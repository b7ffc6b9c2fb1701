package org.otelbuffer.datapipeline.api.ingest;

/**
 * Base class for errors that end an ingestion job or one of its sources.
 * <p>
 * Subclasses distinguish unrecognized formats, oversized documents and fail-mode aborts.
 * Plain instances wrap I/O failures of a source.
 */
public class IngestionException extends Exception {

    private final String sourceName;

    /**
     * @param sourceName the source being ingested
     * @param message    the detail message
     */
    public IngestionException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    /**
     * @param sourceName the source being ingested
     * @param message    the detail message
     * @param cause      the underlying cause
     */
    public IngestionException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    /**
     * @return the name of the source that failed
     */
    public String getSourceName() {
        return sourceName;
    }
}
