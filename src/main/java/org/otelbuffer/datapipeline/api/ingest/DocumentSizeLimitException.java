package org.otelbuffer.datapipeline.api.ingest;

/**
 * A document (or JSON line) exceeds the configured maximum byte size.
 * Always fatal for the source, regardless of {@link OnErrorMode}.
 */
public class DocumentSizeLimitException extends IngestionException {

    private final long limitBytes;

    public DocumentSizeLimitException(String sourceName, long limitBytes) {
        super(sourceName, "OTLP document in source '" + sourceName + "' exceeds maximum size of "
                + limitBytes + " bytes (max_document_bytes)");
        this.limitBytes = limitBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
