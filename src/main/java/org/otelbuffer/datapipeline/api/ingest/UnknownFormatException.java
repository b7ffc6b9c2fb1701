package org.otelbuffer.datapipeline.api.ingest;

/**
 * The leading bytes of a source are neither JSON nor OTLP protobuf.
 * Always fatal; never resolved by {@link OnErrorMode}.
 */
public class UnknownFormatException extends IngestionException {

    public UnknownFormatException(String sourceName) {
        super(sourceName, "Unable to detect OTLP format (expected JSON or Protobuf) in source: " + sourceName);
    }
}
