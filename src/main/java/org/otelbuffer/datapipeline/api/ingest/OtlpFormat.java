package org.otelbuffer.datapipeline.api.ingest;

/**
 * Byte-level encodings recognized by format detection.
 */
public enum OtlpFormat {
    JSON,
    PROTOBUF,
    UNKNOWN
}
