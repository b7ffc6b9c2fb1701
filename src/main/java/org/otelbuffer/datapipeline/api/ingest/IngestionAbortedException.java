package org.otelbuffer.datapipeline.api.ingest;

/**
 * Thrown under {@link OnErrorMode#FAIL} on the first malformed unit. The cause is the
 * {@link OtlpParseException} describing the malformed content.
 */
public class IngestionAbortedException extends IngestionException {

    private final long line;

    /**
     * @param sourceName the source
     * @param line       1-based line number of the malformed unit, or 0 for a whole document
     * @param cause      the parse error
     */
    public IngestionAbortedException(String sourceName, long line, OtlpParseException cause) {
        super(sourceName, describe(sourceName, line, cause), cause);
        this.line = line;
    }

    private static String describe(String sourceName, long line, OtlpParseException cause) {
        String where = line > 0 ? " on line " + line : "";
        return "Failed to parse OTLP data in source '" + sourceName + "'" + where + ": " + cause.getMessage();
    }

    /**
     * @return 1-based line of the failing unit, 0 for single-document sources
     */
    public long getLine() {
        return line;
    }
}
