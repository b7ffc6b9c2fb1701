package org.otelbuffer.datapipeline.api.ingest;

import org.otelbuffer.datapipeline.api.schema.TableKind;

/**
 * The OTLP signal a source carries, with its JSON root key.
 */
public enum SignalType {
    TRACES("resourceSpans"),
    LOGS("resourceLogs"),
    METRICS("resourceMetrics");

    private final String jsonRootKey;

    SignalType(String jsonRootKey) {
        this.jsonRootKey = jsonRootKey;
    }

    /**
     * @return the top-level array field of the OTLP JSON encoding, e.g. {@code resourceSpans}
     */
    public String getJsonRootKey() {
        return jsonRootKey;
    }

    /**
     * Returns the table rows of this signal go to. Metrics have no single table.
     *
     * @return the table, or null for {@link #METRICS}
     */
    public TableKind defaultTable() {
        return switch (this) {
            case TRACES -> TableKind.TRACES;
            case LOGS -> TableKind.LOGS;
            case METRICS -> null;
        };
    }
}
