package org.otelbuffer.datapipeline.api.schema;

/**
 * The seven typed tables held by a buffer set.
 */
public enum TableKind {
    TRACES("otel_traces"),
    LOGS("otel_logs"),
    METRICS_GAUGE("otel_metrics_gauge"),
    METRICS_SUM("otel_metrics_sum"),
    METRICS_HISTOGRAM("otel_metrics_histogram"),
    METRICS_EXP_HISTOGRAM("otel_metrics_exp_histogram"),
    METRICS_SUMMARY("otel_metrics_summary");

    private final String tableName;

    TableKind(String tableName) {
        this.tableName = tableName;
    }

    /**
     * @return the table name, e.g. "otel_traces"
     */
    public String getTableName() {
        return tableName;
    }

    /**
     * @return true for the five metric tables
     */
    public boolean isMetric() {
        return this != TRACES && this != LOGS;
    }
}
