package org.otelbuffer.datapipeline;

import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Row factories shared by buffer, scan and union tests.
 */
public final class TestRows {

    private TestRows() {
    }

    /**
     * A logs row with timestamp, service and body set; everything else null.
     */
    public static Row log(long timestampNanos, String service, String body) {
        return new Row.Builder(OtlpSchemas.logs().arity())
                .set(OtlpSchemas.Logs.TIMESTAMP, timestampNanos)
                .set(OtlpSchemas.Logs.SERVICE_NAME, service)
                .set(OtlpSchemas.Logs.BODY, body)
                .build();
    }

    /**
     * Logs rows with timestamps {@code startNanos, startNanos + stepNanos, ...} and body "row-i".
     */
    public static List<Row> logs(int count, long startNanos, long stepNanos, String service) {
        List<Row> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rows.add(log(startNanos + i * stepNanos, service, "row-" + i));
        }
        return rows;
    }

    /**
     * A gauge row with base columns and value.
     */
    public static Row gauge(long timestampNanos, String service, String metric, double value) {
        return new Row.Builder(OtlpSchemas.MetricBase.WIDTH + 1)
                .set(OtlpSchemas.MetricBase.TIMESTAMP, timestampNanos)
                .set(OtlpSchemas.MetricBase.SERVICE_NAME, service)
                .set(OtlpSchemas.MetricBase.METRIC_NAME, metric)
                .set(OtlpSchemas.MetricBase.WIDTH, value)
                .build();
    }
}
