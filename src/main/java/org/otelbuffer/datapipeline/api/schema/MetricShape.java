package org.otelbuffer.datapipeline.api.schema;

import java.util.Locale;

/**
 * The five mutually exclusive shapes an OTLP metric can carry.
 * <p>
 * Each shape has its own typed buffer and contributes its specific columns to the union
 * schema. {@link #getDiscriminator()} is the value written to the union {@code MetricType} column.
 */
public enum MetricShape {
    GAUGE("gauge", TableKind.METRICS_GAUGE),
    SUM("sum", TableKind.METRICS_SUM),
    HISTOGRAM("histogram", TableKind.METRICS_HISTOGRAM),
    EXPONENTIAL_HISTOGRAM("exponential_histogram", TableKind.METRICS_EXP_HISTOGRAM),
    SUMMARY("summary", TableKind.METRICS_SUMMARY);

    private final String discriminator;
    private final TableKind tableKind;

    MetricShape(String discriminator, TableKind tableKind) {
        this.discriminator = discriminator;
        this.tableKind = tableKind;
    }

    /**
     * Returns the union discriminator string.
     *
     * @return e.g. "gauge", "exponential_histogram"
     */
    public String getDiscriminator() {
        return discriminator;
    }

    /**
     * Returns the table this shape is stored in.
     *
     * @return the table kind
     */
    public TableKind getTableKind() {
        return tableKind;
    }

    /**
     * Parses a discriminator string. Accepts {@code exp_histogram} as an alias, case-insensitive.
     *
     * @param value discriminator string
     * @return the shape
     * @throws IllegalArgumentException if the value names no shape
     */
    public static MetricShape fromDiscriminator(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if ("exp_histogram".equals(normalized)) {
                return EXPONENTIAL_HISTOGRAM;
            }
            for (MetricShape shape : values()) {
                if (shape.discriminator.equals(normalized)) {
                    return shape;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric type '" + value
                + "', expected one of gauge, sum, histogram, exponential_histogram, summary");
    }
}
