package org.otelbuffer.datapipeline.api.schema;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static registry of the seven typed OTLP table layouts and the synthesized metric union layout.
 * <p>
 * Column positions are fixed and exposed as constants in the nested holder classes so the
 * flattener and projector can address cells without name lookups. The first nine columns of
 * every metric schema are the shared {@link MetricBase} columns; the union appends the
 * {@code MetricType} discriminator and the superset of all shape-specific columns.
 */
public final class OtlpSchemas {

    private static final DataType STRING_LIST = DataType.listOf(DataType.VARCHAR);
    private static final DataType MAP_LIST = DataType.listOf(DataType.MAP);
    private static final DataType DOUBLE_LIST = DataType.listOf(DataType.DOUBLE);
    private static final DataType UBIGINT_LIST = DataType.listOf(DataType.UBIGINT);

    /** Column positions of {@code otel_traces}. */
    public static final class Traces {
        public static final int TIMESTAMP = 0;
        public static final int TRACE_ID = 1;
        public static final int SPAN_ID = 2;
        public static final int PARENT_SPAN_ID = 3;
        public static final int TRACE_STATE = 4;
        public static final int SPAN_NAME = 5;
        public static final int SPAN_KIND = 6;
        public static final int SERVICE_NAME = 7;
        public static final int RESOURCE_ATTRIBUTES = 8;
        public static final int SCOPE_NAME = 9;
        public static final int SCOPE_VERSION = 10;
        public static final int SPAN_ATTRIBUTES = 11;
        public static final int DURATION = 12;
        public static final int STATUS_CODE = 13;
        public static final int STATUS_MESSAGE = 14;
        public static final int EVENTS_TIMESTAMP = 15;
        public static final int EVENTS_NAME = 16;
        public static final int EVENTS_ATTRIBUTES = 17;
        public static final int LINKS_TRACE_ID = 18;
        public static final int LINKS_SPAN_ID = 19;
        public static final int LINKS_TRACE_STATE = 20;
        public static final int LINKS_ATTRIBUTES = 21;

        private Traces() {
        }
    }

    /** Column positions of {@code otel_logs}. */
    public static final class Logs {
        public static final int TIMESTAMP = 0;
        public static final int TRACE_ID = 1;
        public static final int SPAN_ID = 2;
        public static final int TRACE_FLAGS = 3;
        public static final int SEVERITY_TEXT = 4;
        public static final int SEVERITY_NUMBER = 5;
        public static final int SERVICE_NAME = 6;
        public static final int BODY = 7;
        public static final int RESOURCE_SCHEMA_URL = 8;
        public static final int RESOURCE_ATTRIBUTES = 9;
        public static final int SCOPE_SCHEMA_URL = 10;
        public static final int SCOPE_NAME = 11;
        public static final int SCOPE_VERSION = 12;
        public static final int SCOPE_ATTRIBUTES = 13;
        public static final int LOG_ATTRIBUTES = 14;

        private Logs() {
        }
    }

    /** Column positions shared by all metric schemas and the union. */
    public static final class MetricBase {
        public static final int TIMESTAMP = 0;
        public static final int SERVICE_NAME = 1;
        public static final int METRIC_NAME = 2;
        public static final int METRIC_DESCRIPTION = 3;
        public static final int METRIC_UNIT = 4;
        public static final int RESOURCE_ATTRIBUTES = 5;
        public static final int SCOPE_NAME = 6;
        public static final int SCOPE_VERSION = 7;
        public static final int ATTRIBUTES = 8;
        /** Number of base columns. */
        public static final int WIDTH = 9;

        private MetricBase() {
        }
    }

    /** Column positions of the 27-column metric union. */
    public static final class Union {
        public static final int METRIC_TYPE = 9;
        public static final int VALUE = 10;
        public static final int AGGREGATION_TEMPORALITY = 11;
        public static final int IS_MONOTONIC = 12;
        public static final int COUNT = 13;
        public static final int SUM = 14;
        public static final int BUCKET_COUNTS = 15;
        public static final int EXPLICIT_BOUNDS = 16;
        public static final int SCALE = 17;
        public static final int ZERO_COUNT = 18;
        public static final int POSITIVE_OFFSET = 19;
        public static final int POSITIVE_BUCKET_COUNTS = 20;
        public static final int NEGATIVE_OFFSET = 21;
        public static final int NEGATIVE_BUCKET_COUNTS = 22;
        public static final int QUANTILE_VALUES = 23;
        public static final int QUANTILE_QUANTILES = 24;
        public static final int MIN = 25;
        public static final int MAX = 26;

        private Union() {
        }
    }

    private static final TableSchema TRACES = TableSchema.builder(TableKind.TRACES.getTableName())
            .column("Timestamp", DataType.TIMESTAMP_NS)
            .column("TraceId", DataType.VARCHAR)
            .column("SpanId", DataType.VARCHAR)
            .column("ParentSpanId", DataType.VARCHAR)
            .column("TraceState", DataType.VARCHAR)
            .column("SpanName", DataType.VARCHAR)
            .column("SpanKind", DataType.VARCHAR)
            .column("ServiceName", DataType.VARCHAR)
            .column("ResourceAttributes", DataType.MAP)
            .column("ScopeName", DataType.VARCHAR)
            .column("ScopeVersion", DataType.VARCHAR)
            .column("SpanAttributes", DataType.MAP)
            .column("Duration", DataType.BIGINT)
            .column("StatusCode", DataType.VARCHAR)
            .column("StatusMessage", DataType.VARCHAR)
            .column("Events.Timestamp", DataType.listOf(DataType.TIMESTAMP_NS))
            .column("Events.Name", STRING_LIST)
            .column("Events.Attributes", MAP_LIST)
            .column("Links.TraceId", STRING_LIST)
            .column("Links.SpanId", STRING_LIST)
            .column("Links.TraceState", STRING_LIST)
            .column("Links.Attributes", MAP_LIST)
            .serviceDimension("ServiceName")
            .build();

    private static final TableSchema LOGS = TableSchema.builder(TableKind.LOGS.getTableName())
            .column("Timestamp", DataType.TIMESTAMP_NS)
            .column("TraceId", DataType.VARCHAR)
            .column("SpanId", DataType.VARCHAR)
            .column("TraceFlags", DataType.UINTEGER)
            .column("SeverityText", DataType.VARCHAR)
            .column("SeverityNumber", DataType.INTEGER)
            .column("ServiceName", DataType.VARCHAR)
            .column("Body", DataType.VARCHAR)
            .column("ResourceSchemaUrl", DataType.VARCHAR)
            .column("ResourceAttributes", DataType.MAP)
            .column("ScopeSchemaUrl", DataType.VARCHAR)
            .column("ScopeName", DataType.VARCHAR)
            .column("ScopeVersion", DataType.VARCHAR)
            .column("ScopeAttributes", DataType.MAP)
            .column("LogAttributes", DataType.MAP)
            .serviceDimension("ServiceName")
            .build();

    private static final List<ColumnDefinition> METRIC_BASE = List.of(
            new ColumnDefinition("Timestamp", DataType.TIMESTAMP_NS),
            new ColumnDefinition("ServiceName", DataType.VARCHAR),
            new ColumnDefinition("MetricName", DataType.VARCHAR),
            new ColumnDefinition("MetricDescription", DataType.VARCHAR),
            new ColumnDefinition("MetricUnit", DataType.VARCHAR),
            new ColumnDefinition("ResourceAttributes", DataType.MAP),
            new ColumnDefinition("ScopeName", DataType.VARCHAR),
            new ColumnDefinition("ScopeVersion", DataType.VARCHAR),
            new ColumnDefinition("Attributes", DataType.MAP));

    private static final TableSchema UNION = metricSchema("otel_metrics_union")
            .column("MetricType", DataType.VARCHAR)
            .column("Value", DataType.DOUBLE)
            .column("AggregationTemporality", DataType.INTEGER)
            .column("IsMonotonic", DataType.BOOLEAN)
            .column("Count", DataType.UBIGINT)
            .column("Sum", DataType.DOUBLE)
            .column("BucketCounts", UBIGINT_LIST)
            .column("ExplicitBounds", DOUBLE_LIST)
            .column("Scale", DataType.INTEGER)
            .column("ZeroCount", DataType.UBIGINT)
            .column("PositiveOffset", DataType.INTEGER)
            .column("PositiveBucketCounts", UBIGINT_LIST)
            .column("NegativeOffset", DataType.INTEGER)
            .column("NegativeBucketCounts", UBIGINT_LIST)
            .column("QuantileValues", DOUBLE_LIST)
            .column("QuantileQuantiles", DOUBLE_LIST)
            .column("Min", DataType.DOUBLE)
            .column("Max", DataType.DOUBLE)
            .build();

    private static final Map<MetricShape, TableSchema> METRIC_SCHEMAS = new EnumMap<>(MetricShape.class);
    private static final Map<TableKind, TableSchema> TABLE_SCHEMAS = new EnumMap<>(TableKind.class);

    static {
        for (MetricShape shape : MetricShape.values()) {
            TableSchema.Builder builder = metricSchema(shape.getTableKind().getTableName());
            for (String columnName : shapeColumnNames(shape)) {
                builder.column(columnName, UNION.typeOf(UNION.requireIndex(columnName)));
            }
            METRIC_SCHEMAS.put(shape, builder.build());
        }
        TABLE_SCHEMAS.put(TableKind.TRACES, TRACES);
        TABLE_SCHEMAS.put(TableKind.LOGS, LOGS);
        for (MetricShape shape : MetricShape.values()) {
            TABLE_SCHEMAS.put(shape.getTableKind(), METRIC_SCHEMAS.get(shape));
        }
    }

    private OtlpSchemas() {
    }

    private static TableSchema.Builder metricSchema(String tableName) {
        return TableSchema.builder(tableName)
                .columns(METRIC_BASE)
                .serviceDimension("ServiceName")
                .metricDimension("MetricName");
    }

    /**
     * Names of the shape-specific columns, in the order they follow the base columns in the
     * shape's own schema. Every name also exists in the union schema with the same type.
     *
     * @param shape the metric shape
     * @return shape-specific column names
     */
    public static List<String> shapeColumnNames(MetricShape shape) {
        return switch (shape) {
            case GAUGE -> List.of("Value");
            case SUM -> List.of("Value", "AggregationTemporality", "IsMonotonic");
            case HISTOGRAM -> List.of("Count", "Sum", "BucketCounts", "ExplicitBounds", "Min", "Max");
            case EXPONENTIAL_HISTOGRAM -> List.of("Count", "Sum", "Scale", "ZeroCount",
                    "PositiveOffset", "PositiveBucketCounts", "NegativeOffset", "NegativeBucketCounts", "Min", "Max");
            case SUMMARY -> List.of("Count", "Sum", "QuantileValues", "QuantileQuantiles");
        };
    }

    public static TableSchema traces() {
        return TRACES;
    }

    public static TableSchema logs() {
        return LOGS;
    }

    /**
     * @return the 27-column metric union schema
     */
    public static TableSchema union() {
        return UNION;
    }

    public static TableSchema forMetric(MetricShape shape) {
        return METRIC_SCHEMAS.get(shape);
    }

    public static TableSchema forTable(TableKind kind) {
        return TABLE_SCHEMAS.get(kind);
    }
}
