package org.otelbuffer.datapipeline.flatten;

import com.google.protobuf.Message;
import io.opentelemetry.proto.common.v1.InstrumentationScope;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.logs.v1.LogsData;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.metrics.v1.ExponentialHistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.HistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.MetricsData;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.metrics.v1.SummaryDataPoint;
import io.opentelemetry.proto.resource.v1.Resource;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;
import io.opentelemetry.proto.trace.v1.Span;
import io.opentelemetry.proto.trace.v1.TracesData;
import org.otelbuffer.datapipeline.api.schema.MetricShape;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas.Logs;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas.MetricBase;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas.Traces;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts decoded OTLP records, with their enclosing resource and scope, into typed rows.
 * <p>
 * <ul>
 *   <li>Traces: one row per span. Ids become lowercase hex; {@code Duration} is
 *       {@code end - start} and is passed through even when negative.</li>
 *   <li>Logs: one row per log record. The timestamp falls back to the observed time when the
 *       event time is zero.</li>
 *   <li>Metrics: one row per data point, routed by {@link MetricShape}. Metrics carrying no
 *       data are dropped and counted.</li>
 * </ul>
 * The service name of every row comes from the resource's {@code service.name} attribute.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe because of the dropped-metric counter; use
 * one instance per worker.
 */
public class RecordFlattener {

    private static final Logger log = LoggerFactory.getLogger(RecordFlattener.class);

    private final MetricShape shapeFilter;
    private long droppedMetrics;

    /**
     * Creates a flattener that emits every metric shape.
     */
    public RecordFlattener() {
        this(null);
    }

    /**
     * Creates a flattener that emits only data points of one metric shape.
     *
     * @param shapeFilter the shape to keep, or null for all shapes
     */
    public RecordFlattener(MetricShape shapeFilter) {
        this.shapeFilter = shapeFilter;
    }

    public MetricShape getShapeFilter() {
        return shapeFilter;
    }

    /**
     * @return number of metrics dropped because they carried no data
     */
    public long getDroppedMetricCount() {
        return droppedMetrics;
    }

    /**
     * Flattens any of {@link TracesData}, {@link LogsData} or {@link MetricsData}.
     *
     * @param message the decoded message
     * @param sink    row destination
     * @return number of rows emitted
     * @throws IllegalArgumentException for other message types
     */
    public int flatten(Message message, RowSink sink) {
        if (message instanceof TracesData traces) {
            return flattenTraces(traces, sink);
        }
        if (message instanceof LogsData logs) {
            return flattenLogs(logs, sink);
        }
        if (message instanceof MetricsData metrics) {
            return flattenMetrics(metrics, sink);
        }
        throw new IllegalArgumentException("Unsupported OTLP message type: " + message.getDescriptorForType().getFullName());
    }

    public int flattenTraces(TracesData data, RowSink sink) {
        int rows = 0;
        for (ResourceSpans resourceSpans : data.getResourceSpansList()) {
            Resource resource = resourceSpans.getResource();
            String serviceName = AttributeFlattener.serviceName(resource);
            Map<String, String> resourceAttributes = AttributeFlattener.flatten(resource.getAttributesList());
            for (ScopeSpans scopeSpans : resourceSpans.getScopeSpansList()) {
                InstrumentationScope scope = scopeSpans.getScope();
                for (Span span : scopeSpans.getSpansList()) {
                    sink.accept(TableKind.TRACES, spanRow(serviceName, resourceAttributes, scope, span));
                    rows++;
                }
            }
        }
        return rows;
    }

    public int flattenLogs(LogsData data, RowSink sink) {
        int rows = 0;
        for (ResourceLogs resourceLogs : data.getResourceLogsList()) {
            Resource resource = resourceLogs.getResource();
            String serviceName = AttributeFlattener.serviceName(resource);
            Map<String, String> resourceAttributes = AttributeFlattener.flatten(resource.getAttributesList());
            for (ScopeLogs scopeLogs : resourceLogs.getScopeLogsList()) {
                for (LogRecord record : scopeLogs.getLogRecordsList()) {
                    sink.accept(TableKind.LOGS, logRow(serviceName, resourceAttributes, resourceLogs.getSchemaUrl(),
                            scopeLogs, record));
                    rows++;
                }
            }
        }
        return rows;
    }

    public int flattenMetrics(MetricsData data, RowSink sink) {
        int rows = 0;
        for (ResourceMetrics resourceMetrics : data.getResourceMetricsList()) {
            Resource resource = resourceMetrics.getResource();
            MetricContext context = new MetricContext(AttributeFlattener.serviceName(resource),
                    AttributeFlattener.flatten(resource.getAttributesList()));
            for (ScopeMetrics scopeMetrics : resourceMetrics.getScopeMetricsList()) {
                InstrumentationScope scope = scopeMetrics.getScope();
                for (Metric metric : scopeMetrics.getMetricsList()) {
                    rows += flattenMetric(context, scope, metric, sink);
                }
            }
        }
        return rows;
    }

    /**
     * Maps a metric's populated data field to its shape.
     *
     * @param metric the metric
     * @return the shape, or null if no data field is set
     */
    public static MetricShape shapeOf(Metric metric) {
        switch (metric.getDataCase()) {
            case GAUGE:
                return MetricShape.GAUGE;
            case SUM:
                return MetricShape.SUM;
            case HISTOGRAM:
                return MetricShape.HISTOGRAM;
            case EXPONENTIAL_HISTOGRAM:
                return MetricShape.EXPONENTIAL_HISTOGRAM;
            case SUMMARY:
                return MetricShape.SUMMARY;
            default:
                return null;
        }
    }

    private int flattenMetric(MetricContext context, InstrumentationScope scope, Metric metric, RowSink sink) {
        MetricShape shape = shapeOf(metric);
        if (shape == null) {
            droppedMetrics++;
            log.debug("Dropping metric '{}' without data", metric.getName());
            return 0;
        }
        if (shapeFilter != null && shape != shapeFilter) {
            return 0;
        }
        TableKind table = shape.getTableKind();
        int arity = OtlpSchemas.forMetric(shape).arity();
        int rows = 0;
        switch (shape) {
            case GAUGE -> {
                for (NumberDataPoint point : metric.getGauge().getDataPointsList()) {
                    Row.Builder row = baseRow(arity, context, scope, metric, point.getTimeUnixNano(), point.getAttributesList());
                    row.set(MetricBase.WIDTH, numberValue(point));
                    sink.accept(table, row.build());
                    rows++;
                }
            }
            case SUM -> {
                int temporality = metric.getSum().getAggregationTemporalityValue();
                boolean monotonic = metric.getSum().getIsMonotonic();
                for (NumberDataPoint point : metric.getSum().getDataPointsList()) {
                    Row.Builder row = baseRow(arity, context, scope, metric, point.getTimeUnixNano(), point.getAttributesList());
                    row.set(MetricBase.WIDTH, numberValue(point));
                    row.set(MetricBase.WIDTH + 1, temporality);
                    row.set(MetricBase.WIDTH + 2, monotonic);
                    sink.accept(table, row.build());
                    rows++;
                }
            }
            case HISTOGRAM -> {
                for (HistogramDataPoint point : metric.getHistogram().getDataPointsList()) {
                    Row.Builder row = baseRow(arity, context, scope, metric, point.getTimeUnixNano(), point.getAttributesList());
                    int c = MetricBase.WIDTH;
                    row.set(c, point.getCount());
                    row.set(c + 1, point.hasSum() ? point.getSum() : null);
                    row.set(c + 2, List.copyOf(point.getBucketCountsList()));
                    row.set(c + 3, List.copyOf(point.getExplicitBoundsList()));
                    row.set(c + 4, point.hasMin() ? point.getMin() : null);
                    row.set(c + 5, point.hasMax() ? point.getMax() : null);
                    sink.accept(table, row.build());
                    rows++;
                }
            }
            case EXPONENTIAL_HISTOGRAM -> {
                for (ExponentialHistogramDataPoint point : metric.getExponentialHistogram().getDataPointsList()) {
                    Row.Builder row = baseRow(arity, context, scope, metric, point.getTimeUnixNano(), point.getAttributesList());
                    int c = MetricBase.WIDTH;
                    row.set(c, point.getCount());
                    row.set(c + 1, point.hasSum() ? point.getSum() : null);
                    row.set(c + 2, point.getScale());
                    row.set(c + 3, point.getZeroCount());
                    row.set(c + 4, point.getPositive().getOffset());
                    row.set(c + 5, List.copyOf(point.getPositive().getBucketCountsList()));
                    row.set(c + 6, point.getNegative().getOffset());
                    row.set(c + 7, List.copyOf(point.getNegative().getBucketCountsList()));
                    row.set(c + 8, point.hasMin() ? point.getMin() : null);
                    row.set(c + 9, point.hasMax() ? point.getMax() : null);
                    sink.accept(table, row.build());
                    rows++;
                }
            }
            case SUMMARY -> {
                for (SummaryDataPoint point : metric.getSummary().getDataPointsList()) {
                    Row.Builder row = baseRow(arity, context, scope, metric, point.getTimeUnixNano(), point.getAttributesList());
                    List<Double> values = new ArrayList<>(point.getQuantileValuesCount());
                    List<Double> quantiles = new ArrayList<>(point.getQuantileValuesCount());
                    for (SummaryDataPoint.ValueAtQuantile q : point.getQuantileValuesList()) {
                        values.add(q.getValue());
                        quantiles.add(q.getQuantile());
                    }
                    int c = MetricBase.WIDTH;
                    row.set(c, point.getCount());
                    row.set(c + 1, point.getSum());
                    row.set(c + 2, values);
                    row.set(c + 3, quantiles);
                    sink.accept(table, row.build());
                    rows++;
                }
            }
        }
        return rows;
    }

    /**
     * Builds the traces row for one span.
     */
    public Row spanRow(String serviceName, Map<String, String> resourceAttributes, InstrumentationScope scope, Span span) {
        List<Long> eventTimes = new ArrayList<>(span.getEventsCount());
        List<String> eventNames = new ArrayList<>(span.getEventsCount());
        List<Map<String, String>> eventAttributes = new ArrayList<>(span.getEventsCount());
        for (Span.Event event : span.getEventsList()) {
            eventTimes.add(event.getTimeUnixNano());
            eventNames.add(event.getName());
            eventAttributes.add(AttributeFlattener.flatten(event.getAttributesList()));
        }
        List<String> linkTraceIds = new ArrayList<>(span.getLinksCount());
        List<String> linkSpanIds = new ArrayList<>(span.getLinksCount());
        List<String> linkStates = new ArrayList<>(span.getLinksCount());
        List<Map<String, String>> linkAttributes = new ArrayList<>(span.getLinksCount());
        for (Span.Link link : span.getLinksList()) {
            linkTraceIds.add(OtlpEnumNames.hexId(link.getTraceId()));
            linkSpanIds.add(OtlpEnumNames.hexId(link.getSpanId()));
            linkStates.add(link.getTraceState());
            linkAttributes.add(AttributeFlattener.flatten(link.getAttributesList()));
        }
        return new Row.Builder(OtlpSchemas.traces().arity())
                .set(Traces.TIMESTAMP, span.getStartTimeUnixNano())
                .set(Traces.TRACE_ID, OtlpEnumNames.hexId(span.getTraceId()))
                .set(Traces.SPAN_ID, OtlpEnumNames.hexId(span.getSpanId()))
                .set(Traces.PARENT_SPAN_ID, OtlpEnumNames.hexId(span.getParentSpanId()))
                .set(Traces.TRACE_STATE, span.getTraceState())
                .set(Traces.SPAN_NAME, span.getName())
                .set(Traces.SPAN_KIND, OtlpEnumNames.spanKind(span.getKindValue()))
                .set(Traces.SERVICE_NAME, serviceName)
                .set(Traces.RESOURCE_ATTRIBUTES, resourceAttributes)
                .set(Traces.SCOPE_NAME, scope.getName())
                .set(Traces.SCOPE_VERSION, scope.getVersion())
                .set(Traces.SPAN_ATTRIBUTES, AttributeFlattener.flatten(span.getAttributesList()))
                .set(Traces.DURATION, span.getEndTimeUnixNano() - span.getStartTimeUnixNano())
                .set(Traces.STATUS_CODE, OtlpEnumNames.statusCode(span.hasStatus() ? span.getStatus().getCodeValue() : 0))
                .set(Traces.STATUS_MESSAGE, span.getStatus().getMessage())
                .set(Traces.EVENTS_TIMESTAMP, eventTimes)
                .set(Traces.EVENTS_NAME, eventNames)
                .set(Traces.EVENTS_ATTRIBUTES, eventAttributes)
                .set(Traces.LINKS_TRACE_ID, linkTraceIds)
                .set(Traces.LINKS_SPAN_ID, linkSpanIds)
                .set(Traces.LINKS_TRACE_STATE, linkStates)
                .set(Traces.LINKS_ATTRIBUTES, linkAttributes)
                .build();
    }

    /**
     * Builds the logs row for one log record.
     */
    public Row logRow(String serviceName, Map<String, String> resourceAttributes, String resourceSchemaUrl,
                      ScopeLogs scopeLogs, LogRecord record) {
        InstrumentationScope scope = scopeLogs.getScope();
        long timestamp = record.getTimeUnixNano() != 0 ? record.getTimeUnixNano() : record.getObservedTimeUnixNano();
        return new Row.Builder(OtlpSchemas.logs().arity())
                .set(Logs.TIMESTAMP, timestamp)
                .set(Logs.TRACE_ID, OtlpEnumNames.hexId(record.getTraceId()))
                .set(Logs.SPAN_ID, OtlpEnumNames.hexId(record.getSpanId()))
                .set(Logs.TRACE_FLAGS, Integer.toUnsignedLong(record.getFlags()))
                .set(Logs.SEVERITY_TEXT, record.getSeverityText())
                .set(Logs.SEVERITY_NUMBER, record.getSeverityNumberValue())
                .set(Logs.SERVICE_NAME, serviceName)
                .set(Logs.BODY, record.hasBody() ? AttributeFlattener.stringify(record.getBody()) : "")
                .set(Logs.RESOURCE_SCHEMA_URL, resourceSchemaUrl)
                .set(Logs.RESOURCE_ATTRIBUTES, resourceAttributes)
                .set(Logs.SCOPE_SCHEMA_URL, scopeLogs.getSchemaUrl())
                .set(Logs.SCOPE_NAME, scope.getName())
                .set(Logs.SCOPE_VERSION, scope.getVersion())
                .set(Logs.SCOPE_ATTRIBUTES, AttributeFlattener.flatten(scope.getAttributesList()))
                .set(Logs.LOG_ATTRIBUTES, AttributeFlattener.flatten(record.getAttributesList()))
                .build();
    }

    private static Row.Builder baseRow(int arity, MetricContext context, InstrumentationScope scope, Metric metric,
                                       long timeUnixNano, List<KeyValue> attributes) {
        return new Row.Builder(arity)
                .set(MetricBase.TIMESTAMP, timeUnixNano)
                .set(MetricBase.SERVICE_NAME, context.serviceName())
                .set(MetricBase.METRIC_NAME, metric.getName())
                .set(MetricBase.METRIC_DESCRIPTION, metric.getDescription())
                .set(MetricBase.METRIC_UNIT, metric.getUnit())
                .set(MetricBase.RESOURCE_ATTRIBUTES, context.resourceAttributes())
                .set(MetricBase.SCOPE_NAME, scope.getName())
                .set(MetricBase.SCOPE_VERSION, scope.getVersion())
                .set(MetricBase.ATTRIBUTES, AttributeFlattener.flatten(attributes));
    }

    private static Double numberValue(NumberDataPoint point) {
        switch (point.getValueCase()) {
            case AS_DOUBLE:
                return point.getAsDouble();
            case AS_INT:
                return (double) point.getAsInt();
            default:
                return null;
        }
    }

    private record MetricContext(String serviceName, Map<String, String> resourceAttributes) {
    }
}
