package org.otelbuffer.datapipeline.ingest;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.EnumDescriptor;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Message;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.ArrayValue;
import io.opentelemetry.proto.common.v1.InstrumentationScope;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.common.v1.KeyValueList;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.logs.v1.LogsData;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.logs.v1.SeverityNumber;
import io.opentelemetry.proto.metrics.v1.AggregationTemporality;
import io.opentelemetry.proto.metrics.v1.ExponentialHistogram;
import io.opentelemetry.proto.metrics.v1.ExponentialHistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Gauge;
import io.opentelemetry.proto.metrics.v1.Histogram;
import io.opentelemetry.proto.metrics.v1.HistogramDataPoint;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.MetricsData;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.metrics.v1.Sum;
import io.opentelemetry.proto.metrics.v1.Summary;
import io.opentelemetry.proto.metrics.v1.SummaryDataPoint;
import io.opentelemetry.proto.resource.v1.Resource;
import io.opentelemetry.proto.trace.v1.ResourceSpans;
import io.opentelemetry.proto.trace.v1.ScopeSpans;
import io.opentelemetry.proto.trace.v1.Span;
import io.opentelemetry.proto.trace.v1.Status;
import io.opentelemetry.proto.trace.v1.TracesData;
import org.otelbuffer.datapipeline.api.ingest.OtlpParseException;
import org.otelbuffer.datapipeline.api.ingest.SignalType;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Decodes OTLP/JSON documents into the protobuf object model.
 * <p>
 * The JSON is parsed into a Gson tree and copied into the generated OTLP builders field by
 * field. The decoder is lenient in the ways OTLP exporters disagree:
 * <ul>
 *   <li>field names are matched in lowerCamelCase with a snake_case fallback;</li>
 *   <li>64-bit integers may be JSON numbers or strings;</li>
 *   <li>trace and span ids are hex strings (anything that is not even-length hex is kept as its
 *       UTF-8 bytes);</li>
 *   <li>enums may be given by number or by name;</li>
 *   <li>the root may be one object or an array of objects, which are merged.</li>
 * </ul>
 * A root without the signal's key ({@code resourceSpans}, {@code resourceLogs},
 * {@code resourceMetrics}) is a parse error, as is any value of the wrong JSON type.
 * <p>
 * <strong>Thread Safety:</strong> Stateless; safe for concurrent use.
 */
public final class OtlpJsonDecoder {

    private static final Map<String, String> SNAKE_CASE = new ConcurrentHashMap<>();

    /**
     * Decodes one document or one JSON line.
     *
     * @param json   the JSON text
     * @param signal the signal the job ingests
     * @return a {@link TracesData}, {@link LogsData} or {@link MetricsData}
     * @throws OtlpParseException if the text is not well-formed OTLP/JSON for the signal
     */
    public Message decode(String json, SignalType signal) throws OtlpParseException {
        try {
            JsonElement root = JsonParser.parseString(json);
            return switch (signal) {
                case TRACES -> {
                    TracesData.Builder traces = TracesData.newBuilder();
                    forEachRoot(root, signal, element -> traces.addResourceSpans(resourceSpans(element)));
                    yield traces.build();
                }
                case LOGS -> {
                    LogsData.Builder logs = LogsData.newBuilder();
                    forEachRoot(root, signal, element -> logs.addResourceLogs(resourceLogs(element)));
                    yield logs.build();
                }
                case METRICS -> {
                    MetricsData.Builder metrics = MetricsData.newBuilder();
                    forEachRoot(root, signal, element -> metrics.addResourceMetrics(resourceMetrics(element)));
                    yield metrics.build();
                }
            };
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                 | ClassCastException | ArithmeticException | IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            throw new OtlpParseException("Invalid OTLP JSON: " + e.getMessage(), e);
        }
    }

    private static void forEachRoot(JsonElement root, SignalType signal, Consumer<JsonElement> consumer) {
        if (root.isJsonArray()) {
            for (JsonElement document : root.getAsJsonArray()) {
                forEachRoot(document.getAsJsonObject(), signal, consumer);
            }
            return;
        }
        if (!root.isJsonObject()) {
            throw new IllegalStateException("Expected a JSON object at the document root");
        }
        JsonElement resources = member(root.getAsJsonObject(), signal.getJsonRootKey());
        if (resources == null) {
            throw new IllegalStateException("Missing '" + signal.getJsonRootKey() + "' at the document root");
        }
        for (JsonElement element : resources.getAsJsonArray()) {
            consumer.accept(element);
        }
    }

    // ---- traces ----

    private static ResourceSpans resourceSpans(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        ResourceSpans.Builder builder = ResourceSpans.newBuilder();
        ifPresent(object, "resource", v -> builder.setResource(resource(v)));
        ifPresent(object, "schemaUrl", v -> builder.setSchemaUrl(v.getAsString()));
        forEach(object, "scopeSpans", v -> builder.addScopeSpans(scopeSpans(v)));
        return builder.build();
    }

    private static ScopeSpans scopeSpans(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        ScopeSpans.Builder builder = ScopeSpans.newBuilder();
        ifPresent(object, "scope", v -> builder.setScope(scope(v)));
        ifPresent(object, "schemaUrl", v -> builder.setSchemaUrl(v.getAsString()));
        forEach(object, "spans", v -> builder.addSpans(span(v)));
        return builder.build();
    }

    private static Span span(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        Span.Builder builder = Span.newBuilder();
        ifPresent(object, "traceId", v -> builder.setTraceId(id(v)));
        ifPresent(object, "spanId", v -> builder.setSpanId(id(v)));
        ifPresent(object, "parentSpanId", v -> builder.setParentSpanId(id(v)));
        ifPresent(object, "traceState", v -> builder.setTraceState(v.getAsString()));
        ifPresent(object, "flags", v -> builder.setFlags((int) u32(v)));
        ifPresent(object, "name", v -> builder.setName(v.getAsString()));
        ifPresent(object, "kind", v -> builder.setKindValue(enumValue(v, Span.SpanKind.getDescriptor())));
        ifPresent(object, "startTimeUnixNano", v -> builder.setStartTimeUnixNano(u64(v)));
        ifPresent(object, "endTimeUnixNano", v -> builder.setEndTimeUnixNano(u64(v)));
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        ifPresent(object, "droppedAttributesCount", v -> builder.setDroppedAttributesCount((int) u32(v)));
        forEach(object, "events", v -> builder.addEvents(event(v)));
        forEach(object, "links", v -> builder.addLinks(link(v)));
        ifPresent(object, "status", v -> builder.setStatus(status(v)));
        return builder.build();
    }

    private static Span.Event event(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        Span.Event.Builder builder = Span.Event.newBuilder();
        ifPresent(object, "timeUnixNano", v -> builder.setTimeUnixNano(u64(v)));
        ifPresent(object, "name", v -> builder.setName(v.getAsString()));
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        return builder.build();
    }

    private static Span.Link link(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        Span.Link.Builder builder = Span.Link.newBuilder();
        ifPresent(object, "traceId", v -> builder.setTraceId(id(v)));
        ifPresent(object, "spanId", v -> builder.setSpanId(id(v)));
        ifPresent(object, "traceState", v -> builder.setTraceState(v.getAsString()));
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        return builder.build();
    }

    private static Status status(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        Status.Builder builder = Status.newBuilder();
        ifPresent(object, "message", v -> builder.setMessage(v.getAsString()));
        ifPresent(object, "code", v -> builder.setCodeValue(enumValue(v, Status.StatusCode.getDescriptor())));
        return builder.build();
    }

    // ---- logs ----

    private static ResourceLogs resourceLogs(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        ResourceLogs.Builder builder = ResourceLogs.newBuilder();
        ifPresent(object, "resource", v -> builder.setResource(resource(v)));
        ifPresent(object, "schemaUrl", v -> builder.setSchemaUrl(v.getAsString()));
        forEach(object, "scopeLogs", v -> builder.addScopeLogs(scopeLogs(v)));
        return builder.build();
    }

    private static ScopeLogs scopeLogs(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        ScopeLogs.Builder builder = ScopeLogs.newBuilder();
        ifPresent(object, "scope", v -> builder.setScope(scope(v)));
        ifPresent(object, "schemaUrl", v -> builder.setSchemaUrl(v.getAsString()));
        forEach(object, "logRecords", v -> builder.addLogRecords(logRecord(v)));
        return builder.build();
    }

    private static LogRecord logRecord(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        LogRecord.Builder builder = LogRecord.newBuilder();
        ifPresent(object, "timeUnixNano", v -> builder.setTimeUnixNano(u64(v)));
        ifPresent(object, "observedTimeUnixNano", v -> builder.setObservedTimeUnixNano(u64(v)));
        ifPresent(object, "severityNumber", v -> builder.setSeverityNumberValue(enumValue(v, SeverityNumber.getDescriptor())));
        ifPresent(object, "severityText", v -> builder.setSeverityText(v.getAsString()));
        ifPresent(object, "body", v -> builder.setBody(anyValue(v)));
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        ifPresent(object, "droppedAttributesCount", v -> builder.setDroppedAttributesCount((int) u32(v)));
        ifPresent(object, "flags", v -> builder.setFlags((int) u32(v)));
        ifPresent(object, "traceId", v -> builder.setTraceId(id(v)));
        ifPresent(object, "spanId", v -> builder.setSpanId(id(v)));
        return builder.build();
    }

    // ---- metrics ----

    private static ResourceMetrics resourceMetrics(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        ResourceMetrics.Builder builder = ResourceMetrics.newBuilder();
        ifPresent(object, "resource", v -> builder.setResource(resource(v)));
        ifPresent(object, "schemaUrl", v -> builder.setSchemaUrl(v.getAsString()));
        forEach(object, "scopeMetrics", v -> builder.addScopeMetrics(scopeMetrics(v)));
        return builder.build();
    }

    private static ScopeMetrics scopeMetrics(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        ScopeMetrics.Builder builder = ScopeMetrics.newBuilder();
        ifPresent(object, "scope", v -> builder.setScope(scope(v)));
        ifPresent(object, "schemaUrl", v -> builder.setSchemaUrl(v.getAsString()));
        forEach(object, "metrics", v -> builder.addMetrics(metric(v)));
        return builder.build();
    }

    private static Metric metric(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        Metric.Builder builder = Metric.newBuilder();
        ifPresent(object, "name", v -> builder.setName(v.getAsString()));
        ifPresent(object, "description", v -> builder.setDescription(v.getAsString()));
        ifPresent(object, "unit", v -> builder.setUnit(v.getAsString()));
        ifPresent(object, "gauge", v -> {
            Gauge.Builder gauge = Gauge.newBuilder();
            forEach(v.getAsJsonObject(), "dataPoints", p -> gauge.addDataPoints(numberPoint(p)));
            builder.setGauge(gauge);
        });
        ifPresent(object, "sum", v -> {
            JsonObject sumObject = v.getAsJsonObject();
            Sum.Builder sum = Sum.newBuilder();
            forEach(sumObject, "dataPoints", p -> sum.addDataPoints(numberPoint(p)));
            ifPresent(sumObject, "aggregationTemporality",
                    t -> sum.setAggregationTemporalityValue(enumValue(t, AggregationTemporality.getDescriptor())));
            ifPresent(sumObject, "isMonotonic", m -> sum.setIsMonotonic(m.getAsBoolean()));
            builder.setSum(sum);
        });
        ifPresent(object, "histogram", v -> {
            JsonObject histogramObject = v.getAsJsonObject();
            Histogram.Builder histogram = Histogram.newBuilder();
            forEach(histogramObject, "dataPoints", p -> histogram.addDataPoints(histogramPoint(p)));
            ifPresent(histogramObject, "aggregationTemporality",
                    t -> histogram.setAggregationTemporalityValue(enumValue(t, AggregationTemporality.getDescriptor())));
            builder.setHistogram(histogram);
        });
        ifPresent(object, "exponentialHistogram", v -> {
            JsonObject histogramObject = v.getAsJsonObject();
            ExponentialHistogram.Builder histogram = ExponentialHistogram.newBuilder();
            forEach(histogramObject, "dataPoints", p -> histogram.addDataPoints(exponentialPoint(p)));
            ifPresent(histogramObject, "aggregationTemporality",
                    t -> histogram.setAggregationTemporalityValue(enumValue(t, AggregationTemporality.getDescriptor())));
            builder.setExponentialHistogram(histogram);
        });
        ifPresent(object, "summary", v -> {
            Summary.Builder summary = Summary.newBuilder();
            forEach(v.getAsJsonObject(), "dataPoints", p -> summary.addDataPoints(summaryPoint(p)));
            builder.setSummary(summary);
        });
        return builder.build();
    }

    private static NumberDataPoint numberPoint(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        NumberDataPoint.Builder builder = NumberDataPoint.newBuilder();
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        ifPresent(object, "startTimeUnixNano", v -> builder.setStartTimeUnixNano(u64(v)));
        ifPresent(object, "timeUnixNano", v -> builder.setTimeUnixNano(u64(v)));
        ifPresent(object, "asDouble", v -> builder.setAsDouble(f64(v)));
        ifPresent(object, "asInt", v -> builder.setAsInt(i64(v)));
        ifPresent(object, "flags", v -> builder.setFlags((int) u32(v)));
        return builder.build();
    }

    private static HistogramDataPoint histogramPoint(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        HistogramDataPoint.Builder builder = HistogramDataPoint.newBuilder();
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        ifPresent(object, "startTimeUnixNano", v -> builder.setStartTimeUnixNano(u64(v)));
        ifPresent(object, "timeUnixNano", v -> builder.setTimeUnixNano(u64(v)));
        ifPresent(object, "count", v -> builder.setCount(u64(v)));
        ifPresent(object, "sum", v -> builder.setSum(f64(v)));
        forEach(object, "bucketCounts", v -> builder.addBucketCounts(u64(v)));
        forEach(object, "explicitBounds", v -> builder.addExplicitBounds(f64(v)));
        ifPresent(object, "flags", v -> builder.setFlags((int) u32(v)));
        ifPresent(object, "min", v -> builder.setMin(f64(v)));
        ifPresent(object, "max", v -> builder.setMax(f64(v)));
        return builder.build();
    }

    private static ExponentialHistogramDataPoint exponentialPoint(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        ExponentialHistogramDataPoint.Builder builder = ExponentialHistogramDataPoint.newBuilder();
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        ifPresent(object, "startTimeUnixNano", v -> builder.setStartTimeUnixNano(u64(v)));
        ifPresent(object, "timeUnixNano", v -> builder.setTimeUnixNano(u64(v)));
        ifPresent(object, "count", v -> builder.setCount(u64(v)));
        ifPresent(object, "sum", v -> builder.setSum(f64(v)));
        ifPresent(object, "scale", v -> builder.setScale(i32(v)));
        ifPresent(object, "zeroCount", v -> builder.setZeroCount(u64(v)));
        ifPresent(object, "positive", v -> builder.setPositive(buckets(v)));
        ifPresent(object, "negative", v -> builder.setNegative(buckets(v)));
        ifPresent(object, "flags", v -> builder.setFlags((int) u32(v)));
        ifPresent(object, "min", v -> builder.setMin(f64(v)));
        ifPresent(object, "max", v -> builder.setMax(f64(v)));
        ifPresent(object, "zeroThreshold", v -> builder.setZeroThreshold(f64(v)));
        return builder.build();
    }

    private static ExponentialHistogramDataPoint.Buckets buckets(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        ExponentialHistogramDataPoint.Buckets.Builder builder = ExponentialHistogramDataPoint.Buckets.newBuilder();
        ifPresent(object, "offset", v -> builder.setOffset(i32(v)));
        forEach(object, "bucketCounts", v -> builder.addBucketCounts(u64(v)));
        return builder.build();
    }

    private static SummaryDataPoint summaryPoint(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        SummaryDataPoint.Builder builder = SummaryDataPoint.newBuilder();
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        ifPresent(object, "startTimeUnixNano", v -> builder.setStartTimeUnixNano(u64(v)));
        ifPresent(object, "timeUnixNano", v -> builder.setTimeUnixNano(u64(v)));
        ifPresent(object, "count", v -> builder.setCount(u64(v)));
        ifPresent(object, "sum", v -> builder.setSum(f64(v)));
        forEach(object, "quantileValues", v -> {
            JsonObject quantile = v.getAsJsonObject();
            SummaryDataPoint.ValueAtQuantile.Builder q = SummaryDataPoint.ValueAtQuantile.newBuilder();
            ifPresent(quantile, "quantile", x -> q.setQuantile(f64(x)));
            ifPresent(quantile, "value", x -> q.setValue(f64(x)));
            builder.addQuantileValues(q);
        });
        ifPresent(object, "flags", v -> builder.setFlags((int) u32(v)));
        return builder.build();
    }

    // ---- common ----

    private static Resource resource(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        Resource.Builder builder = Resource.newBuilder();
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        ifPresent(object, "droppedAttributesCount", v -> builder.setDroppedAttributesCount((int) u32(v)));
        return builder.build();
    }

    private static InstrumentationScope scope(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        InstrumentationScope.Builder builder = InstrumentationScope.newBuilder();
        ifPresent(object, "name", v -> builder.setName(v.getAsString()));
        ifPresent(object, "version", v -> builder.setVersion(v.getAsString()));
        forEach(object, "attributes", v -> builder.addAttributes(keyValue(v)));
        ifPresent(object, "droppedAttributesCount", v -> builder.setDroppedAttributesCount((int) u32(v)));
        return builder.build();
    }

    private static KeyValue keyValue(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        KeyValue.Builder builder = KeyValue.newBuilder();
        ifPresent(object, "key", v -> builder.setKey(v.getAsString()));
        ifPresent(object, "value", v -> builder.setValue(anyValue(v)));
        return builder.build();
    }

    private static AnyValue anyValue(JsonElement element) {
        JsonObject object = element.getAsJsonObject();
        AnyValue.Builder builder = AnyValue.newBuilder();
        ifPresent(object, "stringValue", v -> builder.setStringValue(v.getAsString()));
        ifPresent(object, "boolValue", v -> builder.setBoolValue(v.getAsBoolean()));
        ifPresent(object, "intValue", v -> builder.setIntValue(i64(v)));
        ifPresent(object, "doubleValue", v -> builder.setDoubleValue(f64(v)));
        ifPresent(object, "bytesValue", v -> builder.setBytesValue(ByteString.copyFrom(Base64.getDecoder().decode(v.getAsString()))));
        ifPresent(object, "arrayValue", v -> {
            ArrayValue.Builder array = ArrayValue.newBuilder();
            forEach(v.getAsJsonObject(), "values", x -> array.addValues(anyValue(x)));
            builder.setArrayValue(array);
        });
        ifPresent(object, "kvlistValue", v -> {
            KeyValueList.Builder list = KeyValueList.newBuilder();
            forEach(v.getAsJsonObject(), "values", x -> list.addValues(keyValue(x)));
            builder.setKvlistValue(list);
        });
        return builder.build();
    }

    // ---- scalars ----

    private static ByteString id(JsonElement element) {
        String text = element.getAsString();
        if (text.length() % 2 == 0 && isHex(text)) {
            return ByteString.copyFrom(HexFormat.of().parseHex(text));
        }
        return ByteString.copyFrom(text, StandardCharsets.UTF_8);
    }

    private static boolean isHex(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static long u64(JsonElement element) {
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isString()) {
            return Long.parseUnsignedLong(primitive.getAsString().trim());
        }
        BigInteger value = primitive.getAsBigDecimal().toBigIntegerExact();
        if (value.signum() < 0 || value.bitLength() > 64) {
            throw new ArithmeticException("Value out of unsigned 64-bit range: " + value);
        }
        return value.longValue();
    }

    private static long u32(JsonElement element) {
        long value = i64(element);
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new ArithmeticException("Value out of unsigned 32-bit range: " + value);
        }
        return value;
    }

    private static long i64(JsonElement element) {
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isString()) {
            return Long.parseLong(primitive.getAsString().trim());
        }
        return primitive.getAsBigDecimal().longValueExact();
    }

    private static int i32(JsonElement element) {
        return Math.toIntExact(i64(element));
    }

    private static double f64(JsonElement element) {
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isString()) {
            // OTLP/JSON spells non-finite values as "NaN", "Infinity" and "-Infinity"
            return Double.parseDouble(primitive.getAsString().trim());
        }
        return primitive.getAsDouble();
    }

    private static int enumValue(JsonElement element, EnumDescriptor descriptor) {
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return Math.toIntExact(primitive.getAsBigDecimal().longValueExact());
        }
        String name = primitive.getAsString().trim();
        EnumValueDescriptor value = descriptor.findValueByName(name);
        if (value == null) {
            value = descriptor.findValueByName(name.toUpperCase(Locale.ROOT));
        }
        if (value == null) {
            throw new IllegalArgumentException("Unknown " + descriptor.getName() + " value: " + name);
        }
        return value.getNumber();
    }

    // ---- member access ----

    private static JsonElement member(JsonObject object, String camelName) {
        JsonElement element = object.get(camelName);
        if (element == null) {
            element = object.get(SNAKE_CASE.computeIfAbsent(camelName, OtlpJsonDecoder::toSnakeCase));
        }
        return element == null || element.isJsonNull() ? null : element;
    }

    private static void ifPresent(JsonObject object, String camelName, Consumer<JsonElement> consumer) {
        JsonElement element = member(object, camelName);
        if (element != null) {
            consumer.accept(element);
        }
    }

    private static void forEach(JsonObject object, String camelName, Consumer<JsonElement> consumer) {
        JsonElement element = member(object, camelName);
        if (element == null) {
            return;
        }
        JsonArray array = element.getAsJsonArray();
        for (JsonElement item : array) {
            consumer.accept(item);
        }
    }

    private static String toSnakeCase(String camelName) {
        StringBuilder snake = new StringBuilder(camelName.length() + 4);
        for (int i = 0; i < camelName.length(); i++) {
            char c = camelName.charAt(i);
            if (Character.isUpperCase(c)) {
                snake.append('_').append(Character.toLowerCase(c));
            } else {
                snake.append(c);
            }
        }
        return snake.toString();
    }
}
