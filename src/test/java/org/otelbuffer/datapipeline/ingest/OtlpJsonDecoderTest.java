package org.otelbuffer.datapipeline.ingest;

import com.google.protobuf.ByteString;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.logs.v1.LogsData;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.MetricsData;
import io.opentelemetry.proto.trace.v1.Span;
import io.opentelemetry.proto.trace.v1.TracesData;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.otelbuffer.datapipeline.api.ingest.OtlpParseException;
import org.otelbuffer.datapipeline.api.ingest.SignalType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class OtlpJsonDecoderTest {

    private final OtlpJsonDecoder decoder = new OtlpJsonDecoder();

    private static String fixture(String name) throws IOException {
        try (InputStream in = OtlpJsonDecoderTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void decodesTracesFixture() throws Exception {
        TracesData traces = (TracesData) decoder.decode(fixture("traces.json"), SignalType.TRACES);

        assertThat(traces.getResourceSpansCount()).isEqualTo(1);
        Span root = traces.getResourceSpans(0).getScopeSpans(0).getSpans(0);
        Span child = traces.getResourceSpans(0).getScopeSpans(0).getSpans(1);
        assertThat(root.getTraceId().size()).isEqualTo(16);
        assertThat(root.getKind()).isEqualTo(Span.SpanKind.SPAN_KIND_SERVER);
        assertThat(root.getStartTimeUnixNano()).isEqualTo(1_700_000_000_000_000_000L);
        assertThat(root.getStatus().getCodeValue()).isEqualTo(1);
        assertThat(root.getAttributes(0).getValue().getIntValue()).isEqualTo(200L);
        assertThat(child.getKind()).isEqualTo(Span.SpanKind.SPAN_KIND_CLIENT);
        assertThat(child.getParentSpanId()).isEqualTo(root.getSpanId());
    }

    @Test
    void decodesMetricsFixtureWithEnumNamesAndStringInts() throws Exception {
        MetricsData metrics = (MetricsData) decoder.decode(fixture("metrics-gauge-sum.json"), SignalType.METRICS);

        Metric gauge = metrics.getResourceMetrics(0).getScopeMetrics(0).getMetrics(0);
        Metric sum = metrics.getResourceMetrics(0).getScopeMetrics(0).getMetrics(1);
        assertThat(gauge.getGauge().getDataPoints(0).getAsDouble()).isEqualTo(42.0);
        assertThat(sum.getSum().getIsMonotonic()).isTrue();
        assertThat(sum.getSum().getAggregationTemporalityValue()).isEqualTo(2);
        assertThat(sum.getSum().getDataPoints(0).getAsInt()).isEqualTo(7L);
    }

    @Test
    void acceptsSnakeCaseKeysAndNumericTimestamps() throws Exception {
        String json = "{\"resource_logs\":[{\"scope_logs\":[{\"log_records\":[{\"time_unix_nano\":1000,"
                + "\"severity_number\":\"severity_number_error\",\"body\":{\"string_value\":\"x\"}}]}]}]}";

        LogsData logs = (LogsData) decoder.decode(json, SignalType.LOGS);

        LogRecord record = logs.getResourceLogs(0).getScopeLogs(0).getLogRecords(0);
        assertThat(record.getTimeUnixNano()).isEqualTo(1000L);
        assertThat(record.getSeverityNumberValue()).isEqualTo(17);
        assertThat(record.getBody().getStringValue()).isEqualTo("x");
    }

    @Test
    void mergesRootArrays() throws Exception {
        String json = "[{\"resourceLogs\":[{}]},{\"resourceLogs\":[{},{}]}]";

        LogsData logs = (LogsData) decoder.decode(json, SignalType.LOGS);

        assertThat(logs.getResourceLogsCount()).isEqualTo(3);
    }

    @Test
    void idsThatAreNotHexKeepTheirBytes() throws Exception {
        String json = "{\"resourceSpans\":[{\"scopeSpans\":[{\"spans\":[{\"traceId\":\"abc\",\"spanId\":\"0aff\"}]}]}]}";

        Span span = ((TracesData) decoder.decode(json, SignalType.TRACES)).getResourceSpans(0).getScopeSpans(0).getSpans(0);

        assertThat(span.getTraceId()).isEqualTo(ByteString.copyFromUtf8("abc"));
        assertThat(span.getSpanId()).isEqualTo(ByteString.copyFrom(new byte[]{0x0a, (byte) 0xff}));
    }

    @Test
    void emptyResourceListIsNotAnError() throws Exception {
        LogsData logs = (LogsData) decoder.decode("{\"resourceLogs\":[]}", SignalType.LOGS);

        assertThat(logs.getResourceLogsCount()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"resourceLogs\":[{\"scopeLogs\":[{\"logRecords\":[{\"timeUnixNano\":",
            "{\"resourceSpans\":[]}",
            "{\"resourceLogs\":{}}",
            "{\"resourceLogs\":[{\"scopeLogs\":[{\"logRecords\":[{\"timeUnixNano\":\"soon\"}]}]}]}",
            "{\"resourceLogs\":[{\"scopeLogs\":[{\"logRecords\":[{\"severityNumber\":\"LOUD\"}]}]}]}",
            "{\"resourceLogs\":[{\"scopeLogs\":[{\"logRecords\":[{\"timeUnixNano\":-5}]}]}]}",
            "42"
    })
    void malformedDocumentsAreParseErrors(String json) {
        assertThatThrownBy(() -> decoder.decode(json, SignalType.LOGS))
                .isInstanceOf(OtlpParseException.class)
                .hasMessageStartingWith("Invalid OTLP JSON");
    }
}
