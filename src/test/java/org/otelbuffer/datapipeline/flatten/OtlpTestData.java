package org.otelbuffer.datapipeline.flatten;

import com.google.protobuf.ByteString;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.InstrumentationScope;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.logs.v1.LogsData;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.metrics.v1.Gauge;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.MetricsData;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import io.opentelemetry.proto.metrics.v1.Sum;
import io.opentelemetry.proto.resource.v1.Resource;

/**
 * Small OTLP messages for flattener, pipeline and service tests.
 */
public final class OtlpTestData {

    private OtlpTestData() {
    }

    public static KeyValue attribute(String key, String value) {
        return KeyValue.newBuilder().setKey(key).setValue(AnyValue.newBuilder().setStringValue(value)).build();
    }

    public static Resource resource(String serviceName) {
        return Resource.newBuilder().addAttributes(attribute("service.name", serviceName)).build();
    }

    public static LogsData logs(String serviceName, String... bodies) {
        ScopeLogs.Builder scope = ScopeLogs.newBuilder()
                .setScope(InstrumentationScope.newBuilder().setName("test-scope").setVersion("1.0"));
        long time = 1_700_000_000_000_000_000L;
        for (String body : bodies) {
            scope.addLogRecords(LogRecord.newBuilder()
                    .setTimeUnixNano(time++)
                    .setSeverityNumberValue(9)
                    .setSeverityText("INFO")
                    .setTraceId(ByteString.copyFrom(new byte[]{0x0a, 0x0b, 0x0c, 0x0d}))
                    .setBody(AnyValue.newBuilder().setStringValue(body)));
        }
        return LogsData.newBuilder()
                .addResourceLogs(ResourceLogs.newBuilder().setResource(resource(serviceName)).addScopeLogs(scope))
                .build();
    }

    /**
     * One gauge point with value 42.0 and one monotonic sum point with value 7.0.
     */
    public static MetricsData gaugeAndSum(String serviceName) {
        Metric gauge = Metric.newBuilder()
                .setName("queue.depth")
                .setUnit("1")
                .setGauge(Gauge.newBuilder().addDataPoints(NumberDataPoint.newBuilder()
                        .setTimeUnixNano(1_000_000L)
                        .setAsDouble(42.0)))
                .build();
        Metric sum = Metric.newBuilder()
                .setName("requests")
                .setSum(Sum.newBuilder()
                        .setIsMonotonic(true)
                        .setAggregationTemporalityValue(2)
                        .addDataPoints(NumberDataPoint.newBuilder()
                                .setTimeUnixNano(2_000_000L)
                                .setAsInt(7)
                                .addAttributes(attribute("route", "/home"))))
                .build();
        return MetricsData.newBuilder()
                .addResourceMetrics(ResourceMetrics.newBuilder()
                        .setResource(resource(serviceName))
                        .addScopeMetrics(ScopeMetrics.newBuilder()
                                .setScope(InstrumentationScope.newBuilder().setName("meter"))
                                .addMetrics(gauge)
                                .addMetrics(sum)))
                .build();
    }
}
