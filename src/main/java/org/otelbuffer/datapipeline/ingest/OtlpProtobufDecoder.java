package org.otelbuffer.datapipeline.ingest;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import io.opentelemetry.proto.logs.v1.LogsData;
import io.opentelemetry.proto.metrics.v1.MetricsData;
import io.opentelemetry.proto.trace.v1.TracesData;
import org.otelbuffer.datapipeline.api.ingest.OtlpParseException;
import org.otelbuffer.datapipeline.api.ingest.SignalType;

/**
 * Decodes a binary OTLP document ({@code TracesData}, {@code LogsData} or {@code MetricsData}).
 */
public final class OtlpProtobufDecoder {

    /**
     * @param bytes  the whole document
     * @param length number of valid bytes
     * @param signal which top-level message the bytes hold
     * @return the decoded message
     * @throws OtlpParseException if the bytes are not a valid message
     */
    public Message decode(byte[] bytes, int length, SignalType signal) throws OtlpParseException {
        try {
            return switch (signal) {
                case TRACES -> TracesData.parser().parseFrom(bytes, 0, length);
                case LOGS -> LogsData.parser().parseFrom(bytes, 0, length);
                case METRICS -> MetricsData.parser().parseFrom(bytes, 0, length);
            };
        } catch (InvalidProtocolBufferException e) {
            throw new OtlpParseException("Invalid OTLP protobuf: " + e.getMessage(), e);
        }
    }
}
