package org.otelbuffer.datapipeline.ingest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.otelbuffer.datapipeline.api.ingest.DocumentSizeLimitException;
import org.otelbuffer.datapipeline.api.ingest.IIngestionSource;
import org.otelbuffer.datapipeline.api.ingest.IngestionAbortedException;
import org.otelbuffer.datapipeline.api.ingest.IngestionException;
import org.otelbuffer.datapipeline.api.ingest.IngestionOptions;
import org.otelbuffer.datapipeline.api.ingest.OnErrorMode;
import org.otelbuffer.datapipeline.api.ingest.OtlpFormat;
import org.otelbuffer.datapipeline.api.ingest.SignalType;
import org.otelbuffer.datapipeline.api.ingest.UnknownFormatException;
import org.otelbuffer.datapipeline.api.resources.buffer.BufferSnapshot;
import org.otelbuffer.datapipeline.api.schema.MetricShape;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.SchemaViolationException;
import org.otelbuffer.datapipeline.api.schema.TableKind;
import org.otelbuffer.datapipeline.flatten.OtlpTestData;
import org.otelbuffer.datapipeline.resources.buffer.BufferSet;
import org.otelbuffer.datapipeline.resources.buffer.ColumnarRingBuffer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

@Tag("unit")
class IngestionPipelineTest {

    private static final String MALFORMED_LOGS = "logs-with-malformed.jsonl";

    private final IngestionPipeline pipeline = new IngestionPipeline();
    private BufferSet buffers;

    @BeforeEach
    void setUp() {
        buffers = new BufferSet(64, 16);
    }

    private static ByteArrayIngestionSource fixture(String name) throws IOException {
        try (InputStream in = IngestionPipelineTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new ByteArrayIngestionSource(name, in.readAllBytes());
        }
    }

    private List<Row> logRows() {
        return buffers.getBuffer(TableKind.LOGS).snapshot().toRows();
    }

    @Test
    void nullifyKeepsOneAllNullRowPerMalformedLine() throws Exception {
        IngestionSession session = pipeline.ingest(fixture(MALFORMED_LOGS), buffers,
                SignalType.LOGS, OnErrorMode.NULLIFY, IngestionOptions.DEFAULT_MAX_DOCUMENT_BYTES);

        List<Row> rows = logRows();
        assertThat(rows).hasSize(4);
        assertThat(rows.get(2).isAllNull()).isTrue();
        assertThat(rows.get(0).get(OtlpSchemas.Logs.BODY)).isEqualTo("order placed");
        assertThat(rows.get(1).get(OtlpSchemas.Logs.BODY)).isEqualTo("slow payment");
        assertThat(rows.get(3).get(OtlpSchemas.Logs.BODY)).isEqualTo("payment failed");
        assertThat(rows.get(3).get(OtlpSchemas.Logs.SERVICE_NAME)).isEqualTo("checkout");

        assertThat(session.diagnostics())
                .containsEntry("parse_errors", 1L)
                .containsEntry("records_scanned", 4L)
                .containsEntry("rows_emitted", 4L)
                .containsEntry("nullified", 1L)
                .containsEntry("format_detected", "json")
                .containsEntry("on_error", "nullify");
    }

    @Test
    void skipDropsMalformedLines() throws Exception {
        IngestionSession session = pipeline.ingest(fixture(MALFORMED_LOGS), buffers,
                SignalType.LOGS, OnErrorMode.SKIP, IngestionOptions.DEFAULT_MAX_DOCUMENT_BYTES);

        List<Row> rows = logRows();
        assertThat(rows).hasSize(3);
        assertThat(rows).noneMatch(Row::isAllNull);
        assertThat(session.getSkipped()).isEqualTo(1);
        assertThat(session.getParseErrors()).isEqualTo(1);
        assertThat(session.getErrorRecords()).isEqualTo(1);
        assertThat(session.getErrorRate()).isEqualTo(0.25);
    }

    @Test
    void failAbortsOnFirstMalformedLineAndKeepsEarlierRows() throws IOException {
        ByteArrayIngestionSource source = fixture(MALFORMED_LOGS);

        assertThatThrownBy(() -> pipeline.ingest(source, buffers,
                SignalType.LOGS, OnErrorMode.FAIL, IngestionOptions.DEFAULT_MAX_DOCUMENT_BYTES))
                .isInstanceOfSatisfying(IngestionAbortedException.class, e -> {
                    assertThat(e.getLine()).isEqualTo(3);
                    assertThat(e.getSourceName()).isEqualTo(MALFORMED_LOGS);
                });

        List<Row> rows = logRows();
        assertThat(rows).hasSize(2);
        assertThat(rows).extracting(row -> row.get(OtlpSchemas.Logs.BODY))
                .containsExactly("order placed", "slow payment");
    }

    @Test
    void malformedSingleDocumentCountsAsDocumentError() throws Exception {
        ByteArrayIngestionSource source = ByteArrayIngestionSource.ofString("broken.json",
                "{\"resourceLogs\": [{\"scopeLogs\": [ ");

        IngestionSession session = pipeline.ingest(source, buffers,
                SignalType.LOGS, OnErrorMode.NULLIFY, IngestionOptions.DEFAULT_MAX_DOCUMENT_BYTES);

        assertThat(session.getErrorDocuments()).isEqualTo(1);
        assertThat(session.getErrorRecords()).isZero();
        assertThat(logRows()).singleElement().satisfies(row -> assertThat(row.isAllNull()).isTrue());
    }

    @Test
    void rejectsDocumentsOverTheSizeLimit() throws IOException {
        ByteArrayIngestionSource source = fixture("traces.json");

        assertThatThrownBy(() -> pipeline.ingest(source, buffers, SignalType.TRACES, OnErrorMode.SKIP, 64))
                .isInstanceOf(DocumentSizeLimitException.class)
                .hasMessageContaining("traces.json");
        assertThat(buffers.getBuffer(TableKind.TRACES).size()).isZero();
    }

    @Test
    void rejectsJsonLinesOverTheSizeLimit() throws IOException {
        ByteArrayIngestionSource source = fixture(MALFORMED_LOGS);

        assertThatThrownBy(() -> pipeline.ingest(source, buffers, SignalType.LOGS, OnErrorMode.SKIP, 100))
                .isInstanceOfSatisfying(DocumentSizeLimitException.class,
                        e -> assertThat(e.getLimitBytes()).isEqualTo(100));
    }

    @Test
    void unboundedSizeLimitReadsWholeDocuments() throws Exception {
        byte[] protobuf = OtlpTestData.logs("billing", "first", "second").toByteArray();

        IngestionSession logs = pipeline.ingest(new ByteArrayIngestionSource("logs.pb", protobuf), buffers,
                SignalType.LOGS, OnErrorMode.FAIL, Long.MAX_VALUE);
        IngestionSession traces = pipeline.ingest(fixture("traces.json"), buffers,
                SignalType.TRACES, OnErrorMode.SKIP, Long.MAX_VALUE);

        assertThat(logs.getRowsEmitted()).isEqualTo(2);
        assertThat(logRows()).extracting(row -> row.get(OtlpSchemas.Logs.BODY)).containsExactly("first", "second");
        assertThat(traces.getParseErrors()).isZero();
        assertThat(traces.getRowsEmitted()).isEqualTo(2);
        assertThat(buffers.getBuffer(TableKind.TRACES).size()).isEqualTo(2);
    }

    @Test
    void commitFailureIsSuppressedByTheAbortInFlight() throws IOException {
        BufferSet mismatched = spy(new BufferSet(64, 16));
        doReturn(new ColumnarRingBuffer(OtlpSchemas.traces(), 64, 4)).when(mismatched).getBuffer(TableKind.LOGS);
        ByteArrayIngestionSource source = fixture(MALFORMED_LOGS);

        assertThatThrownBy(() -> pipeline.ingest(source, mismatched,
                SignalType.LOGS, OnErrorMode.FAIL, IngestionOptions.DEFAULT_MAX_DOCUMENT_BYTES))
                .isInstanceOfSatisfying(IngestionAbortedException.class, e -> {
                    assertThat(e.getLine()).isEqualTo(3);
                    assertThat(e.getSuppressed()).hasSize(1);
                    assertThat(e.getSuppressed()[0]).isInstanceOf(SchemaViolationException.class);
                });
    }

    @Test
    void commitFailureWithoutEarlierErrorPropagates() {
        BufferSet mismatched = spy(new BufferSet(64, 16));
        doReturn(new ColumnarRingBuffer(OtlpSchemas.traces(), 64, 4)).when(mismatched).getBuffer(TableKind.LOGS);
        byte[] protobuf = OtlpTestData.logs("billing", "only").toByteArray();

        assertThatThrownBy(() -> pipeline.ingest(new ByteArrayIngestionSource("logs.pb", protobuf), mismatched,
                SignalType.LOGS, OnErrorMode.FAIL, IngestionOptions.DEFAULT_MAX_DOCUMENT_BYTES))
                .isInstanceOf(SchemaViolationException.class);
    }

    @Test
    void rejectsUndetectableInput() {
        ByteArrayIngestionSource plainText = ByteArrayIngestionSource.ofString("notes.txt", "hello, world");
        ByteArrayIngestionSource empty = new ByteArrayIngestionSource("empty.json", new byte[0]);

        assertThatThrownBy(() -> pipeline.ingest(plainText, buffers, SignalType.LOGS, OnErrorMode.SKIP, 1024))
                .isInstanceOf(UnknownFormatException.class);
        assertThatThrownBy(() -> pipeline.ingest(empty, buffers, SignalType.LOGS, OnErrorMode.SKIP, 1024))
                .isInstanceOf(UnknownFormatException.class);
    }

    @Test
    void ingestsProtobufDocuments() throws Exception {
        byte[] bytes = OtlpTestData.logs("billing", "first", "second").toByteArray();

        IngestionSession session = pipeline.ingest(new ByteArrayIngestionSource("logs.pb", bytes), buffers,
                SignalType.LOGS, OnErrorMode.FAIL, IngestionOptions.DEFAULT_MAX_DOCUMENT_BYTES);

        assertThat(session.getFormatDetected()).isEqualTo(OtlpFormat.PROTOBUF);
        assertThat(logRows()).extracting(row -> row.get(OtlpSchemas.Logs.BODY)).containsExactly("first", "second");
        assertThat(logRows()).allMatch(row -> "billing".equals(row.get(OtlpSchemas.Logs.SERVICE_NAME)));
    }

    @Test
    void routesMetricsToTheirShapeBuffers() throws Exception {
        IngestionSession session = pipeline.ingest(fixture("metrics-gauge-sum.json"), buffers,
                IngestionOptions.builder(SignalType.METRICS).build());

        assertThat(session.getRowsEmitted()).isEqualTo(2);
        assertThat(buffers.getBufferForMetric(MetricShape.GAUGE).size()).isEqualTo(1);
        assertThat(buffers.getBufferForMetric(MetricShape.SUM).size()).isEqualTo(1);
        assertThat(buffers.getBufferForMetric(MetricShape.HISTOGRAM).size()).isZero();
    }

    @Test
    void shapeFilterLeavesOtherShapesOut() throws Exception {
        IngestionOptions options = IngestionOptions.builder(SignalType.METRICS)
                .metricShape(MetricShape.SUM)
                .build();

        pipeline.ingest(fixture("metrics-gauge-sum.json"), buffers, options);

        assertThat(buffers.getBufferForMetric(MetricShape.SUM).size()).isEqualTo(1);
        assertThat(buffers.getBufferForMetric(MetricShape.GAUGE).size()).isZero();
    }

    @Test
    void leavesRowsInTheBuildingChunkWithoutSealOnCompletion() throws Exception {
        IngestionOptions options = IngestionOptions.builder(SignalType.LOGS)
                .sealOnCompletion(false)
                .build();

        pipeline.ingest(new ByteArrayIngestionSource("logs.pb", OtlpTestData.logs("svc", "a").toByteArray()),
                buffers, options);

        assertThat(buffers.getBuffer(TableKind.LOGS).snapshot().isEmpty()).isTrue();
        buffers.flushAll();
        assertThat(logRows()).hasSize(1);
    }

    @Test
    void ingestsEveryFileOfAGlobInParallel(@TempDir Path dir) throws Exception {
        for (int i = 0; i < 6; i++) {
            Files.write(dir.resolve("part-" + i + ".pb"),
                    OtlpTestData.logs("svc-" + i, "a", "b", "c").toByteArray());
        }
        Files.writeString(dir.resolve("readme.txt"), "not telemetry", StandardCharsets.UTF_8);

        List<FileIngestionSource> sources = FileIngestionSource.glob(dir, "*.pb");
        IngestionOptions options = IngestionOptions.builder(SignalType.LOGS).parallelism(3).build();
        IngestionSession session = pipeline.ingestAll(sources, buffers, options);

        assertThat(sources).hasSize(6);
        assertThat(session.getSourcesProcessed()).isEqualTo(6);
        assertThat(session.getRowsEmitted()).isEqualTo(18);
        assertThat(logRows()).hasSize(18)
                .extracting(row -> row.get(OtlpSchemas.Logs.SERVICE_NAME))
                .containsOnly("svc-0", "svc-1", "svc-2", "svc-3", "svc-4", "svc-5");
    }

    @Test
    void parallelJobRethrowsTheFirstFailure() {
        List<IIngestionSource> sources = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            sources.add(new ByteArrayIngestionSource("ok-" + i + ".pb", OtlpTestData.logs("svc", "x").toByteArray()));
        }
        sources.add(ByteArrayIngestionSource.ofString("bad.txt", "plain text"));
        IngestionOptions options = IngestionOptions.builder(SignalType.LOGS).parallelism(2).build();

        assertThatThrownBy(() -> pipeline.ingestAll(sources, buffers, options))
                .isInstanceOf(UnknownFormatException.class)
                .satisfies(e -> assertThat(((IngestionException) e).getSourceName()).isEqualTo("bad.txt"));
    }

    @Test
    void globWithoutMatchesFails(@TempDir Path dir) {
        assertThatThrownBy(() -> FileIngestionSource.glob(dir, "*.jsonl"))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("No files found");
    }

    @Test
    void emptyDocumentYieldsNoRowsAndNoError() throws Exception {
        ByteArrayIngestionSource source = ByteArrayIngestionSource.ofString("empty.json", "{\"resourceLogs\": []}");

        IngestionSession session = pipeline.ingest(source, buffers, SignalType.LOGS, OnErrorMode.FAIL, 1024);

        assertThat(session.getRowsEmitted()).isZero();
        assertThat(session.getParseErrors()).isZero();
        assertThat(session.getRecordsScanned()).isEqualTo(1);
    }

    @Test
    void snapshotSeesOnlyCompleteIngestionOutput() throws Exception {
        pipeline.ingest(fixture("traces.json"), buffers, IngestionOptions.builder(SignalType.TRACES).build());

        BufferSnapshot snapshot = buffers.getBuffer(TableKind.TRACES).snapshot();
        assertThat(snapshot.rowCount()).isEqualTo(2);
        assertThat(snapshot.toRows()).extracting(row -> row.get(OtlpSchemas.Traces.SERVICE_NAME))
                .containsOnly("frontend");
    }
}
