package org.otelbuffer.datapipeline.union;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.otelbuffer.datapipeline.TestRows;
import org.otelbuffer.datapipeline.api.ingest.IngestionOptions;
import org.otelbuffer.datapipeline.api.ingest.SignalType;
import org.otelbuffer.datapipeline.api.schema.DataType;
import org.otelbuffer.datapipeline.api.schema.MetricShape;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableSchema;
import org.otelbuffer.datapipeline.flatten.OtlpTestData;
import org.otelbuffer.datapipeline.ingest.ByteArrayIngestionSource;
import org.otelbuffer.datapipeline.ingest.IngestionPipeline;
import org.otelbuffer.datapipeline.resources.buffer.BufferSet;
import org.otelbuffer.datapipeline.scan.ScanEngine;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class UnionProjectorTest {

    private static final int SUM_VALUE = OtlpSchemas.MetricBase.WIDTH;
    private static final int SUM_IS_MONOTONIC = OtlpSchemas.MetricBase.WIDTH + 2;

    /**
     * A fully populated row of the shape's typed schema; {@code seed} varies the values.
     */
    private static Row typedRow(MetricShape shape, int seed) {
        TableSchema schema = OtlpSchemas.forMetric(shape);
        Row.Builder builder = new Row.Builder(schema.arity());
        for (int c = 0; c < schema.arity(); c++) {
            builder.set(c, sample(schema.typeOf(c), seed + c));
        }
        return builder.build();
    }

    private static Object sample(DataType type, int seed) {
        return switch (type.id()) {
            case TIMESTAMP_NS, BIGINT, UBIGINT, UINTEGER -> 1_000L + seed;
            case INTEGER -> seed;
            case DOUBLE -> seed + 0.5;
            case BOOLEAN -> seed % 2 == 0;
            case VARCHAR -> "v" + seed;
            case MAP -> Map.of("k" + seed, "v" + seed);
            case LIST -> List.of(sample(type.elementType(), seed), sample(type.elementType(), seed + 1));
        };
    }

    @ParameterizedTest
    @EnumSource(MetricShape.class)
    void unionThenNarrowReproducesTypedRow(MetricShape shape) {
        Row typed = typedRow(shape, 3);

        Row union = UnionProjector.toUnion(shape, typed);

        OtlpSchemas.union().validate(union);
        assertThat(union.get(OtlpSchemas.Union.METRIC_TYPE)).isEqualTo(shape.getDiscriminator());
        assertThat(UnionProjector.shapeOf(union)).isEqualTo(shape);
        assertThat(UnionProjector.narrow(union, shape)).isEqualTo(typed);
    }

    @ParameterizedTest
    @EnumSource(MetricShape.class)
    void columnsOfOtherShapesStayNull(MetricShape shape) {
        Row union = UnionProjector.toUnion(shape, typedRow(shape, 1));
        List<String> own = OtlpSchemas.shapeColumnNames(shape);
        TableSchema schema = OtlpSchemas.union();

        for (int c = OtlpSchemas.Union.METRIC_TYPE + 1; c < schema.arity(); c++) {
            String name = schema.column(c).name();
            assertThat(union.isNull(c)).as("column %s of a %s row", name, shape).isEqualTo(!own.contains(name));
        }
    }

    @Test
    void gaugeAndSumProjectIntoOneUnion() throws Exception {
        BufferSet buffers = new BufferSet(16, 4);
        new IngestionPipeline().ingest(
                new ByteArrayIngestionSource("metrics.pb", OtlpTestData.gaugeAndSum("inventory").toByteArray()),
                buffers, IngestionOptions.builder(SignalType.METRICS).build());

        List<Row> gauges = buffers.getBufferForMetric(MetricShape.GAUGE).snapshot().toRows();
        List<Row> sums = buffers.getBufferForMetric(MetricShape.SUM).snapshot().toRows();
        assertThat(gauges).singleElement().satisfies(row -> assertThat(row.get(SUM_VALUE)).isEqualTo(42.0));
        assertThat(sums).singleElement().satisfies(row -> {
            assertThat(row.get(SUM_VALUE)).isEqualTo(7.0);
            assertThat(row.get(SUM_IS_MONOTONIC)).isEqualTo(true);
        });

        List<Row> union = UnionProjector.readUnion(buffers, new ScanEngine(1), null);

        assertThat(union).hasSize(2);
        Row gauge = union.get(0);
        Row sum = union.get(1);
        assertThat(gauge.get(OtlpSchemas.Union.METRIC_TYPE)).isEqualTo("gauge");
        assertThat(gauge.get(OtlpSchemas.Union.VALUE)).isEqualTo(42.0);
        assertThat(gauge.isNull(OtlpSchemas.Union.IS_MONOTONIC)).isTrue();
        assertThat(gauge.isNull(OtlpSchemas.Union.AGGREGATION_TEMPORALITY)).isTrue();
        assertThat(sum.get(OtlpSchemas.Union.METRIC_TYPE)).isEqualTo("sum");
        assertThat(sum.get(OtlpSchemas.Union.VALUE)).isEqualTo(7.0);
        assertThat(sum.get(OtlpSchemas.Union.IS_MONOTONIC)).isEqualTo(true);
        assertThat(sum.isNull(OtlpSchemas.Union.COUNT)).isTrue();
        assertThat(List.of(gauge, sum)).allMatch(row -> "inventory".equals(row.get(OtlpSchemas.MetricBase.SERVICE_NAME)));
    }

    @Test
    void readUnionHonoursTheShapeFilter() {
        BufferSet buffers = new BufferSet(16, 4);
        buffers.getBufferForMetric(MetricShape.GAUGE).append(TestRows.gauge(1L, "svc", "cpu", 0.25));
        buffers.getBufferForMetric(MetricShape.SUMMARY).append(typedRow(MetricShape.SUMMARY, 7));
        buffers.flushAll();

        List<Row> summaries = UnionProjector.readUnion(buffers, new ScanEngine(1), MetricShape.SUMMARY);
        List<Row> all = UnionProjector.readUnion(buffers, new ScanEngine(1), null);

        assertThat(summaries).singleElement()
                .satisfies(row -> assertThat(UnionProjector.shapeOf(row)).isEqualTo(MetricShape.SUMMARY));
        assertThat(all).extracting(UnionProjector::shapeOf).containsExactly(MetricShape.GAUGE, MetricShape.SUMMARY);
    }

    @Test
    void readUnionOfEmptyBuffersIsEmpty() {
        assertThat(UnionProjector.readUnion(new BufferSet(16, 4), new ScanEngine(1), null)).isEmpty();
    }

    @Test
    void rejectsRowsOfTheWrongWidth() {
        Row gauge = typedRow(MetricShape.GAUGE, 0);

        assertThatThrownBy(() -> UnionProjector.toUnion(MetricShape.SUM, gauge))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("otel_metrics_sum");
        assertThatThrownBy(() -> UnionProjector.narrow(gauge, MetricShape.GAUGE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownDiscriminatorIsRejected() {
        Row union = new Row.Builder(OtlpSchemas.union().arity())
                .set(OtlpSchemas.Union.METRIC_TYPE, "counter")
                .build();

        assertThatThrownBy(() -> UnionProjector.shapeOf(union)).isInstanceOf(IllegalArgumentException.class);
    }
}
