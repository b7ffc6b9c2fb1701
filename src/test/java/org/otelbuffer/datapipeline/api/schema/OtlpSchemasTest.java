package org.otelbuffer.datapipeline.api.schema;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class OtlpSchemasTest {

    @Test
    void unionHasTwentySevenColumnsWithDiscriminatorAfterBase() {
        TableSchema union = OtlpSchemas.union();

        assertThat(union.arity()).isEqualTo(27);
        assertThat(union.column(OtlpSchemas.Union.METRIC_TYPE).name()).isEqualTo("MetricType");
        assertThat(union.column(OtlpSchemas.Union.MAX).name()).isEqualTo("Max");
        assertThat(union.getTimestampColumn()).isZero();
        assertThat(union.getServiceColumn()).isEqualTo(OtlpSchemas.MetricBase.SERVICE_NAME);
        assertThat(union.getMetricNameColumn()).isEqualTo(OtlpSchemas.MetricBase.METRIC_NAME);
    }

    @ParameterizedTest
    @EnumSource(MetricShape.class)
    void everyShapeColumnExistsInUnionWithSameType(MetricShape shape) {
        TableSchema typed = OtlpSchemas.forMetric(shape);
        TableSchema union = OtlpSchemas.union();
        List<String> shapeColumns = OtlpSchemas.shapeColumnNames(shape);

        assertThat(typed.arity()).isEqualTo(OtlpSchemas.MetricBase.WIDTH + shapeColumns.size());
        for (int i = 0; i < OtlpSchemas.MetricBase.WIDTH; i++) {
            assertThat(typed.column(i)).isEqualTo(union.column(i));
        }
        for (String name : shapeColumns) {
            assertThat(typed.typeOf(typed.requireIndex(name))).isEqualTo(union.typeOf(union.requireIndex(name)));
        }
        assertThat(OtlpSchemas.forTable(shape.getTableKind())).isSameAs(typed);
    }

    @Test
    void tracesAndLogsLayouts() {
        assertThat(OtlpSchemas.traces().arity()).isEqualTo(22);
        assertThat(OtlpSchemas.logs().arity()).isEqualTo(15);
        assertThat(OtlpSchemas.traces().column(OtlpSchemas.Traces.DURATION).name()).isEqualTo("Duration");
        assertThat(OtlpSchemas.logs().column(OtlpSchemas.Logs.BODY).name()).isEqualTo("Body");
        assertThat(OtlpSchemas.logs().getMetricNameColumn()).isEqualTo(TableSchema.NO_COLUMN);
    }

    @Test
    void validateRejectsWrongArity() {
        assertThatThrownBy(() -> OtlpSchemas.logs().validate(Row.allNull(3)))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("arity 3");
    }

    @Test
    void validateRejectsWrongCellType() {
        Row row = new Row.Builder(OtlpSchemas.logs().arity())
                .set(OtlpSchemas.Logs.SEVERITY_NUMBER, "nine")
                .build();

        assertThatThrownBy(() -> OtlpSchemas.logs().validate(row))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("SeverityNumber");
    }

    @Test
    void validateAcceptsAllNullAndTypedCells() {
        Row row = new Row.Builder(OtlpSchemas.logs().arity())
                .set(OtlpSchemas.Logs.TIMESTAMP, 1_000L)
                .set(OtlpSchemas.Logs.TRACE_FLAGS, 1L)
                .set(OtlpSchemas.Logs.SEVERITY_NUMBER, 9)
                .set(OtlpSchemas.Logs.BODY, "hello")
                .set(OtlpSchemas.Logs.LOG_ATTRIBUTES, Map.of("k", "v"))
                .build();

        OtlpSchemas.logs().validate(row);
        OtlpSchemas.logs().validate(Row.allNull(OtlpSchemas.logs().arity()));
    }

    @Test
    void uintegerRejectsValuesAboveThirtyTwoBits() {
        assertThat(DataType.UINTEGER.accepts(0xFFFF_FFFFL)).isTrue();
        assertThat(DataType.UINTEGER.accepts(0x1_0000_0000L)).isFalse();
        assertThat(DataType.UINTEGER.accepts(-1L)).isFalse();
    }

    @Test
    void discriminatorParsing() {
        assertThat(MetricShape.fromDiscriminator("Gauge")).isEqualTo(MetricShape.GAUGE);
        assertThat(MetricShape.fromDiscriminator("exp_histogram")).isEqualTo(MetricShape.EXPONENTIAL_HISTOGRAM);
        assertThatThrownBy(() -> MetricShape.fromDiscriminator("counter"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
