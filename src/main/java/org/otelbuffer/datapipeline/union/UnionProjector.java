package org.otelbuffer.datapipeline.union;

import org.otelbuffer.datapipeline.api.schema.MetricShape;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableSchema;
import org.otelbuffer.datapipeline.resources.buffer.BufferSet;
import org.otelbuffer.datapipeline.scan.RowBatch;
import org.otelbuffer.datapipeline.scan.ScanCursor;
import org.otelbuffer.datapipeline.scan.ScanEngine;
import org.otelbuffer.datapipeline.scan.ScanRequest;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between the five typed metric schemas and the union metric schema.
 * <p>
 * A typed row projected into the union keeps its base columns at the same positions, gets the
 * shape's discriminator in {@code MetricType}, fills the shape's own columns and leaves the
 * columns of every other shape null. Narrowing is the inverse and drops whatever the target
 * shape does not own. Both directions are pure.
 * <p>
 * <strong>Thread Safety:</strong> Stateless after class initialization.
 */
public final class UnionProjector {

    private static final TableSchema UNION = OtlpSchemas.union();
    private static final int BASE_WIDTH = OtlpSchemas.MetricBase.WIDTH;

    // Union index of each shape-specific column, in typed-schema order after the base columns.
    private static final Map<MetricShape, int[]> SHAPE_COLUMNS = new EnumMap<>(MetricShape.class);

    static {
        for (MetricShape shape : MetricShape.values()) {
            List<String> names = OtlpSchemas.shapeColumnNames(shape);
            int[] unionIndices = new int[names.size()];
            for (int i = 0; i < unionIndices.length; i++) {
                unionIndices[i] = UNION.requireIndex(names.get(i));
            }
            SHAPE_COLUMNS.put(shape, unionIndices);
        }
    }

    private UnionProjector() {
    }

    /**
     * Projects a typed metric row into the union schema.
     *
     * @param shape    the shape of {@code typedRow}
     * @param typedRow a row of {@link OtlpSchemas#forMetric(MetricShape)}
     * @return a union row
     */
    public static Row toUnion(MetricShape shape, Row typedRow) {
        int[] shapeColumns = SHAPE_COLUMNS.get(shape);
        requireArity(typedRow, BASE_WIDTH + shapeColumns.length, shape.getTableKind().getTableName());
        Row.Builder union = new Row.Builder(UNION.arity());
        for (int c = 0; c < BASE_WIDTH; c++) {
            union.set(c, typedRow.get(c));
        }
        union.set(OtlpSchemas.Union.METRIC_TYPE, shape.getDiscriminator());
        for (int i = 0; i < shapeColumns.length; i++) {
            union.set(shapeColumns[i], typedRow.get(BASE_WIDTH + i));
        }
        return union.build();
    }

    /**
     * Narrows a union row to one typed metric schema.
     *
     * @param unionRow a row of {@link OtlpSchemas#union()}
     * @param shape    the target shape
     * @return a row of the shape's typed schema
     */
    public static Row narrow(Row unionRow, MetricShape shape) {
        requireArity(unionRow, UNION.arity(), UNION.getName());
        int[] shapeColumns = SHAPE_COLUMNS.get(shape);
        Row.Builder typed = new Row.Builder(BASE_WIDTH + shapeColumns.length);
        for (int c = 0; c < BASE_WIDTH; c++) {
            typed.set(c, unionRow.get(c));
        }
        for (int i = 0; i < shapeColumns.length; i++) {
            typed.set(BASE_WIDTH + i, unionRow.get(shapeColumns[i]));
        }
        return typed.build();
    }

    /**
     * Reads the discriminator of a union row.
     *
     * @param unionRow a union row
     * @return its shape
     * @throws IllegalArgumentException if the discriminator is missing or unknown
     */
    public static MetricShape shapeOf(Row unionRow) {
        return MetricShape.fromDiscriminator(unionRow.get(OtlpSchemas.Union.METRIC_TYPE, String.class));
    }

    /**
     * Synthesizes union rows from the metric buffers of a buffer set.
     * <p>
     * Each buffer is read through its own snapshot, so the result reflects sealed chunks only.
     * Rows come out grouped by shape in declaration order, oldest first within a shape.
     *
     * @param buffers     the buffer set
     * @param engine      the scan engine
     * @param shapeFilter a single shape to read, or null for all five
     * @return union rows
     */
    public static List<Row> readUnion(BufferSet buffers, ScanEngine engine, MetricShape shapeFilter) {
        List<Row> rows = new ArrayList<>();
        for (MetricShape shape : MetricShape.values()) {
            if (shapeFilter != null && shape != shapeFilter) {
                continue;
            }
            ScanCursor cursor = engine.scan(buffers.getBufferForMetric(shape), ScanRequest.all());
            RowBatch batch;
            while ((batch = cursor.nextBatch()) != null) {
                for (int i = 0; i < batch.size(); i++) {
                    rows.add(toUnion(shape, batch.getRow(i)));
                }
            }
        }
        return rows;
    }

    private static void requireArity(Row row, int expected, String tableName) {
        if (row.arity() != expected) {
            throw new IllegalArgumentException("Row of arity " + row.arity() + " does not fit " + tableName
                    + " with " + expected + " columns");
        }
    }
}
