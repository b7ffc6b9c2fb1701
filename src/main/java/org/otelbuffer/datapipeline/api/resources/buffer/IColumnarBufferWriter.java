package org.otelbuffer.datapipeline.api.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.Row;

import java.util.List;

/**
 * Write side of a columnar buffer.
 * <p>
 * Only one writer holds the buffer at a time; each call below acquires exclusive access for
 * its whole duration, so rows of one batch are never interleaved with another writer's rows.
 */
public interface IColumnarBufferWriter {

    /**
     * Appends a single row.
     *
     * @param row the row
     * @throws org.otelbuffer.datapipeline.api.schema.SchemaViolationException if the row does not match the schema
     */
    void append(Row row);

    /**
     * Appends rows under one exclusive lock acquisition. All rows are validated first, so a
     * schema violation leaves the buffer unchanged.
     *
     * @param rows the rows, in order
     * @throws org.otelbuffer.datapipeline.api.schema.SchemaViolationException if any row does not match the schema
     */
    void appendBatch(List<Row> rows);

    /**
     * Opens a row-at-a-time writer that holds the exclusive lock until closed.
     * <p>
     * Use with try-with-resources so the lock is released on every exit path:
     * <pre>
     * try (IScopedRowWriter writer = buffer.scopedWriter()) {
     *     writer.beginRow();
     *     writer.setTimestamp(0, ts);
     *     writer.commitRow();
     * }
     * </pre>
     *
     * @return the writer
     */
    IScopedRowWriter scopedWriter();

    /**
     * Seals the building chunk early if it holds at least one row, making its rows visible to
     * new snapshots.
     *
     * @return true if a chunk was sealed
     */
    boolean flush();
}
