package org.otelbuffer.datapipeline.ingest;

import org.otelbuffer.datapipeline.api.resources.buffer.IScopedRowWriter;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableKind;
import org.otelbuffer.datapipeline.flatten.RowSink;
import org.otelbuffer.datapipeline.resources.buffer.BufferSet;
import org.otelbuffer.datapipeline.resources.buffer.ColumnarRingBuffer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups flattened rows per destination buffer and commits them in batches.
 * <p>
 * Rows are held per table until {@code batchSize} of them are pending; the batch is then
 * written through one {@link IScopedRowWriter}, so the buffer's exclusive lock is taken once
 * per batch instead of once per row. {@link #commitPending()} writes whatever is left.
 * <p>
 * <strong>Thread Safety:</strong> This component is <strong>NOT thread-safe</strong>. Each
 * ingestion worker or receiver thread owns its own router; the buffers behind it are shared.
 */
public class RowRouter implements RowSink {

    private final BufferSet destination;
    private final int batchSize;
    private final Map<TableKind, List<Row>> pending = new EnumMap<>(TableKind.class);
    private final Set<TableKind> touched = EnumSet.noneOf(TableKind.class);
    private long rowsCommitted;

    /**
     * @param destination the buffers rows are committed to
     * @param batchSize   rows per commit batch (must be positive)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    public RowRouter(BufferSet destination, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.destination = destination;
        this.batchSize = batchSize;
    }

    @Override
    public void accept(TableKind table, Row row) {
        List<Row> rows = pending.computeIfAbsent(table, k -> new ArrayList<>(Math.min(batchSize, 1024)));
        rows.add(row);
        if (rows.size() >= batchSize) {
            commit(table, rows);
        }
    }

    /**
     * Writes all pending rows to their buffers.
     */
    public void commitPending() {
        for (Map.Entry<TableKind, List<Row>> entry : pending.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                commit(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * Seals the building chunk of every buffer this router has written to since the last call.
     *
     * @return number of chunks sealed
     */
    public int sealTouched() {
        int sealed = 0;
        for (TableKind table : touched) {
            if (destination.getBuffer(table).flush()) {
                sealed++;
            }
        }
        touched.clear();
        return sealed;
    }

    /**
     * @return number of rows pending across all tables
     */
    public int getPendingCount() {
        int count = 0;
        for (List<Row> rows : pending.values()) {
            count += rows.size();
        }
        return count;
    }

    /**
     * @return rows written to buffers so far
     */
    public long getRowsCommitted() {
        return rowsCommitted;
    }

    private void commit(TableKind table, List<Row> rows) {
        ColumnarRingBuffer buffer = destination.getBuffer(table);
        try (IScopedRowWriter writer = buffer.scopedWriter()) {
            for (Row row : rows) {
                writer.writeRow(row);
            }
            rowsCommitted += rows.size();
        } finally {
            // A schema violation mid-batch drops the rest of the batch rather than retrying it.
            touched.add(table);
            rows.clear();
        }
    }
}
