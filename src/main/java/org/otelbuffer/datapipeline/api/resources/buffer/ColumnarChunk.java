package org.otelbuffer.datapipeline.api.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable block of up to {@code capacity} rows in columnar layout, plus pruning statistics.
 * <p>
 * A chunk is produced by sealing a ring buffer's building chunk. From that point on neither
 * its column storage nor its statistics change, so any number of threads may read it without
 * locking, and a {@link BufferSnapshot} may keep it alive after the buffer evicted it.
 * <p>
 * <strong>Statistics:</strong>
 * <ul>
 *   <li>{@link #getTsMinMicros()}/{@link #getTsMaxMicros()}: min/max of the timestamp column
 *       (column 0) in microseconds, ignoring null timestamps. When every timestamp is null the
 *       range is empty ({@code min = Long.MAX_VALUE}, {@code max = Long.MIN_VALUE}).</li>
 *   <li>{@link #getServiceSummary()}/{@link #getMetricNameSummary()}: dimension summaries.</li>
 * </ul>
 */
public final class ColumnarChunk {

    private final TableSchema schema;
    private final long sequence;
    private final ColumnReader[] columns;
    private final int size;
    private final int capacity;
    private final long tsMinMicros;
    private final long tsMaxMicros;
    private final DimensionSummary serviceSummary;
    private final DimensionSummary metricNameSummary;

    /**
     * Creates a finalized chunk. The caller hands over ownership of {@code columns} and must not
     * write to them afterwards.
     *
     * @param schema            the schema the columns follow
     * @param sequence          per-buffer sequence number, increasing in seal order
     * @param columns           one reader per schema column
     * @param size              number of valid rows
     * @param capacity          row capacity the chunk was built with
     * @param tsMinMicros       minimum timestamp in microseconds
     * @param tsMaxMicros       maximum timestamp in microseconds
     * @param serviceSummary    service-name dimension summary
     * @param metricNameSummary metric-name dimension summary
     */
    public ColumnarChunk(TableSchema schema, long sequence, ColumnReader[] columns, int size, int capacity,
                         long tsMinMicros, long tsMaxMicros,
                         DimensionSummary serviceSummary, DimensionSummary metricNameSummary) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        if (columns.length != schema.arity()) {
            throw new IllegalArgumentException("Expected " + schema.arity() + " columns but got " + columns.length);
        }
        if (size < 0 || size > capacity) {
            throw new IllegalArgumentException("Chunk size " + size + " outside [0, " + capacity + "]");
        }
        this.sequence = sequence;
        this.columns = columns;
        this.size = size;
        this.capacity = capacity;
        this.tsMinMicros = tsMinMicros;
        this.tsMaxMicros = tsMaxMicros;
        this.serviceSummary = Objects.requireNonNull(serviceSummary);
        this.metricNameSummary = Objects.requireNonNull(metricNameSummary);
    }

    public TableSchema getSchema() {
        return schema;
    }

    public long getSequence() {
        return sequence;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public ColumnReader column(int index) {
        return columns[index];
    }

    public long getTsMinMicros() {
        return tsMinMicros;
    }

    public long getTsMaxMicros() {
        return tsMaxMicros;
    }

    /**
     * @return true if at least one row has a non-null timestamp
     */
    public boolean hasTimestampRange() {
        return tsMinMicros <= tsMaxMicros;
    }

    public DimensionSummary getServiceSummary() {
        return serviceSummary;
    }

    public DimensionSummary getMetricNameSummary() {
        return metricNameSummary;
    }

    /**
     * Returns the dimension summary tracked for a column.
     *
     * @param columnIndex schema column index
     * @return the summary, {@link DimensionSummary#absent()} for untracked columns
     */
    public DimensionSummary summaryFor(int columnIndex) {
        if (columnIndex != TableSchema.NO_COLUMN) {
            if (columnIndex == schema.getServiceColumn()) {
                return serviceSummary;
            }
            if (columnIndex == schema.getMetricNameColumn()) {
                return metricNameSummary;
            }
        }
        return DimensionSummary.absent();
    }

    public Object getValue(int columnIndex, int row) {
        checkRow(row);
        return columns[columnIndex].getValue(row);
    }

    /**
     * Materializes one row. Allocates; scans should read the column readers instead.
     *
     * @param row row index
     * @return the row
     */
    public Row getRow(int row) {
        checkRow(row);
        Object[] cells = new Object[columns.length];
        for (int c = 0; c < columns.length; c++) {
            cells[c] = columns[c].getValue(row);
        }
        return Row.of(cells);
    }

    /**
     * @return all rows of this chunk in order
     */
    public List<Row> toRows() {
        List<Row> rows = new ArrayList<>(size);
        for (int r = 0; r < size; r++) {
            rows.add(getRow(r));
        }
        return rows;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " outside chunk of size " + size);
        }
    }

    @Override
    public String toString() {
        return "ColumnarChunk{" + schema.getName() + "#" + sequence + ", size=" + size
                + ", ts=[" + tsMinMicros + ", " + tsMaxMicros + "]us, service=" + serviceSummary
                + ", metric=" + metricNameSummary + "}";
    }
}
