package org.otelbuffer.datapipeline.scan;

import org.otelbuffer.datapipeline.api.resources.buffer.ColumnReader;
import org.otelbuffer.datapipeline.api.resources.buffer.ColumnarChunk;
import org.otelbuffer.datapipeline.api.schema.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Projected rows of one chunk.
 * <p>
 * A batch references the chunk's column storage directly; nothing is copied. Rows are
 * addressed by batch position {@code 0..size()-1}, which maps to chunk rows through an
 * optional selection vector. Without a selection the batch covers the whole chunk.
 * <p>
 * <strong>Thread Safety:</strong> Immutable; backed by an immutable chunk.
 */
public final class RowBatch {

    private final ColumnarChunk chunk;
    private final int[] projection;
    private final ColumnReader[] columns;
    private final int[] selection;
    private final int size;

    RowBatch(ColumnarChunk chunk, int[] projection, int[] selection) {
        this.chunk = chunk;
        this.projection = projection;
        this.columns = new ColumnReader[projection.length];
        for (int i = 0; i < projection.length; i++) {
            columns[i] = chunk.column(projection[i]);
        }
        this.selection = selection;
        this.size = selection == null ? chunk.size() : selection.length;
    }

    public ColumnarChunk getChunk() {
        return chunk;
    }

    public int size() {
        return size;
    }

    public int columnCount() {
        return columns.length;
    }

    /**
     * @param outputColumn position in the projection
     * @return the schema column index it refers to
     */
    public int schemaColumn(int outputColumn) {
        return projection[outputColumn];
    }

    /**
     * @param outputColumn position in the projection
     * @return the chunk's reader for that column; index it with {@link #chunkRow(int)}
     */
    public ColumnReader column(int outputColumn) {
        return columns[outputColumn];
    }

    /**
     * @return true if the batch covers every row of its chunk
     */
    public boolean isFullChunk() {
        return selection == null;
    }

    /**
     * @param position batch position
     * @return the row index within the chunk
     */
    public int chunkRow(int position) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("Position " + position + " outside batch of size " + size);
        }
        return selection == null ? position : selection[position];
    }

    public Object getValue(int position, int outputColumn) {
        return columns[outputColumn].getValue(chunkRow(position));
    }

    /**
     * Materializes one projected row.
     *
     * @param position batch position
     * @return the row with {@link #columnCount()} cells
     */
    public Row getRow(int position) {
        int row = chunkRow(position);
        Row.Builder builder = new Row.Builder(columns.length);
        for (int c = 0; c < columns.length; c++) {
            builder.set(c, columns[c].getValue(row));
        }
        return builder.build();
    }

    public List<Row> toRows() {
        List<Row> rows = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            rows.add(getRow(i));
        }
        return rows;
    }

    @Override
    public String toString() {
        return "RowBatch{chunk=#" + chunk.getSequence() + ", rows=" + size + ", columns=" + columns.length + "}";
    }
}
