package org.otelbuffer.datapipeline.api.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.Row;

import java.util.List;
import java.util.Map;

/**
 * Row-at-a-time writer holding a buffer's exclusive lock from creation until {@link #close()}.
 * <p>
 * Protocol: {@link #beginRow()}, any number of setters, then {@link #commitRow()} or
 * {@link #abortRow()}. Columns not set between begin and commit are null. Setters throw
 * {@link org.otelbuffer.datapipeline.api.schema.SchemaViolationException} when the value type
 * does not match the column or no row is open.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; must be used and closed by the thread that opened it.
 */
public interface IScopedRowWriter extends AutoCloseable {

    void beginRow();

    void setTimestamp(int column, long epochNanos);

    void setLong(int column, long value);

    void setInt(int column, int value);

    void setDouble(int column, double value);

    void setBoolean(int column, boolean value);

    void setString(int column, String value);

    void setList(int column, List<?> value);

    void setMap(int column, Map<String, String> value);

    /**
     * Sets a boxed value of any type; null sets the cell to null.
     *
     * @param column column index
     * @param value  the value
     */
    void setValue(int column, Object value);

    void setNull(int column);

    /**
     * Commits the open row into the building chunk, sealing it when full.
     */
    void commitRow();

    /**
     * Discards the open row.
     */
    void abortRow();

    /**
     * Convenience: begin, set every cell from {@code row}, commit.
     *
     * @param row the row
     */
    void writeRow(Row row);

    /**
     * @return number of rows committed through this writer
     */
    long getRowsCommitted();

    /**
     * Releases the exclusive lock. An open, uncommitted row is discarded.
     */
    @Override
    void close();
}
