package org.otelbuffer.datapipeline.api.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.DataType;

/**
 * Read-only view of one column of a finalized chunk.
 * <p>
 * The typed getters read the primitive storage directly and must only be called for rows
 * where {@link #isNull(int)} is false and the column's storage family matches; the value is
 * unspecified otherwise. {@link #getValue(int)} works for every type and returns null for null cells.
 */
public interface ColumnReader {

    DataType type();

    boolean isNull(int row);

    long getLong(int row);

    int getInt(int row);

    double getDouble(int row);

    boolean getBoolean(int row);

    /**
     * Returns the boxed cell value.
     *
     * @param row row index within the chunk
     * @return the value, or null if the cell is null
     */
    Object getValue(int row);
}
