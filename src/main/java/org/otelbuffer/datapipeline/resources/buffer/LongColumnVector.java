package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.DataType;

/**
 * Vector for timestamp, signed and unsigned integer columns widened to {@code long}.
 */
final class LongColumnVector extends ColumnVector {

    private final long[] values;

    LongColumnVector(DataType type, int capacity) {
        super(type, capacity);
        this.values = new long[capacity];
    }

    @Override
    void store(int row, Object value) {
        values[row] = (Long) value;
    }

    @Override
    void storeLong(int row, long value) {
        values[row] = value;
    }

    @Override
    public long getLong(int row) {
        return values[row];
    }

    @Override
    protected Object boxed(int row) {
        return values[row];
    }
}
