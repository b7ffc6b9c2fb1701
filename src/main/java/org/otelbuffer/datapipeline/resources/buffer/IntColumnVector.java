package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.DataType;

final class IntColumnVector extends ColumnVector {

    private final int[] values;

    IntColumnVector(DataType type, int capacity) {
        super(type, capacity);
        this.values = new int[capacity];
    }

    @Override
    void store(int row, Object value) {
        values[row] = (Integer) value;
    }

    @Override
    void storeInt(int row, int value) {
        values[row] = value;
    }

    @Override
    public int getInt(int row) {
        return values[row];
    }

    @Override
    protected Object boxed(int row) {
        return values[row];
    }
}
