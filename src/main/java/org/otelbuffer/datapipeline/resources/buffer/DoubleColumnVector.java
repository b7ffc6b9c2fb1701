package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.DataType;

final class DoubleColumnVector extends ColumnVector {

    private final double[] values;

    DoubleColumnVector(DataType type, int capacity) {
        super(type, capacity);
        this.values = new double[capacity];
    }

    @Override
    void store(int row, Object value) {
        values[row] = (Double) value;
    }

    @Override
    void storeDouble(int row, double value) {
        values[row] = value;
    }

    @Override
    public double getDouble(int row) {
        return values[row];
    }

    @Override
    protected Object boxed(int row) {
        return values[row];
    }
}
