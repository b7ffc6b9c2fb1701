package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.DataType;

import java.util.BitSet;

final class BooleanColumnVector extends ColumnVector {

    private final BitSet values;

    BooleanColumnVector(DataType type, int capacity) {
        super(type, capacity);
        this.values = new BitSet(capacity);
    }

    @Override
    void store(int row, Object value) {
        values.set(row, (Boolean) value);
    }

    @Override
    void storeBoolean(int row, boolean value) {
        values.set(row, value);
    }

    @Override
    public boolean getBoolean(int row) {
        return values.get(row);
    }

    @Override
    protected Object boxed(int row) {
        return values.get(row);
    }
}
