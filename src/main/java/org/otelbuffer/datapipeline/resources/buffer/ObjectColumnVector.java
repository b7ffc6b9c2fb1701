package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.DataType;

/**
 * Vector for strings, lists and maps. Stored values are immutable (strings, or unmodifiable
 * collections made by {@link ChunkBuilder}).
 */
final class ObjectColumnVector extends ColumnVector {

    private final Object[] values;

    ObjectColumnVector(DataType type, int capacity) {
        super(type, capacity);
        this.values = new Object[capacity];
    }

    @Override
    void store(int row, Object value) {
        values[row] = value;
    }

    @Override
    protected Object boxed(int row) {
        return values[row];
    }
}
