package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.resources.buffer.ColumnReader;
import org.otelbuffer.datapipeline.api.schema.DataType;

import java.util.BitSet;

/**
 * Fixed-capacity storage for one column of a chunk: a contiguous typed array plus a null mask.
 * <p>
 * Mutators are package-private and only called by {@link ChunkBuilder} while the chunk is
 * being built. Once the chunk is sealed the vector is handed to an immutable
 * {@link org.otelbuffer.datapipeline.api.resources.buffer.ColumnarChunk} and never written again.
 */
abstract class ColumnVector implements ColumnReader {

    private final DataType type;
    private final BitSet nulls;

    protected ColumnVector(DataType type, int capacity) {
        this.type = type;
        this.nulls = new BitSet(capacity);
    }

    /**
     * Allocates the vector matching a type's storage family.
     *
     * @param type     column type
     * @param capacity row capacity
     * @return a new, empty vector
     */
    static ColumnVector allocate(DataType type, int capacity) {
        return switch (type.id().getStorageFamily()) {
            case LONG -> new LongColumnVector(type, capacity);
            case INT -> new IntColumnVector(type, capacity);
            case DOUBLE -> new DoubleColumnVector(type, capacity);
            case BOOLEAN -> new BooleanColumnVector(type, capacity);
            case OBJECT -> new ObjectColumnVector(type, capacity);
        };
    }

    @Override
    public DataType type() {
        return type;
    }

    @Override
    public boolean isNull(int row) {
        return nulls.get(row);
    }

    void markNull(int row) {
        nulls.set(row);
    }

    void markPresent(int row) {
        nulls.clear(row);
    }

    /**
     * Stores an already type-checked, non-null boxed value.
     */
    abstract void store(int row, Object value);

    void storeLong(int row, long value) {
        throw new UnsupportedOperationException(type + " column cannot store a long");
    }

    void storeInt(int row, int value) {
        throw new UnsupportedOperationException(type + " column cannot store an int");
    }

    void storeDouble(int row, double value) {
        throw new UnsupportedOperationException(type + " column cannot store a double");
    }

    void storeBoolean(int row, boolean value) {
        throw new UnsupportedOperationException(type + " column cannot store a boolean");
    }

    @Override
    public long getLong(int row) {
        throw new UnsupportedOperationException(type + " column has no long values");
    }

    @Override
    public int getInt(int row) {
        throw new UnsupportedOperationException(type + " column has no int values");
    }

    @Override
    public double getDouble(int row) {
        throw new UnsupportedOperationException(type + " column has no double values");
    }

    @Override
    public boolean getBoolean(int row) {
        throw new UnsupportedOperationException(type + " column has no boolean values");
    }

    @Override
    public Object getValue(int row) {
        return isNull(row) ? null : boxed(row);
    }

    protected abstract Object boxed(int row);
}
