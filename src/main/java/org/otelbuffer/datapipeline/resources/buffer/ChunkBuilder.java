package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.resources.buffer.ColumnReader;
import org.otelbuffer.datapipeline.api.resources.buffer.ColumnarChunk;
import org.otelbuffer.datapipeline.api.schema.ColumnType;
import org.otelbuffer.datapipeline.api.schema.DataType;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.SchemaViolationException;
import org.otelbuffer.datapipeline.api.schema.TableSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single mutable chunk of a ring buffer.
 * <p>
 * Rows are written column by column between {@link #beginRow()} and {@link #commitRow()}.
 * Chunk statistics (timestamp range, dimension summaries) are updated at commit, so they
 * always reflect exactly the committed rows. {@link #seal(long)} transfers the column
 * storage to an immutable {@link ColumnarChunk}; the builder must not be used afterwards.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. The owning ring buffer only touches it under
 * its write lock.
 */
final class ChunkBuilder {

    private final TableSchema schema;
    private final int capacity;
    private final ColumnVector[] vectors;
    private final DimensionTracker serviceTracker;
    private final DimensionTracker metricTracker;
    private int count;
    private boolean rowOpen;
    private boolean sealed;
    private long tsMinMicros = Long.MAX_VALUE;
    private long tsMaxMicros = Long.MIN_VALUE;

    ChunkBuilder(TableSchema schema, int capacity) {
        this.schema = schema;
        this.capacity = capacity;
        this.vectors = new ColumnVector[schema.arity()];
        for (int c = 0; c < vectors.length; c++) {
            vectors[c] = ColumnVector.allocate(schema.typeOf(c), capacity);
        }
        this.serviceTracker = new DimensionTracker(schema.getServiceColumn() != TableSchema.NO_COLUMN);
        this.metricTracker = new DimensionTracker(schema.getMetricNameColumn() != TableSchema.NO_COLUMN);
    }

    int size() {
        return count;
    }

    boolean isFull() {
        return count >= capacity;
    }

    boolean isRowOpen() {
        return rowOpen;
    }

    void beginRow() {
        if (sealed) {
            throw new IllegalStateException("Chunk builder already sealed");
        }
        if (rowOpen) {
            throw new SchemaViolationException("beginRow() called while a row is open");
        }
        if (isFull()) {
            throw new IllegalStateException("Chunk is full (" + capacity + " rows)");
        }
        for (ColumnVector vector : vectors) {
            vector.markNull(count);
        }
        rowOpen = true;
    }

    void setNull(int column) {
        vectorFor(column, null).markNull(count);
    }

    void setLong(int column, long value) {
        ColumnVector vector = vectorFor(column, "long");
        ColumnType id = vector.type().id();
        if (id.getStorageFamily() != ColumnType.StorageFamily.LONG) {
            throw mismatch(column, "long");
        }
        if (id == ColumnType.UINTEGER && (value < 0 || value > 0xFFFF_FFFFL)) {
            throw new SchemaViolationException("Value " + value + " out of UINTEGER range for column '"
                    + schema.column(column).name() + "'");
        }
        vector.storeLong(count, value);
        vector.markPresent(count);
    }

    void setTimestamp(int column, long epochNanos) {
        if (column >= 0 && column < vectors.length && vectors[column].type().id() != ColumnType.TIMESTAMP_NS) {
            throw mismatch(column, "timestamp");
        }
        setLong(column, epochNanos);
    }

    void setInt(int column, int value) {
        ColumnVector vector = vectorFor(column, "int");
        if (vector.type().id() != ColumnType.INTEGER) {
            throw mismatch(column, "int");
        }
        vector.storeInt(count, value);
        vector.markPresent(count);
    }

    void setDouble(int column, double value) {
        ColumnVector vector = vectorFor(column, "double");
        if (vector.type().id() != ColumnType.DOUBLE) {
            throw mismatch(column, "double");
        }
        vector.storeDouble(count, value);
        vector.markPresent(count);
    }

    void setBoolean(int column, boolean value) {
        ColumnVector vector = vectorFor(column, "boolean");
        if (vector.type().id() != ColumnType.BOOLEAN) {
            throw mismatch(column, "boolean");
        }
        vector.storeBoolean(count, value);
        vector.markPresent(count);
    }

    /**
     * Stores any boxed value after a full type check. Lists and maps are copied into
     * unmodifiable collections so callers cannot mutate sealed data.
     */
    void setValue(int column, Object value) {
        if (value == null) {
            setNull(column);
            return;
        }
        ColumnVector vector = vectorFor(column, value.getClass().getSimpleName());
        DataType type = vector.type();
        if (!type.accepts(value)) {
            throw mismatch(column, value.getClass().getSimpleName());
        }
        vector.store(count, freeze(type, value));
        vector.markPresent(count);
    }

    void commitRow() {
        if (!rowOpen) {
            throw new SchemaViolationException("commitRow() called without beginRow()");
        }
        ColumnVector ts = vectors[schema.getTimestampColumn()];
        if (!ts.isNull(count)) {
            long micros = Math.floorDiv(ts.getLong(count), 1000L);
            if (micros < tsMinMicros) {
                tsMinMicros = micros;
            }
            if (micros > tsMaxMicros) {
                tsMaxMicros = micros;
            }
        }
        observeDimension(serviceTracker, schema.getServiceColumn());
        observeDimension(metricTracker, schema.getMetricNameColumn());
        count++;
        rowOpen = false;
    }

    void abortRow() {
        rowOpen = false;
    }

    /**
     * Writes a whole, already validated row.
     */
    void writeRow(Row row) {
        beginRow();
        for (int c = 0; c < vectors.length; c++) {
            Object cell = row.get(c);
            if (cell != null) {
                setValue(c, cell);
            }
        }
        commitRow();
    }

    ColumnarChunk seal(long sequence) {
        if (rowOpen) {
            throw new IllegalStateException("Cannot seal a chunk with an open row");
        }
        sealed = true;
        ColumnReader[] readers = new ColumnReader[vectors.length];
        System.arraycopy(vectors, 0, readers, 0, vectors.length);
        return new ColumnarChunk(schema, sequence, readers, count, capacity, tsMinMicros, tsMaxMicros,
                serviceTracker.freeze(), metricTracker.freeze());
    }

    private void observeDimension(DimensionTracker tracker, int column) {
        if (column != TableSchema.NO_COLUMN) {
            tracker.observe((String) vectors[column].getValue(count));
        }
    }

    private ColumnVector vectorFor(int column, String javaType) {
        if (!rowOpen) {
            throw new SchemaViolationException("No open row; call beginRow() first");
        }
        if (column < 0 || column >= vectors.length) {
            throw new SchemaViolationException("Column index " + column + " out of range for schema '"
                    + schema.getName() + "' with " + vectors.length + " columns"
                    + (javaType == null ? "" : " (setting " + javaType + ")"));
        }
        return vectors[column];
    }

    private SchemaViolationException mismatch(int column, String javaType) {
        return new SchemaViolationException("Column '" + schema.column(column).name() + "' of schema '"
                + schema.getName() + "' is " + schema.typeOf(column) + ", cannot set " + javaType);
    }

    private static Object freeze(DataType type, Object value) {
        if (type.id() == ColumnType.LIST) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(element == null ? null : freeze(type.elementType(), element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (type.id() == ColumnType.MAP) {
            @SuppressWarnings("unchecked")
            Map<String, String> map = (Map<String, String>) value;
            return Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
        return value;
    }
}
