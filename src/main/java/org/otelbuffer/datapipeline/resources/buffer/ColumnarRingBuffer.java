package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.resources.buffer.BufferSnapshot;
import org.otelbuffer.datapipeline.api.resources.buffer.ColumnarChunk;
import org.otelbuffer.datapipeline.api.resources.buffer.IColumnarBufferReader;
import org.otelbuffer.datapipeline.api.resources.buffer.IColumnarBufferWriter;
import org.otelbuffer.datapipeline.api.resources.buffer.IScopedRowWriter;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, thread-safe, append-only columnar store for one schema.
 * <p>
 * Holds a FIFO deque of immutable {@link ColumnarChunk}s (oldest first) and one mutable
 * building chunk. When the building chunk reaches {@code chunkCapacity} rows it is sealed and
 * pushed onto the deque; if the deque then holds more than {@code maxChunks} chunks, exactly the
 * oldest one is evicted. Capacity overflow is never an error.
 * <p>
 * <strong>Visibility:</strong> snapshots only contain finalized chunks. Rows in the building
 * chunk become visible when it fills up or when {@link #flush()} seals it early.
 * <p>
 * <strong>Thread Safety:</strong> A {@link ReentrantReadWriteLock} guards the deque and the
 * building chunk. Writers hold the write lock for a whole batch ({@link #appendBatch(List)}) or
 * for the lifetime of a {@link #scopedWriter()}; readers hold the read lock only while copying
 * chunk references in {@link #snapshot()} or summing sizes in {@link #size()}. Iterating a
 * snapshot requires no lock. Evicted chunks stay alive as long as a snapshot references them.
 */
public class ColumnarRingBuffer implements IColumnarBufferReader, IColumnarBufferWriter {

    private static final Logger log = LoggerFactory.getLogger(ColumnarRingBuffer.class);

    private final TableSchema schema;
    private final int chunkCapacity;
    private final int maxChunks;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ArrayDeque<ColumnarChunk> chunks = new ArrayDeque<>();
    private ChunkBuilder building;
    private long finalizedRows;
    private long nextSequence;
    private long evictedChunks;
    private long evictedRows;

    /**
     * Creates a ring buffer.
     *
     * @param schema        the row layout
     * @param chunkCapacity rows per chunk (at least 1)
     * @param maxChunks     maximum finalized chunks retained (at least 1)
     * @throws IllegalArgumentException if a bound is not positive
     */
    public ColumnarRingBuffer(TableSchema schema, int chunkCapacity, int maxChunks) {
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        if (chunkCapacity <= 0) {
            throw new IllegalArgumentException("chunkCapacity must be positive for buffer '" + schema.getName() + "'");
        }
        if (maxChunks <= 0) {
            throw new IllegalArgumentException("maxChunks must be positive for buffer '" + schema.getName() + "'");
        }
        this.chunkCapacity = chunkCapacity;
        this.maxChunks = maxChunks;
        this.building = new ChunkBuilder(schema, chunkCapacity);
    }

    /**
     * Creates a ring buffer sized to retain roughly {@code rowCapacity} rows.
     *
     * @param schema        the row layout
     * @param rowCapacity   target row bound
     * @param chunkCapacity rows per chunk
     * @return a buffer with {@code max(1, ceil(rowCapacity / chunkCapacity))} chunks
     */
    public static ColumnarRingBuffer forRowCapacity(TableSchema schema, long rowCapacity, int chunkCapacity) {
        return new ColumnarRingBuffer(schema, chunkCapacity, chunksFor(rowCapacity, chunkCapacity));
    }

    static int chunksFor(long rowCapacity, int chunkCapacity) {
        if (chunkCapacity <= 0) {
            throw new IllegalArgumentException("chunkCapacity must be positive");
        }
        long chunksNeeded = (rowCapacity + chunkCapacity - 1) / chunkCapacity;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, chunksNeeded));
    }

    @Override
    public TableSchema getSchema() {
        return schema;
    }

    public int getChunkCapacity() {
        return chunkCapacity;
    }

    public int getMaxChunks() {
        return maxChunks;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void append(Row row) {
        schema.validate(row);
        lock.writeLock().lock();
        try {
            writeLocked(row);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void appendBatch(List<Row> rows) {
        if (rows.isEmpty()) {
            return;
        }
        for (Row row : rows) {
            schema.validate(row);
        }
        lock.writeLock().lock();
        try {
            for (Row row : rows) {
                writeLocked(row);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public IScopedRowWriter scopedWriter() {
        return new ScopedWriter();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean flush() {
        lock.writeLock().lock();
        try {
            if (building.size() == 0) {
                return false;
            }
            sealBuilding();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public BufferSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new BufferSnapshot(schema, List.copyOf(chunks));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return finalizedRows + building.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return number of finalized chunks currently retained
     */
    public int getChunkCount() {
        lock.readLock().lock();
        try {
            return chunks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return total number of chunks evicted since construction
     */
    public long getEvictedChunkCount() {
        lock.readLock().lock();
        try {
            return evictedChunks;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns buffer diagnostics for monitoring.
     *
     * @return metric name to value
     */
    public Map<String, Number> getMetrics() {
        lock.readLock().lock();
        try {
            return Map.of(
                    "chunks", chunks.size(),
                    "max_chunks", maxChunks,
                    "chunk_capacity", chunkCapacity,
                    "rows_finalized", finalizedRows,
                    "rows_building", building.size(),
                    "chunks_evicted", evictedChunks,
                    "rows_evicted", evictedRows);
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock.
    private void writeLocked(Row row) {
        building.writeRow(row);
        if (building.isFull()) {
            sealBuilding();
        }
    }

    // Caller holds the write lock.
    private void sealBuilding() {
        ColumnarChunk sealed = building.seal(nextSequence++);
        chunks.addLast(sealed);
        finalizedRows += sealed.size();
        building = new ChunkBuilder(schema, chunkCapacity);
        if (log.isDebugEnabled()) {
            log.debug("Sealed {} into '{}' ({} of {} chunks)", sealed, schema.getName(), chunks.size(), maxChunks);
        }
        if (chunks.size() > maxChunks) {
            ColumnarChunk evicted = chunks.removeFirst();
            finalizedRows -= evicted.size();
            evictedChunks++;
            evictedRows += evicted.size();
            log.debug("Evicted chunk #{} ({} rows) from '{}'", evicted.getSequence(), evicted.size(), schema.getName());
        }
    }

    /**
     * Row-at-a-time writer holding the write lock until {@link #close()}.
     */
    private final class ScopedWriter implements IScopedRowWriter {

        private boolean closed;
        private long rowsCommitted;

        ScopedWriter() {
            lock.writeLock().lock();
        }

        @Override
        public void beginRow() {
            ensureOpen();
            building.beginRow();
        }

        @Override
        public void setTimestamp(int column, long epochNanos) {
            ensureOpen();
            building.setTimestamp(column, epochNanos);
        }

        @Override
        public void setLong(int column, long value) {
            ensureOpen();
            building.setLong(column, value);
        }

        @Override
        public void setInt(int column, int value) {
            ensureOpen();
            building.setInt(column, value);
        }

        @Override
        public void setDouble(int column, double value) {
            ensureOpen();
            building.setDouble(column, value);
        }

        @Override
        public void setBoolean(int column, boolean value) {
            ensureOpen();
            building.setBoolean(column, value);
        }

        @Override
        public void setString(int column, String value) {
            ensureOpen();
            building.setValue(column, value);
        }

        @Override
        public void setList(int column, List<?> value) {
            ensureOpen();
            building.setValue(column, value);
        }

        @Override
        public void setMap(int column, Map<String, String> value) {
            ensureOpen();
            building.setValue(column, value);
        }

        @Override
        public void setValue(int column, Object value) {
            ensureOpen();
            building.setValue(column, value);
        }

        @Override
        public void setNull(int column) {
            ensureOpen();
            building.setNull(column);
        }

        @Override
        public void commitRow() {
            ensureOpen();
            building.commitRow();
            rowsCommitted++;
            if (building.isFull()) {
                sealBuilding();
            }
        }

        @Override
        public void abortRow() {
            ensureOpen();
            building.abortRow();
        }

        @Override
        public void writeRow(Row row) {
            ensureOpen();
            schema.validate(row);
            writeLocked(row);
            rowsCommitted++;
        }

        @Override
        public long getRowsCommitted() {
            return rowsCommitted;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                if (building.isRowOpen()) {
                    log.debug("Discarding uncommitted row in '{}' on writer close", schema.getName());
                    building.abortRow();
                }
            } finally {
                lock.writeLock().unlock();
            }
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Writer for '" + schema.getName() + "' is closed");
            }
        }
    }
}
