package org.otelbuffer.datapipeline.api.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time, immutable view of a ring buffer's finalized chunks, oldest first.
 * <p>
 * Holding a snapshot keeps its chunks reachable even after the buffer evicts them, and no
 * later append can change a row observed through it. Iterating a snapshot needs no locking.
 */
public final class BufferSnapshot {

    private final TableSchema schema;
    private final List<ColumnarChunk> chunks;
    private final long rowCount;

    /**
     * @param schema the buffer schema
     * @param chunks finalized chunks, oldest first; copied
     */
    public BufferSnapshot(TableSchema schema, List<ColumnarChunk> chunks) {
        this.schema = schema;
        this.chunks = List.copyOf(chunks);
        long rows = 0;
        for (ColumnarChunk chunk : this.chunks) {
            rows += chunk.size();
        }
        this.rowCount = rows;
    }

    public TableSchema getSchema() {
        return schema;
    }

    public List<ColumnarChunk> getChunks() {
        return chunks;
    }

    public int chunkCount() {
        return chunks.size();
    }

    public long rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * Materializes every row of the snapshot. Intended for tests and small buffers.
     *
     * @return all rows, oldest first
     */
    public List<Row> toRows() {
        List<Row> rows = new ArrayList<>((int) Math.min(rowCount, Integer.MAX_VALUE));
        for (ColumnarChunk chunk : chunks) {
            rows.addAll(chunk.toRows());
        }
        return rows;
    }
}
