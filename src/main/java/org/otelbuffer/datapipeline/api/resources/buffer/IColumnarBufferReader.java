package org.otelbuffer.datapipeline.api.resources.buffer;

import org.otelbuffer.datapipeline.api.schema.TableSchema;

/**
 * Read side of a columnar buffer, used by scans and diagnostics.
 * <p>
 * Implementations must be thread-safe: any number of readers may call these methods while
 * a writer appends.
 */
public interface IColumnarBufferReader {

    TableSchema getSchema();

    /**
     * Captures the buffer's finalized chunks. Rows in the chunk still being built are not included.
     *
     * @return an immutable snapshot
     */
    BufferSnapshot snapshot();

    /**
     * Returns the number of committed rows, finalized and building. The value may be stale by
     * the time it is used; callers needing a stable count must take a {@link #snapshot()}.
     *
     * @return approximate committed row count
     */
    long size();
}
