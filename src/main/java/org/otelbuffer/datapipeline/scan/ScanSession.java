package org.otelbuffer.datapipeline.scan;

import org.otelbuffer.datapipeline.api.resources.buffer.BufferSnapshot;
import org.otelbuffer.datapipeline.api.resources.buffer.ColumnarChunk;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One scan over one snapshot, shared by any number of worker cursors.
 * <p>
 * Chunks are handed out through an atomic cursor: every chunk of the snapshot goes to exactly
 * one {@link ScanCursor}, and none is skipped. The snapshot is captured when the session is
 * opened, so later writes to the buffer are invisible to it.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe; each worker takes its own cursor from
 * {@link #newCursor()}.
 */
public final class ScanSession {

    private final BufferSnapshot snapshot;
    private final List<ColumnarChunk> chunks;
    private final BoundScan scan;
    private final RowMatcher matcher;
    private final ChunkPruner pruner;
    private final AtomicInteger nextChunk = new AtomicInteger();
    private final ScanStatistics statistics;

    ScanSession(BufferSnapshot snapshot, BoundScan scan, RowMatcher matcher, ChunkPruner pruner) {
        this.snapshot = snapshot;
        this.chunks = snapshot.getChunks();
        this.scan = scan;
        this.matcher = matcher;
        this.pruner = pruner;
        this.statistics = new ScanStatistics(chunks.size());
    }

    /**
     * @return a new cursor drawing chunks from this session
     */
    public ScanCursor newCursor() {
        return new ScanCursor(this);
    }

    public BufferSnapshot getSnapshot() {
        return snapshot;
    }

    public BoundScan getScan() {
        return scan;
    }

    public ScanStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return the next unclaimed chunk, or null when all chunks are claimed
     */
    ColumnarChunk claimNextChunk() {
        int index = nextChunk.getAndIncrement();
        // Bounded so repeated calls after exhaustion cannot overflow the counter.
        if (index >= chunks.size()) {
            nextChunk.set(chunks.size());
            return null;
        }
        return chunks.get(index);
    }

    RowMatcher matcher() {
        return matcher;
    }

    ChunkPruner pruner() {
        return pruner;
    }
}
