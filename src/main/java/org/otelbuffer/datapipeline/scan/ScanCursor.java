package org.otelbuffer.datapipeline.scan;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.otelbuffer.datapipeline.api.resources.buffer.ColumnarChunk;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, finite sequence of {@link RowBatch}es drawn from a {@link ScanSession}.
 * <p>
 * Each call to {@link #nextBatch()} claims chunks from the session until one yields at least
 * one matching row. Pruned chunks are never evaluated row by row. A scan without predicates
 * returns whole-chunk batches without a selection vector. The cursor cannot be restarted; stop
 * pulling to end the scan early.
 * <p>
 * <strong>Thread Safety:</strong> A cursor belongs to one worker. Cursors of the same session
 * may run concurrently.
 */
public final class ScanCursor implements Iterator<RowBatch> {

    private final ScanSession session;
    private final BoundScan scan;
    private final int[] projection;
    private RowBatch lookahead;
    private boolean exhausted;

    ScanCursor(ScanSession session) {
        this.session = session;
        this.scan = session.getScan();
        this.projection = scan.getProjection();
    }

    /**
     * @return the next non-empty batch, or null when the scan is complete
     */
    public RowBatch nextBatch() {
        if (lookahead != null) {
            RowBatch batch = lookahead;
            lookahead = null;
            return batch;
        }
        if (exhausted) {
            return null;
        }
        ScanStatistics statistics = session.getStatistics();
        ColumnarChunk chunk;
        while ((chunk = session.claimNextChunk()) != null) {
            if (session.pruner().canPrune(chunk, scan)) {
                statistics.recordPruned();
                continue;
            }
            if (scan.getPredicates().isEmpty()) {
                statistics.recordScanned(chunk.size(), chunk.size());
                return new RowBatch(chunk, projection, null);
            }
            IntArrayList selection = session.matcher().select(chunk, scan);
            statistics.recordScanned(chunk.size(), selection.size());
            if (!selection.isEmpty()) {
                return new RowBatch(chunk, projection, selection.toIntArray());
            }
        }
        exhausted = true;
        return null;
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null) {
            lookahead = nextBatch();
        }
        return lookahead != null;
    }

    @Override
    public RowBatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Scan is complete");
        }
        RowBatch batch = lookahead;
        lookahead = null;
        return batch;
    }

    public ScanStatistics getStatistics() {
        return session.getStatistics();
    }
}
