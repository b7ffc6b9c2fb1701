package org.otelbuffer.datapipeline.scan;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of one scan, shared by all of its cursors.
 * <p>
 * <strong>Thread Safety:</strong> All counters are atomic.
 */
public final class ScanStatistics {

    private final long chunksTotal;
    private final AtomicLong chunksScanned = new AtomicLong();
    private final AtomicLong chunksPruned = new AtomicLong();
    private final AtomicLong rowsEvaluated = new AtomicLong();
    private final AtomicLong rowsEmitted = new AtomicLong();

    ScanStatistics(long chunksTotal) {
        this.chunksTotal = chunksTotal;
    }

    void recordPruned() {
        chunksPruned.incrementAndGet();
    }

    void recordScanned(long evaluated, long emitted) {
        chunksScanned.incrementAndGet();
        rowsEvaluated.addAndGet(evaluated);
        rowsEmitted.addAndGet(emitted);
    }

    /**
     * @return chunks in the snapshot the scan reads
     */
    public long getChunksTotal() {
        return chunksTotal;
    }

    /**
     * @return chunks whose rows were evaluated
     */
    public long getChunksScanned() {
        return chunksScanned.get();
    }

    /**
     * @return chunks skipped from their statistics alone
     */
    public long getChunksPruned() {
        return chunksPruned.get();
    }

    public long getRowsEvaluated() {
        return rowsEvaluated.get();
    }

    public long getRowsEmitted() {
        return rowsEmitted.get();
    }

    public Map<String, Number> toMap() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("chunks_total", chunksTotal);
        metrics.put("chunks_scanned", chunksScanned.get());
        metrics.put("chunks_pruned", chunksPruned.get());
        metrics.put("rows_evaluated", rowsEvaluated.get());
        metrics.put("rows_emitted", rowsEmitted.get());
        return metrics;
    }

    @Override
    public String toString() {
        return "ScanStatistics" + toMap();
    }
}
