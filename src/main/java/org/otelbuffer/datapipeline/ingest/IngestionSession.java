package org.otelbuffer.datapipeline.ingest;

import org.otelbuffer.datapipeline.api.ingest.OnErrorMode;
import org.otelbuffer.datapipeline.api.ingest.OtlpFormat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Diagnostics of one ingestion job or attached stream.
 * <p>
 * Returned by {@link IngestionPipeline#ingest} and owned by the caller; there is no global
 * registry. Counters are updated whatever the error policy, so data quality can be audited
 * under {@link OnErrorMode#SKIP} and {@link OnErrorMode#NULLIFY} too.
 * <p>
 * <strong>Thread Safety:</strong> All counters are atomic; workers of a parallel job share one
 * session.
 */
public class IngestionSession {

    private final OnErrorMode onError;
    private final AtomicLong recordsScanned = new AtomicLong();
    private final AtomicLong rowsEmitted = new AtomicLong();
    private final AtomicLong parseErrors = new AtomicLong();
    private final AtomicLong errorRecords = new AtomicLong();
    private final AtomicLong errorDocuments = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong nullified = new AtomicLong();
    private final AtomicLong droppedMetrics = new AtomicLong();
    private final AtomicLong sourcesProcessed = new AtomicLong();
    private final Map<String, OtlpFormat> formatsBySource = new ConcurrentHashMap<>();
    private volatile OtlpFormat lastFormat = OtlpFormat.UNKNOWN;

    public IngestionSession(OnErrorMode onError) {
        this.onError = onError;
    }

    public OnErrorMode getOnError() {
        return onError;
    }

    public void recordFormat(String sourceName, OtlpFormat format) {
        formatsBySource.put(sourceName, format);
        lastFormat = format;
    }

    public void recordUnit() {
        recordsScanned.incrementAndGet();
    }

    public void recordRows(long rows) {
        rowsEmitted.addAndGet(rows);
    }

    /**
     * Counts one malformed unit.
     *
     * @param lineLevel true for a JSON line, false for a whole document
     * @return the total number of parse errors including this one
     */
    public long recordParseError(boolean lineLevel) {
        if (lineLevel) {
            errorRecords.incrementAndGet();
        } else {
            errorDocuments.incrementAndGet();
        }
        return parseErrors.incrementAndGet();
    }

    public void recordSkipped() {
        skipped.incrementAndGet();
    }

    public void recordNullified() {
        nullified.incrementAndGet();
    }

    public void recordDroppedMetrics(long count) {
        droppedMetrics.addAndGet(count);
    }

    public void recordSourceProcessed() {
        sourcesProcessed.incrementAndGet();
    }

    /**
     * @return units read: JSON lines, or whole documents
     */
    public long getRecordsScanned() {
        return recordsScanned.get();
    }

    public long getRowsEmitted() {
        return rowsEmitted.get();
    }

    public long getParseErrors() {
        return parseErrors.get();
    }

    public long getErrorRecords() {
        return errorRecords.get();
    }

    public long getErrorDocuments() {
        return errorDocuments.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    public long getNullified() {
        return nullified.get();
    }

    /**
     * @return metrics dropped because they carried no data points
     */
    public long getDroppedMetrics() {
        return droppedMetrics.get();
    }

    public long getSourcesProcessed() {
        return sourcesProcessed.get();
    }

    /**
     * @return format of the most recently detected source, UNKNOWN before the first
     */
    public OtlpFormat getFormatDetected() {
        return lastFormat;
    }

    /**
     * @param sourceName a source of this job
     * @return its detected format, or null if it was never detected
     */
    public OtlpFormat getFormatDetected(String sourceName) {
        return formatsBySource.get(sourceName);
    }

    /**
     * @return parse errors per unit scanned, 0 when nothing was scanned
     */
    public double getErrorRate() {
        long scanned = recordsScanned.get();
        return scanned == 0 ? 0.0 : (double) parseErrors.get() / scanned;
    }

    /**
     * Returns all counters keyed by their diagnostic names ({@code records_scanned},
     * {@code parse_errors}, {@code format_detected}, ...).
     *
     * @return an insertion-ordered, unmodifiable snapshot of the counters
     */
    public Map<String, Object> diagnostics() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("records_scanned", recordsScanned.get());
        result.put("rows_emitted", rowsEmitted.get());
        result.put("parse_errors", parseErrors.get());
        result.put("error_records", errorRecords.get());
        result.put("error_documents", errorDocuments.get());
        result.put("skipped", skipped.get());
        result.put("nullified", nullified.get());
        result.put("dropped_metrics", droppedMetrics.get());
        result.put("sources_processed", sourcesProcessed.get());
        result.put("format_detected", lastFormat.name().toLowerCase(Locale.ROOT));
        result.put("on_error", onError.name().toLowerCase(Locale.ROOT));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "IngestionSession" + diagnostics();
    }
}
