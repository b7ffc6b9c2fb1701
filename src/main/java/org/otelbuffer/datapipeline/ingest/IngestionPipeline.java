package org.otelbuffer.datapipeline.ingest;

import com.google.protobuf.Message;
import org.otelbuffer.datapipeline.api.ingest.DocumentSizeLimitException;
import org.otelbuffer.datapipeline.api.ingest.IIngestionSource;
import org.otelbuffer.datapipeline.api.ingest.IngestionAbortedException;
import org.otelbuffer.datapipeline.api.ingest.IngestionException;
import org.otelbuffer.datapipeline.api.ingest.IngestionOptions;
import org.otelbuffer.datapipeline.api.ingest.OnErrorMode;
import org.otelbuffer.datapipeline.api.ingest.OtlpFormat;
import org.otelbuffer.datapipeline.api.ingest.OtlpParseException;
import org.otelbuffer.datapipeline.api.ingest.SignalType;
import org.otelbuffer.datapipeline.api.ingest.UnknownFormatException;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableKind;
import org.otelbuffer.datapipeline.flatten.RecordFlattener;
import org.otelbuffer.datapipeline.resources.buffer.BufferSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads OTLP sources into a {@link BufferSet}.
 * <p>
 * Each source runs through the same steps:
 * <ol>
 *   <li><strong>Detect:</strong> sniff {@code sniffBytes} leading bytes with
 *       {@link FormatDetector}; an unrecognized layout is an {@link UnknownFormatException}.</li>
 *   <li><strong>Mode:</strong> for JSON, decide once between JSON Lines and a single
 *       document.</li>
 *   <li><strong>Decode:</strong> JSON Lines are decoded one line at a time; documents are read
 *       whole, up to {@code maxDocumentBytes}. An oversized unit is a
 *       {@link DocumentSizeLimitException} under every error policy.</li>
 *   <li><strong>Flatten and route:</strong> a unit is decoded completely before any of its rows
 *       is routed, so a malformed unit never leaves partial rows behind.</li>
 *   <li><strong>Commit:</strong> a {@link RowRouter} appends rows in batches of
 *       {@code batchSize}; at the end of the source the remainder is appended and, with
 *       {@code sealOnCompletion}, the touched buffers are sealed so snapshots see them.</li>
 * </ol>
 * Parse errors are resolved by the job's {@link OnErrorMode}. Under FAIL, rows committed before
 * the error stay in the buffers and the job throws {@link IngestionAbortedException}.
 * <p>
 * <strong>Thread Safety:</strong> Stateless apart from its decoders, which are themselves
 * stateless; one pipeline may run many jobs concurrently.
 */
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final int STREAM_BUFFER_BYTES = 64 * 1024;
    private static final int MAX_ARRAY_BYTES = Integer.MAX_VALUE - 8;

    private final OtlpJsonDecoder jsonDecoder = new OtlpJsonDecoder();
    private final OtlpProtobufDecoder protobufDecoder = new OtlpProtobufDecoder();

    /**
     * Ingests one source.
     *
     * @param source      the source
     * @param destination the buffers to fill
     * @param options     job settings
     * @return the job's diagnostics
     * @throws UnknownFormatException     if the format cannot be detected
     * @throws DocumentSizeLimitException if a unit exceeds {@code maxDocumentBytes}
     * @throws IngestionAbortedException  on the first parse error under FAIL
     * @throws IngestionException         if the source cannot be read
     */
    public IngestionSession ingest(IIngestionSource source, BufferSet destination, IngestionOptions options)
            throws IngestionException {
        IngestionSession session = new IngestionSession(options.getOnError());
        ingestSource(source, destination, options, session);
        logSummary(session, options);
        return session;
    }

    /**
     * Ingests one source with default settings apart from the error policy and size bound.
     *
     * @param source           the source
     * @param destination      the buffers to fill
     * @param signal           the signal the source carries
     * @param onError          error policy
     * @param maxDocumentBytes size bound per document or JSON line
     * @return the job's diagnostics
     * @throws IngestionException see {@link #ingest(IIngestionSource, BufferSet, IngestionOptions)}
     */
    public IngestionSession ingest(IIngestionSource source, BufferSet destination, SignalType signal,
                                   OnErrorMode onError, long maxDocumentBytes) throws IngestionException {
        IngestionOptions options = IngestionOptions.builder(signal)
                .onError(onError)
                .maxDocumentBytes(maxDocumentBytes)
                .build();
        return ingest(source, destination, options);
    }

    /**
     * Ingests several sources (for example the files of a glob) into one buffer set.
     * <p>
     * With {@code parallelism > 1}, workers pull sources through a shared atomic cursor so each
     * source is read by exactly one worker. The first failure stops the remaining workers from
     * taking new sources and is rethrown once all of them have finished.
     *
     * @param sources     the sources, in order
     * @param destination the buffers to fill
     * @param options     job settings
     * @return the diagnostics of the whole job
     * @throws IngestionException the first failure of any source
     */
    public IngestionSession ingestAll(List<? extends IIngestionSource> sources, BufferSet destination,
                                      IngestionOptions options) throws IngestionException {
        IngestionSession session = new IngestionSession(options.getOnError());
        int workers = Math.min(options.getParallelism(), sources.size());
        if (workers <= 1) {
            for (IIngestionSource source : sources) {
                ingestSource(source, destination, options, session);
            }
        } else {
            runParallel(sources, destination, options, session, workers);
        }
        logSummary(session, options);
        return session;
    }

    private void runParallel(List<? extends IIngestionSource> sources, BufferSet destination, IngestionOptions options,
                             IngestionSession session, int workers) throws IngestionException {
        AtomicInteger cursor = new AtomicInteger();
        AtomicReference<IngestionException> failure = new AtomicReference<>();
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            List<Future<Void>> futures = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                futures.add(executor.submit(() -> {
                    int index;
                    while (failure.get() == null && (index = cursor.getAndIncrement()) < sources.size()) {
                        try {
                            ingestSource(sources.get(index), destination, options, session);
                        } catch (IngestionException e) {
                            failure.compareAndSet(null, e);
                        }
                    }
                    return null;
                }));
            }
            for (Future<Void> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionException("(job)", "Interrupted while waiting for ingestion workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IngestionException("(job)", "Ingestion worker failed", cause);
        } finally {
            executor.shutdownNow();
        }
        if (failure.get() != null) {
            throw failure.get();
        }
    }

    private void ingestSource(IIngestionSource source, BufferSet destination, IngestionOptions options,
                              IngestionSession session) throws IngestionException {
        String name = source.getName();
        RecordFlattener flattener = new RecordFlattener(options.getMetricShape());
        RowRouter router = new RowRouter(destination, options.getBatchSize());
        int sniffBytes = options.getSniffBytes();
        Exception failure = null;
        try (InputStream raw = source.open();
             BufferedInputStream in = new BufferedInputStream(raw, Math.max(STREAM_BUFFER_BYTES, sniffBytes + 1))) {
            in.mark(sniffBytes + 1);
            byte[] prefix = in.readNBytes(sniffBytes);
            boolean complete = prefix.length < sniffBytes || in.read() < 0;
            in.reset();

            OtlpFormat format = FormatDetector.detect(prefix, prefix.length);
            session.recordFormat(name, format);
            if (format == OtlpFormat.UNKNOWN) {
                throw new UnknownFormatException(name);
            }
            if (format == OtlpFormat.JSON && FormatDetector.isJsonLines(name, prefix, prefix.length, complete)) {
                log.debug("Source '{}': JSON Lines", name);
                ingestJsonLines(in, name, options, session, flattener, router);
            } else {
                log.debug("Source '{}': single {} document", name, format);
                ingestDocument(in, name, format, options, session, flattener, router);
            }
            session.recordSourceProcessed();
        } catch (IOException e) {
            IngestionException readFailure = new IngestionException(name,
                    "Failed to read source '" + name + "': " + e.getMessage(), e);
            failure = readFailure;
            throw readFailure;
        } catch (IngestionException | RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            finishSource(name, options, session, flattener, router, failure);
        }
    }

    /**
     * Commits pending rows and seals touched buffers. A commit failure is rethrown unless the
     * source already failed, in which case it is attached to that failure as suppressed.
     */
    private static void finishSource(String name, IngestionOptions options, IngestionSession session,
                                     RecordFlattener flattener, RowRouter router, Exception failure) {
        RuntimeException commitFailure = null;
        try {
            router.commitPending();
        } catch (RuntimeException e) {
            commitFailure = e;
        }
        session.recordDroppedMetrics(flattener.getDroppedMetricCount());
        if (options.isSealOnCompletion()) {
            router.sealTouched();
        }
        if (commitFailure == null) {
            return;
        }
        if (failure == null) {
            throw commitFailure;
        }
        log.warn("Source '{}': committing pending rows failed after an earlier error: {}",
                name, commitFailure.getMessage());
        failure.addSuppressed(commitFailure);
    }

    private void ingestJsonLines(InputStream in, String name, IngestionOptions options, IngestionSession session,
                                 RecordFlattener flattener, RowRouter router) throws IOException, IngestionException {
        BoundedLineReader reader = new BoundedLineReader(in, name, options.getMaxDocumentBytes());
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            session.recordUnit();
            Message message;
            try {
                message = jsonDecoder.decode(line, options.getSignal());
            } catch (OtlpParseException e) {
                handleParseError(name, reader.getLineNumber(), true, e, options, session, router);
                continue;
            }
            session.recordRows(flattener.flatten(message, router));
        }
    }

    private void ingestDocument(InputStream in, String name, OtlpFormat format, IngestionOptions options,
                                IngestionSession session, RecordFlattener flattener, RowRouter router)
            throws IOException, IngestionException {
        long limit = options.getMaxDocumentBytes();
        int readBound = limit >= MAX_ARRAY_BYTES ? MAX_ARRAY_BYTES : (int) limit + 1;
        byte[] document = in.readNBytes(readBound);
        if (document.length > limit) {
            throw new DocumentSizeLimitException(name, limit);
        }
        // A document that fills the largest array cannot be held in full.
        if (document.length == MAX_ARRAY_BYTES && in.read() >= 0) {
            throw new DocumentSizeLimitException(name, MAX_ARRAY_BYTES);
        }
        session.recordUnit();
        Message message;
        try {
            message = format == OtlpFormat.JSON
                    ? jsonDecoder.decode(new String(document, StandardCharsets.UTF_8), options.getSignal())
                    : protobufDecoder.decode(document, document.length, options.getSignal());
        } catch (OtlpParseException e) {
            handleParseError(name, 0, false, e, options, session, router);
            return;
        }
        session.recordRows(flattener.flatten(message, router));
    }

    private void handleParseError(String name, long line, boolean lineLevel, OtlpParseException e,
                                  IngestionOptions options, IngestionSession session, RowRouter router)
            throws IngestionAbortedException {
        long errors = session.recordParseError(lineLevel);
        OnErrorMode mode = options.getOnError();
        switch (mode) {
            case FAIL -> throw new IngestionAbortedException(name, line, e);
            case SKIP -> session.recordSkipped();
            case NULLIFY -> {
                TableKind table = nullifyTable(options);
                router.accept(table, Row.allNull(OtlpSchemas.forTable(table).arity()));
                session.recordNullified();
                session.recordRows(1);
            }
        }
        if (errors == 1) {
            log.warn("Parse error in source '{}'{} (on_error={}): {}", name, line > 0 ? " on line " + line : "",
                    mode.name().toLowerCase(Locale.ROOT), e.getMessage());
        } else {
            log.debug("Parse error #{} in source '{}' line {}: {}", errors, name, line, e.getMessage());
        }
    }

    private static TableKind nullifyTable(IngestionOptions options) {
        if (options.getSignal() == SignalType.METRICS) {
            // Guaranteed non-null by IngestionOptions for NULLIFY metric jobs.
            return options.getMetricShape().getTableKind();
        }
        return options.getSignal().defaultTable();
    }

    private static void logSummary(IngestionSession session, IngestionOptions options) {
        log.info("Ingested {} source(s) of {}: {} units, {} rows, {} parse errors (format={}, on_error={})",
                session.getSourcesProcessed(), options.getSignal(), session.getRecordsScanned(),
                session.getRowsEmitted(), session.getParseErrors(), session.getFormatDetected(),
                options.getOnError());
        if (session.getParseErrors() > 0 && options.getOnError() != OnErrorMode.FAIL) {
            log.warn("{} of {} units could not be parsed ({}% error rate, {} skipped, {} nullified)",
                    session.getParseErrors(), session.getRecordsScanned(),
                    String.format(Locale.ROOT, "%.1f", session.getErrorRate() * 100),
                    session.getSkipped(), session.getNullified());
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "otel-ingest-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
