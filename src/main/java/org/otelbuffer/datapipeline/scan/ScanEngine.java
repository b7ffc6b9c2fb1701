package org.otelbuffer.datapipeline.scan;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.otelbuffer.datapipeline.api.resources.buffer.BufferSnapshot;
import org.otelbuffer.datapipeline.api.resources.buffer.IColumnarBufferReader;
import org.otelbuffer.datapipeline.api.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Filtered, projected scans over columnar buffers.
 * <p>
 * A scan binds its request against the buffer's schema, takes one snapshot, and then walks the
 * snapshot's chunks: chunks refuted by their statistics are skipped, the remaining rows are
 * filtered by the request's predicates, and matching rows are returned as projected
 * {@link RowBatch}es. Binding errors surface as {@link ScanBindException} before any chunk is
 * read.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe. Scans never block writers beyond the snapshot
 * capture.
 */
public class ScanEngine {

    private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

    public static final int DEFAULT_PARALLELISM = 4;

    private final RowMatcher matcher;
    private final ChunkPruner pruner;
    private final int parallelism;

    public ScanEngine() {
        this(DEFAULT_PARALLELISM);
    }

    public ScanEngine(int parallelism) {
        this(new RowMatcher(), new ChunkPruner(), parallelism);
    }

    ScanEngine(RowMatcher matcher, ChunkPruner pruner, int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.matcher = matcher;
        this.pruner = pruner;
        this.parallelism = parallelism;
    }

    /**
     * Creates an engine from an {@code otelbuffer.scan} subtree.
     *
     * @param options configuration; missing keys fall back to defaults
     * @return the engine
     */
    public static ScanEngine fromConfig(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of("parallelism", DEFAULT_PARALLELISM));
        try {
            return new ScanEngine(options.withFallback(defaults).getInt("parallelism"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for ScanEngine", e);
        }
    }

    /**
     * Checks a request against a schema without executing it.
     *
     * @param schema  the schema to scan
     * @param request the request
     * @return the bound scan
     * @throws ScanBindException if the request does not fit the schema
     */
    public BoundScan bind(TableSchema schema, ScanRequest request) {
        return BoundScan.bind(schema, request);
    }

    /**
     * Starts a single-worker scan over a fresh snapshot of the buffer.
     *
     * @param buffer  the buffer
     * @param request the request
     * @return a cursor over the matching batches
     * @throws ScanBindException if the request does not fit the buffer's schema
     */
    public ScanCursor scan(IColumnarBufferReader buffer, ScanRequest request) {
        return open(buffer, request).newCursor();
    }

    /**
     * Starts a single-worker scan over an existing snapshot.
     */
    public ScanCursor scan(BufferSnapshot snapshot, ScanRequest request) {
        return open(snapshot, request).newCursor();
    }

    /**
     * Opens a scan session that several workers can share.
     *
     * @param buffer  the buffer
     * @param request the request
     * @return a session over a fresh snapshot of the buffer
     * @throws ScanBindException if the request does not fit the buffer's schema
     */
    public ScanSession open(IColumnarBufferReader buffer, ScanRequest request) {
        // Bind before the snapshot so an invalid request never touches the buffer lock.
        BoundScan bound = bind(buffer.getSchema(), request);
        return new ScanSession(buffer.snapshot(), bound, matcher, pruner);
    }

    public ScanSession open(BufferSnapshot snapshot, ScanRequest request) {
        BoundScan bound = bind(snapshot.getSchema(), request);
        return new ScanSession(snapshot, bound, matcher, pruner);
    }

    /**
     * Scans with the engine's configured parallelism.
     *
     * @see #parallelScan(IColumnarBufferReader, ScanRequest, int, Consumer)
     */
    public ScanStatistics parallelScan(IColumnarBufferReader buffer, ScanRequest request, Consumer<RowBatch> consumer) {
        return parallelScan(buffer, request, parallelism, consumer);
    }

    /**
     * Scans one snapshot with several workers sharing a session.
     * <p>
     * Every chunk is handed to exactly one worker. The consumer is called from worker threads and
     * must be thread-safe; batches arrive in no particular order.
     *
     * @param buffer   the buffer
     * @param request  the request
     * @param workers  number of worker threads
     * @param consumer receives every matching batch
     * @return statistics of the completed scan
     * @throws ScanBindException if the request does not fit the buffer's schema
     */
    public ScanStatistics parallelScan(IColumnarBufferReader buffer, ScanRequest request, int workers,
                                       Consumer<RowBatch> consumer) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        ScanSession session = open(buffer, request);
        int threads = Math.max(1, Math.min(workers, session.getSnapshot().chunkCount()));
        if (threads == 1) {
            drain(session.newCursor(), consumer);
        } else {
            runWorkers(session, threads, consumer);
        }
        log.debug("Scan of {} finished: {}", buffer.getSchema().getName(), session.getStatistics());
        return session.getStatistics();
    }

    private static void runWorkers(ScanSession session, int threads, Consumer<RowBatch> consumer) {
        ExecutorService executor = Executors.newFixedThreadPool(threads, workerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(threads);
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> drain(session.newCursor(), consumer)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for scan workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Scan worker failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void drain(ScanCursor cursor, Consumer<RowBatch> consumer) {
        RowBatch batch;
        while ((batch = cursor.nextBatch()) != null) {
            consumer.accept(batch);
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "otel-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public int getParallelism() {
        return parallelism;
    }
}
