package org.otelbuffer.datapipeline.services;

import com.google.protobuf.Message;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.opentelemetry.proto.logs.v1.LogsData;
import io.opentelemetry.proto.metrics.v1.MetricsData;
import io.opentelemetry.proto.trace.v1.TracesData;
import org.otelbuffer.datapipeline.api.ingest.OnErrorMode;
import org.otelbuffer.datapipeline.flatten.RecordFlattener;
import org.otelbuffer.datapipeline.ingest.IngestionSession;
import org.otelbuffer.datapipeline.ingest.RowRouter;
import org.otelbuffer.datapipeline.resources.buffer.BufferSet;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Receives decoded OTLP messages pushed by an exporter front end and writes them into a
 * {@link BufferSet}.
 * <p>
 * Producers hand {@link TracesData}, {@link LogsData} or {@link MetricsData} to
 * {@link #offer(Message)} or {@link #submit(Message)}; the service thread drains the queue,
 * flattens every message and commits its rows before taking the next one. Other message types
 * are recorded as operational errors and skipped.
 * <p>
 * Rows become visible to scans when their chunk is sealed: once the queue has been idle for
 * {@code idleSealMs}, and when the service stops.
 * <p>
 * Configuration keys: {@code queueCapacity}, {@code pollTimeoutMs}, {@code idleSealMs},
 * {@code batchSize}, {@code shutdownTimeout}.
 * <p>
 * <strong>Thread Safety:</strong> {@code offer}/{@code submit} may be called from any thread.
 */
public class OtlpReceiverService extends AbstractService {

    private final BufferSet destination;
    private final BlockingQueue<Message> queue;
    private final long pollTimeoutMs;
    private final long idleSealMs;
    private final RecordFlattener flattener = new RecordFlattener();
    private final RowRouter router;
    private final IngestionSession session = new IngestionSession(OnErrorMode.SKIP);
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong messagesRejected = new AtomicLong();
    private final AtomicLong chunksSealed = new AtomicLong();

    private long lastDroppedMetrics;
    private long lastWriteMillis;
    private boolean unsealedWrites;

    public OtlpReceiverService(String name, Config options, BufferSet destination) {
        super(name, options.withFallback(defaults()));
        this.destination = destination;
        try {
            int queueCapacity = this.options.getInt("queueCapacity");
            this.pollTimeoutMs = this.options.getLong("pollTimeoutMs");
            this.idleSealMs = this.options.getLong("idleSealMs");
            int batchSize = this.options.getInt("batchSize");
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("queueCapacity must be positive");
            }
            if (pollTimeoutMs <= 0) {
                throw new IllegalArgumentException("pollTimeoutMs must be positive");
            }
            this.queue = new ArrayBlockingQueue<>(queueCapacity);
            this.router = new RowRouter(destination, batchSize);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for OtlpReceiverService", e);
        }
    }

    private static Config defaults() {
        return ConfigFactory.parseMap(Map.of(
                "queueCapacity", 1000,
                "pollTimeoutMs", 100,
                "idleSealMs", 1000,
                "batchSize", 1024,
                "shutdownTimeout", 5
        ));
    }

    /**
     * Enqueues a message without blocking.
     *
     * @param message a decoded OTLP message
     * @return false if the queue is full
     */
    public boolean offer(Message message) {
        boolean accepted = queue.offer(message);
        if (!accepted) {
            messagesRejected.incrementAndGet();
        }
        return accepted;
    }

    /**
     * Enqueues a message, waiting for space.
     *
     * @param message a decoded OTLP message
     * @throws InterruptedException if interrupted while waiting
     */
    public void submit(Message message) throws InterruptedException {
        queue.put(message);
    }

    @Override
    protected void logStarted() {
        log.info("{} started: queueCapacity={}, idleSealMs={}", serviceName,
                queue.remainingCapacity() + queue.size(), idleSealMs);
    }

    @Override
    protected void run() throws InterruptedException {
        try {
            while (!isStopRequested()) {
                checkPause();
                Message message = queue.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
                if (message != null) {
                    process(message);
                } else if (unsealedWrites && System.currentTimeMillis() - lastWriteMillis >= idleSealMs) {
                    seal("idle");
                }
            }
            Message remaining;
            while ((remaining = queue.poll()) != null) {
                process(remaining);
            }
        } finally {
            seal("stop");
        }
    }

    private void process(Message message) {
        messagesReceived.incrementAndGet();
        session.recordUnit();
        if (!(message instanceof TracesData || message instanceof LogsData || message instanceof MetricsData)) {
            String type = message.getDescriptorForType().getFullName();
            log.warn("{} skipped unsupported message type {}", serviceName, type);
            recordError("UNSUPPORTED_MESSAGE", "Unsupported OTLP message type", "type=" + type);
            session.recordSkipped();
            return;
        }
        int rows = flattener.flatten(message, router);
        router.commitPending();
        session.recordRows(rows);
        long dropped = flattener.getDroppedMetricCount();
        if (dropped > lastDroppedMetrics) {
            session.recordDroppedMetrics(dropped - lastDroppedMetrics);
            lastDroppedMetrics = dropped;
        }
        if (rows > 0) {
            unsealedWrites = true;
            lastWriteMillis = System.currentTimeMillis();
        }
    }

    private void seal(String reason) {
        router.commitPending();
        int sealed = router.sealTouched();
        unsealedWrites = false;
        if (sealed > 0) {
            chunksSealed.addAndGet(sealed);
            log.debug("{} sealed {} chunks on {}", serviceName, sealed, reason);
        }
    }

    /**
     * @return diagnostics of everything received since the service was created
     */
    public IngestionSession getSession() {
        return session;
    }

    public BufferSet getDestination() {
        return destination;
    }

    public int getQueueSize() {
        return queue.size();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("messages_received", messagesReceived.get());
        metrics.put("messages_rejected", messagesRejected.get());
        metrics.put("rows_emitted", session.getRowsEmitted());
        metrics.put("queue_size", queue.size());
        metrics.put("chunks_sealed", chunksSealed.get());
        metrics.put("buffered_rows", destination.totalSize());
    }
}
