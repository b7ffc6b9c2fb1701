package org.otelbuffer.datapipeline.api.ingest;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.otelbuffer.datapipeline.api.schema.MetricShape;

import java.util.Map;
import java.util.Objects;

/**
 * Settings of one ingestion job, applied uniformly to all of its sources.
 * <p>
 * Build with {@link #builder(SignalType)} or {@link #fromConfig(SignalType, Config)}.
 * A metrics job under {@link OnErrorMode#NULLIFY} must be filtered to one shape, since the
 * all-null row needs a destination buffer.
 */
public final class IngestionOptions {

    /** Default document size bound: 100 MiB. */
    public static final long DEFAULT_MAX_DOCUMENT_BYTES = 100L * 1024 * 1024;
    /** Default number of leading bytes inspected by format detection. */
    public static final int DEFAULT_SNIFF_BYTES = 8192;
    /** Default rows per commit batch. */
    public static final int DEFAULT_BATCH_SIZE = 1024;

    private final SignalType signal;
    private final MetricShape metricShape;
    private final OnErrorMode onError;
    private final long maxDocumentBytes;
    private final int sniffBytes;
    private final int batchSize;
    private final boolean sealOnCompletion;
    private final int parallelism;

    private IngestionOptions(Builder builder) {
        this.signal = Objects.requireNonNull(builder.signal, "signal cannot be null");
        this.metricShape = builder.metricShape;
        this.onError = Objects.requireNonNull(builder.onError, "onError cannot be null");
        this.maxDocumentBytes = builder.maxDocumentBytes;
        this.sniffBytes = builder.sniffBytes;
        this.batchSize = builder.batchSize;
        this.sealOnCompletion = builder.sealOnCompletion;
        this.parallelism = builder.parallelism;
        if (metricShape != null && signal != SignalType.METRICS) {
            throw new IllegalArgumentException("A metric shape filter requires signal METRICS, not " + signal);
        }
        if (signal == SignalType.METRICS && metricShape == null && onError == OnErrorMode.NULLIFY) {
            throw new IllegalArgumentException("on_error=nullify for metrics requires a metric shape filter");
        }
        if (maxDocumentBytes <= 0) {
            throw new IllegalArgumentException("maxDocumentBytes must be positive");
        }
        if (sniffBytes <= 0) {
            throw new IllegalArgumentException("sniffBytes must be positive");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
    }

    public static Builder builder(SignalType signal) {
        return new Builder(signal);
    }

    /**
     * Reads options from configuration.
     *
     * @param signal  the signal the job ingests
     * @param options config with optional keys:
     *                <ul>
     *                  <li>{@code onError} - fail, skip or nullify (default: fail)</li>
     *                  <li>{@code maxDocumentBytes} - size bound per document (default: 100 MiB)</li>
     *                  <li>{@code sniffBytes} - format detection prefix (default: 8192)</li>
     *                  <li>{@code batchSize} - rows per commit batch (default: 1024)</li>
     *                  <li>{@code sealOnCompletion} - seal building chunks when done (default: true)</li>
     *                  <li>{@code parallelism} - workers for multi-source jobs (default: 1)</li>
     *                  <li>{@code metricShape} - optional shape filter for metrics</li>
     *                </ul>
     * @return the options
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static IngestionOptions fromConfig(SignalType signal, Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "onError", "fail",
                "maxDocumentBytes", DEFAULT_MAX_DOCUMENT_BYTES,
                "sniffBytes", DEFAULT_SNIFF_BYTES,
                "batchSize", DEFAULT_BATCH_SIZE,
                "sealOnCompletion", true,
                "parallelism", 1
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            Builder builder = builder(signal)
                    .onError(OnErrorMode.parse(finalConfig.getString("onError")))
                    .maxDocumentBytes(finalConfig.getBytes("maxDocumentBytes"))
                    .sniffBytes(finalConfig.getInt("sniffBytes"))
                    .batchSize(finalConfig.getInt("batchSize"))
                    .sealOnCompletion(finalConfig.getBoolean("sealOnCompletion"))
                    .parallelism(finalConfig.getInt("parallelism"));
            if (finalConfig.hasPath("metricShape")) {
                builder.metricShape(MetricShape.fromDiscriminator(finalConfig.getString("metricShape")));
            }
            return builder.build();
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for ingestion of " + signal, e);
        }
    }

    public SignalType getSignal() {
        return signal;
    }

    /**
     * @return the metric shape filter, or null
     */
    public MetricShape getMetricShape() {
        return metricShape;
    }

    public OnErrorMode getOnError() {
        return onError;
    }

    public long getMaxDocumentBytes() {
        return maxDocumentBytes;
    }

    public int getSniffBytes() {
        return sniffBytes;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isSealOnCompletion() {
        return sealOnCompletion;
    }

    public int getParallelism() {
        return parallelism;
    }

    @Override
    public String toString() {
        return "IngestionOptions{signal=" + signal + ", metricShape=" + metricShape + ", onError=" + onError
                + ", maxDocumentBytes=" + maxDocumentBytes + ", batchSize=" + batchSize
                + ", parallelism=" + parallelism + "}";
    }

    /**
     * Builder for {@link IngestionOptions}.
     */
    public static final class Builder {
        private final SignalType signal;
        private MetricShape metricShape;
        private OnErrorMode onError = OnErrorMode.FAIL;
        private long maxDocumentBytes = DEFAULT_MAX_DOCUMENT_BYTES;
        private int sniffBytes = DEFAULT_SNIFF_BYTES;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private boolean sealOnCompletion = true;
        private int parallelism = 1;

        private Builder(SignalType signal) {
            this.signal = signal;
        }

        public Builder metricShape(MetricShape shape) {
            this.metricShape = shape;
            return this;
        }

        public Builder onError(OnErrorMode mode) {
            this.onError = mode;
            return this;
        }

        public Builder maxDocumentBytes(long bytes) {
            this.maxDocumentBytes = bytes;
            return this;
        }

        public Builder sniffBytes(int bytes) {
            this.sniffBytes = bytes;
            return this;
        }

        public Builder batchSize(int rows) {
            this.batchSize = rows;
            return this;
        }

        public Builder sealOnCompletion(boolean seal) {
            this.sealOnCompletion = seal;
            return this;
        }

        public Builder parallelism(int workers) {
            this.parallelism = workers;
            return this;
        }

        public IngestionOptions build() {
            return new IngestionOptions(this);
        }
    }
}
