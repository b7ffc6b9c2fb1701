package org.otelbuffer.datapipeline.resources.buffer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.otelbuffer.datapipeline.api.schema.MetricShape;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.TableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The seven ring buffers of one ingestion source: traces, logs and the five metric shapes.
 * <p>
 * All buffers are created together with the same chunk capacity and chunk bound. A buffer set
 * typically lives as long as the attached stream or ingestion job that fills it.
 */
public class BufferSet {

    private static final Logger log = LoggerFactory.getLogger(BufferSet.class);

    /** Default rows per chunk. */
    public static final int DEFAULT_CHUNK_CAPACITY = 2048;
    /** Default finalized chunks retained per buffer. */
    public static final int DEFAULT_MAX_CHUNKS = 256;

    private final Map<TableKind, ColumnarRingBuffer> buffers = new EnumMap<>(TableKind.class);
    private final int chunkCapacity;
    private final int maxChunks;

    /**
     * Creates a buffer set.
     *
     * @param chunkCapacity rows per chunk
     * @param maxChunks     finalized chunks retained per buffer
     */
    public BufferSet(int chunkCapacity, int maxChunks) {
        this.chunkCapacity = chunkCapacity;
        this.maxChunks = maxChunks;
        for (TableKind kind : TableKind.values()) {
            buffers.put(kind, new ColumnarRingBuffer(OtlpSchemas.forTable(kind), chunkCapacity, maxChunks));
        }
    }

    /**
     * Creates a buffer set from a target row bound.
     *
     * @param rowCapacity   target rows per buffer; used when {@code maxChunks <= 0}
     * @param chunkCapacity rows per chunk
     * @param maxChunks     explicit chunk bound, or 0 to derive it from {@code rowCapacity}
     * @return the buffer set
     */
    public static BufferSet withCapacity(long rowCapacity, int chunkCapacity, int maxChunks) {
        int chunks = maxChunks > 0 ? maxChunks : ColumnarRingBuffer.chunksFor(rowCapacity, chunkCapacity);
        return new BufferSet(chunkCapacity, chunks);
    }

    /**
     * Creates a buffer set from configuration.
     *
     * @param options config with optional keys:
     *                <ul>
     *                  <li>{@code chunkCapacity} - rows per chunk (default: 2048)</li>
     *                  <li>{@code maxChunks} - finalized chunks per buffer (default: 256)</li>
     *                  <li>{@code rowCapacity} - target rows per buffer; when positive it
     *                      overrides {@code maxChunks} (default: 0)</li>
     *                </ul>
     * @return the buffer set
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static BufferSet fromConfig(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "chunkCapacity", DEFAULT_CHUNK_CAPACITY,
                "maxChunks", DEFAULT_MAX_CHUNKS,
                "rowCapacity", 0
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            int chunkCapacity = finalConfig.getInt("chunkCapacity");
            int maxChunks = finalConfig.getInt("maxChunks");
            long rowCapacity = finalConfig.getLong("rowCapacity");
            if (chunkCapacity <= 0) {
                throw new IllegalArgumentException("chunkCapacity must be positive");
            }
            if (rowCapacity < 0) {
                throw new IllegalArgumentException("rowCapacity cannot be negative");
            }
            BufferSet set = rowCapacity > 0
                    ? withCapacity(rowCapacity, chunkCapacity, 0)
                    : new BufferSet(chunkCapacity, maxChunks);
            log.debug("Created buffer set: chunkCapacity={}, maxChunks={}", set.chunkCapacity, set.maxChunks);
            return set;
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for BufferSet", e);
        }
    }

    public ColumnarRingBuffer getBuffer(TableKind kind) {
        return buffers.get(kind);
    }

    public ColumnarRingBuffer getBufferForMetric(MetricShape shape) {
        return buffers.get(shape.getTableKind());
    }

    /**
     * @return the five metric buffers in {@link MetricShape} order
     */
    public List<ColumnarRingBuffer> getAllMetricBuffers() {
        List<ColumnarRingBuffer> result = new ArrayList<>(MetricShape.values().length);
        for (MetricShape shape : MetricShape.values()) {
            result.add(getBufferForMetric(shape));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Seals the building chunk of every buffer that holds uncommitted-to-snapshot rows.
     *
     * @return number of chunks sealed
     */
    public int flushAll() {
        int sealed = 0;
        for (ColumnarRingBuffer buffer : buffers.values()) {
            if (buffer.flush()) {
                sealed++;
            }
        }
        return sealed;
    }

    /**
     * @return approximate committed rows across all seven buffers
     */
    public long totalSize() {
        long total = 0;
        for (ColumnarRingBuffer buffer : buffers.values()) {
            total += buffer.size();
        }
        return total;
    }

    public int getChunkCapacity() {
        return chunkCapacity;
    }

    public int getMaxChunks() {
        return maxChunks;
    }
}
