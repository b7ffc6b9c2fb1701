package org.otelbuffer.datapipeline.resources.buffer;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.otelbuffer.datapipeline.TestRows;
import org.otelbuffer.datapipeline.api.schema.MetricShape;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.TableKind;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BufferSetTest {

    @Test
    void holdsOneBufferPerTableWithItsSchema() {
        BufferSet set = new BufferSet(16, 4);

        for (TableKind kind : TableKind.values()) {
            assertThat(set.getBuffer(kind).getSchema()).isSameAs(OtlpSchemas.forTable(kind));
            assertThat(set.getBuffer(kind).getChunkCapacity()).isEqualTo(16);
        }
        assertThat(set.getBufferForMetric(MetricShape.SUMMARY)).isSameAs(set.getBuffer(TableKind.METRICS_SUMMARY));
        assertThat(set.getAllMetricBuffers()).hasSize(5)
                .first().isSameAs(set.getBufferForMetric(MetricShape.GAUGE));
    }

    @Test
    void flushAllSealsOnlyBuffersWithBuildingRows() {
        BufferSet set = new BufferSet(16, 4);
        set.getBuffer(TableKind.LOGS).appendBatch(TestRows.logs(3, 0L, 1L, "svc"));
        set.getBufferForMetric(MetricShape.GAUGE).append(TestRows.gauge(1L, "svc", "cpu", 0.5));

        assertThat(set.totalSize()).isEqualTo(4);
        assertThat(set.flushAll()).isEqualTo(2);
        assertThat(set.flushAll()).isZero();
        assertThat(set.getBuffer(TableKind.LOGS).snapshot().rowCount()).isEqualTo(3);
    }

    @Test
    void fromConfigUsesRowCapacityWhenPositive() {
        BufferSet set = BufferSet.fromConfig(ConfigFactory.parseMap(Map.of(
                "chunkCapacity", 100,
                "rowCapacity", 1000)));

        assertThat(set.getChunkCapacity()).isEqualTo(100);
        assertThat(set.getMaxChunks()).isEqualTo(10);
    }

    @Test
    void fromConfigFallsBackToDefaults() {
        BufferSet set = BufferSet.fromConfig(ConfigFactory.empty());

        assertThat(set.getChunkCapacity()).isEqualTo(BufferSet.DEFAULT_CHUNK_CAPACITY);
        assertThat(set.getMaxChunks()).isEqualTo(BufferSet.DEFAULT_MAX_CHUNKS);
    }

    @Test
    void fromConfigWrapsInvalidValues() {
        assertThatThrownBy(() -> BufferSet.fromConfig(ConfigFactory.parseMap(Map.of("maxChunks", "many")))
        ).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid configuration for BufferSet");
    }
}
