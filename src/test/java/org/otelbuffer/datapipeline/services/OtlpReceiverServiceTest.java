package org.otelbuffer.datapipeline.services;

import com.google.protobuf.StringValue;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.otelbuffer.datapipeline.api.schema.MetricShape;
import org.otelbuffer.datapipeline.api.schema.OtlpSchemas;
import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableKind;
import org.otelbuffer.datapipeline.api.services.IService;
import org.otelbuffer.datapipeline.api.services.OperationalError;
import org.otelbuffer.datapipeline.flatten.OtlpTestData;
import org.otelbuffer.datapipeline.resources.buffer.BufferSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class OtlpReceiverServiceTest {

    private BufferSet buffers;
    private OtlpReceiverService service;

    @BeforeEach
    void setUp() {
        buffers = new BufferSet(32, 8);
    }

    @AfterEach
    void tearDown() {
        if (service != null && (service.getCurrentState() == IService.State.RUNNING
                || service.getCurrentState() == IService.State.PAUSED)) {
            service.stop();
        }
    }

    private OtlpReceiverService newService(long idleSealMs) {
        Config config = ConfigFactory.parseMap(Map.of(
                "queueCapacity", 4,
                "pollTimeoutMs", 10,
                "idleSealMs", idleSealMs));
        service = new OtlpReceiverService("otlp-receiver", config, buffers);
        return service;
    }

    private long visibleLogRows() {
        return buffers.getBuffer(TableKind.LOGS).snapshot().rowCount();
    }

    @Test
    void rowsBecomeVisibleAfterIdleSeal() throws InterruptedException {
        newService(50).start();

        service.submit(OtlpTestData.logs("checkout", "a", "b", "c"));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertEquals(3, visibleLogRows()));
        assertEquals(3L, service.getSession().getRowsEmitted());
        assertEquals(1L, service.getMetrics().get("messages_received").longValue());
        assertTrue(service.getMetrics().get("chunks_sealed").longValue() >= 1);
    }

    @Test
    void stopDrainsQueueAndSeals() throws InterruptedException {
        newService(60_000).start();

        service.submit(OtlpTestData.logs("checkout", "first"));
        service.submit(OtlpTestData.gaugeAndSum("inventory"));
        service.stop();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertEquals(0, service.getQueueSize());
        List<Row> logs = buffers.getBuffer(TableKind.LOGS).snapshot().toRows();
        assertEquals(1, logs.size());
        assertEquals("first", logs.get(0).get(OtlpSchemas.Logs.BODY));
        assertEquals(1, buffers.getBufferForMetric(MetricShape.GAUGE).snapshot().rowCount());
        assertEquals(1, buffers.getBufferForMetric(MetricShape.SUM).snapshot().rowCount());
    }

    @Test
    void unsupportedMessagesAreRecordedAsErrors() throws InterruptedException {
        newService(50).start();

        service.submit(StringValue.of("not telemetry"));
        service.submit(OtlpTestData.logs("checkout", "ok"));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertEquals(1, visibleLogRows()));
        List<OperationalError> errors = service.getErrors();
        assertEquals(1, errors.size());
        assertEquals("UNSUPPORTED_MESSAGE", errors.get(0).code());
        assertTrue(errors.get(0).details().contains("google.protobuf.StringValue"));
        assertEquals(1L, service.getSession().getSkipped());
        assertFalse(service.isHealthy());

        service.clearErrors();
        assertTrue(service.isHealthy());
    }

    @Test
    void offerRejectsWhenQueueIsFull() {
        newService(50).start();
        service.pause();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
                assertEquals(IService.State.PAUSED, service.getCurrentState()));

        // The service thread may hold one message it polled before pausing.
        int accepted = 0;
        for (int i = 0; i < 6; i++) {
            if (service.offer(OtlpTestData.logs("svc", "m" + i))) {
                accepted++;
            }
        }

        assertTrue(accepted >= 4 && accepted <= 5, "accepted " + accepted);
        assertEquals(6L - accepted, service.getMetrics().get("messages_rejected").longValue());

        service.resume();
        final int expected = accepted;
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertEquals(expected, visibleLogRows()));
    }

    @Test
    void pausedServiceLeavesMessagesQueued() throws InterruptedException {
        newService(20).start();
        service.pause();
        // Let an in-flight poll time out so the loop parks in checkPause.
        Thread.sleep(50);

        service.submit(OtlpTestData.logs("svc", "queued"));
        Thread.sleep(100);
        assertEquals(1, service.getQueueSize());
        assertEquals(0, visibleLogRows());

        service.resume();
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertEquals(1, visibleLogRows()));
    }

    @Test
    void lifecycleTransitionsAreChecked() {
        newService(50);
        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertThrows(IllegalStateException.class, service::stop);

        service.start();
        assertThrows(IllegalStateException.class, service::start);
        assertThrows(IllegalStateException.class, service::resume);

        service.stop();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void metricsReportBufferedRows() throws InterruptedException {
        newService(50).start();
        service.submit(OtlpTestData.logs("svc", "x", "y"));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            Map<String, Number> metrics = service.getMetrics();
            assertEquals(2L, metrics.get("buffered_rows").longValue());
            assertEquals(2L, metrics.get("rows_emitted").longValue());
            assertEquals(0, metrics.get("queue_size").intValue());
        });
        assertEquals(0L, service.getMetrics().get("error_count").longValue());
    }

    @Test
    void rejectsInvalidConfiguration() {
        Config badCapacity = ConfigFactory.parseMap(Map.of("queueCapacity", 0));
        Config badType = ConfigFactory.parseMap(Map.of("idleSealMs", "soon"));

        assertThrows(IllegalArgumentException.class, () -> new OtlpReceiverService("r", badCapacity, buffers));
        assertThrows(IllegalArgumentException.class, () -> new OtlpReceiverService("r", badType, buffers));
    }
}
