package org.otelbuffer.datapipeline.services;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.otelbuffer.datapipeline.api.services.IService;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AbstractServiceTest {

    // Counts loop iterations until asked to stop.
    private static class CountingService extends AbstractService {
        final AtomicInteger iterations = new AtomicInteger();
        volatile boolean failNext = false;

        CountingService(Config options) {
            super("counting-service", options);
        }

        @Override
        protected void run() throws InterruptedException {
            while (!isStopRequested()) {
                checkPause();
                if (failNext) {
                    throw new IllegalStateException("boom");
                }
                iterations.incrementAndGet();
                Thread.sleep(5);
            }
        }

        void error(String code) {
            recordError(code, "test error", "");
        }

        @Override
        protected int getMaxErrors() {
            return 3;
        }
    }

    // Ignores stop requests and only ends on interrupt.
    private static class StubbornService extends AbstractService {
        StubbornService(Config options) {
            super("stubborn-service", options);
        }

        @Override
        protected void run() throws InterruptedException {
            while (true) {
                Thread.sleep(10);
            }
        }
    }

    @Test
    void serviceStartsAndStopsCorrectly() {
        CountingService service = new CountingService(ConfigFactory.empty());
        assertEquals(IService.State.STOPPED, service.getCurrentState());

        service.start();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertTrue(service.iterations.get() > 0));
        assertEquals(IService.State.RUNNING, service.getCurrentState());

        service.stop();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void servicePausesAndResumesCorrectly() throws InterruptedException {
        CountingService service = new CountingService(ConfigFactory.empty());
        service.start();
        service.pause();
        assertEquals(IService.State.PAUSED, service.getCurrentState());
        Thread.sleep(30);

        int frozen = service.iterations.get();
        Thread.sleep(50);
        assertEquals(frozen, service.iterations.get());

        service.resume();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertTrue(service.iterations.get() > frozen));
        service.stop();
    }

    @Test
    void stopWhilePausedEndsTheLoop() {
        CountingService service = new CountingService(ConfigFactory.empty());
        service.start();
        service.pause();

        service.stop();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void failureInRunMovesToErrorState() {
        CountingService service = new CountingService(ConfigFactory.empty());
        service.failNext = true;
        service.start();

        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
                assertEquals(IService.State.ERROR, service.getCurrentState()));
        assertFalse(service.isHealthy());
    }

    @Test
    void stubbornServiceIsInterruptedAfterShutdownTimeout() {
        StubbornService service = new StubbornService(ConfigFactory.parseMap(Map.of("shutdownTimeout", 0)));
        service.start();

        service.stop();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void errorsAreBoundedOldestFirst() {
        CountingService service = new CountingService(ConfigFactory.empty());
        for (int i = 0; i < 5; i++) {
            service.error("E" + i);
        }

        assertEquals(3, service.getErrors().size());
        assertEquals("E2", service.getErrors().get(0).code());
        assertEquals(3, service.getMetrics().get("error_count").intValue());
    }
}
