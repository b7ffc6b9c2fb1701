package org.otelbuffer.datapipeline.services;

import com.typesafe.config.Config;
import org.otelbuffer.datapipeline.api.services.IMonitorable;
import org.otelbuffer.datapipeline.api.services.IService;
import org.otelbuffer.datapipeline.api.services.OperationalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for services running a loop on a dedicated thread. Subclasses implement
 * {@link #run()} and poll {@link #isStopRequested()}.
 * <p>
 * Stopping is two-phase: the stop flag is set and the thread gets {@code shutdownTimeout}
 * seconds to leave its loop; after that it is interrupted. An exception escaping {@link #run()}
 * moves the service to {@link State#ERROR}.
 * <p>
 * Transient failures that the service survives are kept through
 * {@link #recordError(String, String, String)} and make the service unhealthy.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Object pauseLock = new Object();
    private final int shutdownTimeoutSeconds;
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private Thread serviceThread;

    protected AbstractService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
        this.shutdownTimeoutSeconds = options.hasPath("shutdownTimeout")
                ? options.getInt("shutdownTimeout")
                : 5;
    }

    /**
     * Oldest errors are dropped beyond this many.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s",
                    serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        logStarted();
    }

    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s",
                    serviceName, state));
        }
        stopRequested.set(true);
        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }

        if (serviceThread != null) {
            try {
                long deadline = System.currentTimeMillis() + shutdownTimeoutSeconds * 1000L;
                while (serviceThread.isAlive() && System.currentTimeMillis() < deadline) {
                    serviceThread.join(50);
                }
                if (serviceThread.isAlive()) {
                    log.warn("{} did not stop within {}s, forcing interrupt",
                            this.getClass().getSimpleName(), shutdownTimeoutSeconds);
                    serviceThread.interrupt();
                    serviceThread.join(1000);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service shutdown", this.getClass().getSimpleName());
            }

            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} seconds! Forcing ERROR state.",
                        this.getClass().getSimpleName(), shutdownTimeoutSeconds);
                currentState.set(State.ERROR);
                return;
            }
        }

        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.info("{} stopped", this.getClass().getSimpleName());
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s",
                    serviceName, getCurrentState()));
        }
        log.info("{} paused", this.getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s",
                    serviceName, getCurrentState()));
        }
        log.info("{} resumed", this.getClass().getSimpleName());
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}", this.getClass().getSimpleName(), e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    /**
     * The service loop, executed on the service thread. Blocking calls inside it must use
     * timeouts so the loop sees {@link #isStopRequested()} in time.
     *
     * @throws InterruptedException if the thread is interrupted
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks while the service is paused.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED && !stopRequested.get()) {
                pauseLock.wait();
            }
        }
    }

    protected boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Records a transient error. Not for fatal errors; those are thrown from {@link #run()}.
     *
     * @param code    category
     * @param message summary
     * @param details context
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) {
            return false;
        }
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Adds service-specific metrics after the base ones. Overrides call super first.
     *
     * @param metrics mutable map already holding the base metrics
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
    }
}
