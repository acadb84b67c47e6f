package org.empiresim.engine.services;

import com.typesafe.config.Config;
import org.empiresim.engine.api.resources.IMonitorable;
import org.empiresim.engine.api.resources.OperationalError;
import org.empiresim.engine.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class of engine services that run a loop on a dedicated thread.
 * <p>
 * Subclasses implement {@link #run()} and call {@link #checkPause()} once per iteration.
 * <p>
 * <strong>Error Handling Guidelines for Services:</strong>
 * <ul>
 *   <li>Transient errors (one trigger rejected, one tick failed): {@code log.warn(...)} without the
 *       exception, {@link #recordError(String, String, String)}, keep running.</li>
 *   <li>Fatal errors: {@code log.error(...)} without the exception and throw. The service moves to
 *       {@link State#ERROR}.</li>
 *   <li>Shutdown: let {@link InterruptedException} propagate out of {@link #run()}.</li>
 *   <li>Stack traces are logged at DEBUG level only.</li>
 * </ul>
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final Object pauseLock = new Object();
    private Thread serviceThread;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors kept in memory; the oldest are dropped first.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    protected AbstractService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format(
                "Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        serviceThread = new Thread(this::runService);
        serviceThread.setName(this.getClass().getSimpleName());
        serviceThread.start();
        logStarted();
    }

    /**
     * Logs the startup. Services override this to log their configuration.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format(
                "Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }
        if (serviceThread != null) {
            serviceThread.interrupt();
            try {
                serviceThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service thread to stop", this.getClass().getSimpleName());
            }
            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within 5 seconds, forcing ERROR state", this.getClass().getSimpleName());
                currentState.set(State.ERROR);
                return;
            }
        }
        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.debug("{} stopped", this.getClass().getSimpleName());
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format(
                "Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused", this.getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format(
                "Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} resumed", this.getClass().getSimpleName());
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public void restart() {
        stop();
        if (getCurrentState() == State.ERROR) {
            throw new IllegalStateException("Cannot restart service '" + serviceName + "': thread did not stop");
        }
        start();
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
     * The service loop, executed on the service thread.
     *
     * @throws InterruptedException when the service is stopped.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks while the service is paused.
     *
     * @throws InterruptedException if the thread is interrupted while waiting.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED) {
                pauseLock.wait();
            }
        }
    }

    /**
     * Records a transient error. Only for errors the service survives.
     *
     * @param code    Error code for categorization (e.g. "TICK_REJECTED").
     * @param message Human-readable error message.
     * @param details Additional context.
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

    /**
     * Unhealthy in {@link State#ERROR} or while errors are recorded.
     */
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
     * Hook for service-specific metrics. Overrides must call {@code super.addCustomMetrics(metrics)} first.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
