package org.attrition.engine.services;

import com.typesafe.config.Config;
import org.attrition.engine.api.resources.IMonitorable;
import org.attrition.engine.api.resources.OperationalError;
import org.attrition.engine.api.services.IService;
import org.attrition.engine.api.services.ServiceStatus;
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
 * An abstract base class for all long-running engine services, providing common lifecycle
 * management, thread handling and error tracking. Subclasses must implement the
 * {@link #run()} method to define their specific logic.
 * <p>
 * Error Tracking: Services can use {@link #recordError(String, String, String)} to
 * track transient errors that don't require service termination.
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final Object pauseLock = new Object();
    private Thread serviceThread;

    /**
     * Operational errors that occurred during service execution. Bounded by {@link #getMaxErrors()}.
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected int getMaxErrors() {
        return 10000;
    }

    /**
     * Constructs an AbstractService with its configuration.
     *
     * @param name    The name of the service instance.
     * @param options The configuration for this service.
     */
    protected AbstractService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        serviceThread = new Thread(this::runService);
        serviceThread.setName(this.getClass().getSimpleName());
        serviceThread.start();
        logStarted();
    }

    /**
     * Template method for logging service startup. Services can override this to provide
     * detailed startup information.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state == State.RUNNING || state == State.PAUSED) {
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
                    log.error("{} thread did not stop within 5 seconds! Forcing ERROR state.", this.getClass().getSimpleName());
                    currentState.set(State.ERROR);
                    return;
                }
            }

            if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("{} stopped", this.getClass().getSimpleName());
        } else {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused", this.getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
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

    /**
     * Returns a snapshot of state, health, metrics and errors.
     *
     * @return the current {@link ServiceStatus}
     */
    public ServiceStatus getServiceStatus() {
        return new ServiceStatus(getCurrentState(), isHealthy(), getMetrics(), getErrors());
    }

    /**
     * Wraps the service's run() method with error handling and state management.
     * Transient errors are handled inside {@link #run()}; anything escaping it moves the
     * service to ERROR.
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}",
                this.getClass().getSimpleName(),
                e.getClass().getSimpleName());
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
     * The main logic of the service, executed in a dedicated thread. It should periodically
     * check for pause and interruption status.
     * <p>
     * <strong>Error Handling Guidelines for Services:</strong>
     * <ul>
     *   <li><strong>Transient errors</strong> (service continues): {@code log.warn(...)} with NO exception
     *       parameter, track with {@link #recordError(String, String, String)}, do not throw.
     *       Example: one queue item failed to complete during a tick.</li>
     *   <li><strong>Fatal errors</strong> (service must stop): {@code log.error(...)}, throw. AbstractService
     *       sets the ERROR state. Example: the store became unusable.</li>
     *   <li><strong>Normal shutdown</strong>: rethrow {@link InterruptedException}.</li>
     * </ul>
     * Exception stack traces are logged at DEBUG level only.
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks the current thread while the service is in the {@link State#PAUSED} state.
     *
     * @throws InterruptedException if the thread is interrupted while waiting.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED) {
                log.debug("Service is paused, waiting...");
                pauseLock.wait();
                log.debug("Woke up from pause.");
            }
        }
    }

    /**
     * Records an operational error for tracking and monitoring. Use ONLY for transient errors
     * where the service continues running. See {@link #run()} for the full guidelines.
     *
     * @param code    Error code for categorization (e.g. "TICK_ITEM_FAILED")
     * @param message Human-readable error message
     * @param details Additional context about the error
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
     * Returns whether the service is healthy: never in ERROR state and no recorded errors.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
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
     * Hook method for subclasses to add service-specific metrics.
     * Always call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
