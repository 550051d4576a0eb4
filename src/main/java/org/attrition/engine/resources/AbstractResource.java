package org.attrition.engine.resources;

import com.typesafe.config.Config;
import org.attrition.engine.api.resources.IMonitorable;
import org.attrition.engine.api.resources.IResource;
import org.attrition.engine.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Abstract base class for all IResource implementations, providing common
 * functionality for name and configuration handling, and monitoring infrastructure.
 * <p>
 * This class implements {@link IMonitorable} to provide consistent error tracking
 * and metrics across all resources, following the same patterns as
 * {@link org.attrition.engine.services.AbstractService}.
 */
public abstract class AbstractResource implements IResource, IMonitorable {
    protected final String resourceName;
    protected final Config options;

    /**
     * Operational errors that occurred during resource operations.
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    /**
     * Constructor for AbstractResource.
     *
     * @param name    The unique name of the resource instance from the configuration.
     * @param options The configuration object for this resource instance.
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    /**
     * Records an operational error for tracking and monitoring.
     * <p>
     * <strong>Error Handling Guidelines for Resources:</strong>
     * <ul>
     *   <li><strong>Transient errors</strong>: {@code log.warn(...)} without the exception parameter,
     *       record the error here, and rethrow if the caller needs to react (e.g. a failed statement).</li>
     *   <li><strong>Fatal errors</strong>: {@code log.error(...)} and throw. Do not record, the resource is broken anyway
     *       (e.g. the connection pool cannot be created, schema creation failed).</li>
     *   <li><strong>Expected conflicts</strong>: unique-constraint races are part of the contract and are
     *       counted as metrics, not recorded as errors.</li>
     * </ul>
     * Stack traces belong at DEBUG level only.
     *
     * @param code    Error code for categorization (e.g. "QUERY_FAILED")
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
     * Returns whether the resource is healthy. Any recorded error makes it unhealthy
     * until an operator clears the errors.
     *
     * @return {@code true} if resource has no errors, {@code false} otherwise
     */
    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    /**
     * Returns the base metrics ({@code error_count}) followed by those added in
     * {@link #addCustomMetrics(Map)}.
     *
     * @return Map of metric names to their current values
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add resource-specific metrics.
     * Always call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
