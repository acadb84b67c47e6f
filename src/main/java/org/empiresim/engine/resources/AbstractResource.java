package org.empiresim.engine.resources;

import com.typesafe.config.Config;
import org.empiresim.engine.api.resources.IMonitorable;
import org.empiresim.engine.api.resources.IResource;
import org.empiresim.engine.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Abstract base class for all engine resources, providing name and configuration handling
 * together with the monitoring infrastructure shared with {@link org.empiresim.engine.services.AbstractService}.
 * <p>
 * <strong>Error Handling Guidelines for Resources:</strong>
 * <ul>
 *   <li>Transient errors: {@code log.warn(...)} without the exception, {@link #recordError} to track,
 *       rethrow if the caller must react (e.g. a failed SQL statement).</li>
 *   <li>Fatal errors: {@code log.error(...)} without the exception and throw. Do not record.</li>
 *   <li>Stack traces are logged at DEBUG level only.</li>
 * </ul>
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    protected final String resourceName;
    protected final Config options;

    /**
     * Transient errors, bounded by {@link #getMaxErrors()}. Private to enforce use of
     * {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors kept in memory; the oldest are dropped first.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * @param name    The unique name of the resource instance.
     * @param options The configuration block of this resource.
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    public Config getOptions() {
        return options;
    }

    @Override
    public ResourceState getState() {
        return isHealthy() ? ResourceState.ACTIVE : ResourceState.FAILED;
    }

    /**
     * Records a transient error. Use only when the resource keeps functioning.
     *
     * @param code    Error code for categorization (e.g. "WRITE_FAILED").
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
     * A resource is healthy as long as no error has been recorded since the last {@link #clearErrors()}.
     */
    @Override
    public boolean isHealthy() {
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
     * Hook for resource-specific metrics. Overrides must call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map that already contains the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
