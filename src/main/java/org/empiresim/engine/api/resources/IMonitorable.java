package org.empiresim.engine.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Implemented by components that expose metrics, operational errors and a health flag.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the component's metrics.
     *
     * @return Metric names mapped to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the transient errors recorded so far, oldest first.
     *
     * @return A copy of the error collection.
     */
    List<OperationalError> getErrors();

    /**
     * Discards all recorded errors.
     */
    void clearErrors();

    /**
     * Returns whether the component is currently healthy.
     *
     * @return {@code true} if healthy.
     */
    boolean isHealthy();
}
