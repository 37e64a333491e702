package org.scholargraph.api.resources;

import java.util.List;
import java.util.Map;

/**
 * A component whose health, counters and recovered failures can be inspected.
 * <p>
 * Implemented by the columnar store and the artifact cache so that callers can tell
 * whether a request was served on a degraded path (for example, a cache write that
 * failed but did not abort the computation).
 */
public interface IMonitorable {

    /**
     * Returns the current counters of the component.
     * <p>
     * Keys are snake_case metric names such as {@code queries_executed} or {@code cache_hits}.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the recovered failures recorded since the last {@link #clearErrors()}.
     *
     * @return A copy of the recorded {@link OperationalError}s, oldest first.
     */
    List<OperationalError> getErrors();

    /**
     * Discards all recorded operational errors.
     */
    void clearErrors();

    /**
     * @return true if no operational error is currently recorded.
     */
    boolean isHealthy();
}
