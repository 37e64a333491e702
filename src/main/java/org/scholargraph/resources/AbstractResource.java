package org.scholargraph.resources;

import com.typesafe.config.Config;
import org.scholargraph.api.resources.IMonitorable;
import org.scholargraph.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Base class for configurable resources (the columnar store, the artifact cache), providing
 * name and option handling plus the error-tracking half of {@link IMonitorable}.
 * <p>
 * <strong>Error handling guidelines for resources:</strong>
 * <ul>
 *   <li>Recovered failures (the resource keeps working, e.g. a cache file could not be written):
 *       {@code log.warn(...)} without the exception, then {@link #recordError(String, String, String)}.</li>
 *   <li>Fatal failures (the caller's operation cannot complete): throw; do not record.</li>
 *   <li>Stack traces go to DEBUG only.</li>
 * </ul>
 */
public abstract class AbstractResource implements IMonitorable {

    protected final String resourceName;
    protected final Config options;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    public String getResourceName() {
        return resourceName;
    }

    /**
     * Upper bound of retained errors; the oldest are dropped beyond it.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * Records a recovered failure. Use only when the resource continues to function.
     *
     * @param code    Error category, e.g. {@code "CACHE_WRITE_FAILED"}.
     * @param message Human-readable description.
     * @param details Context such as a file path.
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
     * Hook for resource-specific counters. Overrides must call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map already containing {@code error_count}.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
