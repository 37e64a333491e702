package org.scholargraph;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.scholargraph.analytics.GraphAnalytics;
import org.scholargraph.filter.CorpusFilterPipeline;
import org.scholargraph.graph.GraphBuilder;
import org.scholargraph.query.CorpusQueryService;
import org.scholargraph.resources.AbstractResource;
import org.scholargraph.resources.cache.ParquetArtifactCache;
import org.scholargraph.resources.store.DuckDbColumnarStore;
import org.scholargraph.sample.SampleDatasetExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires every component from the {@code scholargraph} configuration block and owns the two
 * DuckDB instances: the full corpus store and the sample store read by the query layer.
 */
public final class ScholarGraphEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScholarGraphEngine.class);
    private static final String ROOT = "scholargraph";

    private final DuckDbColumnarStore store;
    private final DuckDbColumnarStore queryStore;
    private final ParquetArtifactCache cache;
    private final CorpusFilterPipeline pipeline;
    private final GraphBuilder graphBuilder;
    private final GraphAnalytics analytics;
    private final CorpusQueryService queryService;
    private final SampleDatasetExporter sampleExporter;
    private final int defaultLookbackYears;

    private ScholarGraphEngine(Config root, Clock clock) {
        Config filterOptions = section(root, "filter");
        this.defaultLookbackYears = filterOptions.hasPath("defaultLookbackYears")
            ? filterOptions.getInt("defaultLookbackYears") : 5;
        if (defaultLookbackYears < 0) {
            throw new IllegalArgumentException("defaultLookbackYears must not be negative, got: " + defaultLookbackYears);
        }

        this.store = new DuckDbColumnarStore("corpus-store", section(root, "store"));
        DuckDbColumnarStore sampleStore = null;
        try {
            sampleStore = new DuckDbColumnarStore("sample-store", section(root, "query.store"));
            this.cache = new ParquetArtifactCache("artifact-cache", section(root, "cache"), store);
            this.pipeline = new CorpusFilterPipeline(store, cache, filterOptions, clock);
            this.graphBuilder = new GraphBuilder(store, cache, pipeline.criteria(), section(root, "graph"));
            this.analytics = new GraphAnalytics(section(root, "analytics"));
            this.queryService = new CorpusQueryService(sampleStore, clock);
            this.sampleExporter = new SampleDatasetExporter(store, pipeline);
        } catch (RuntimeException e) {
            store.close();
            if (sampleStore != null) {
                sampleStore.close();
            }
            throw e;
        }
        this.queryStore = sampleStore;
        log.info("ScholarGraph engine ready: {} (signature {})", pipeline.criteria().describe(), pipeline.signature());
    }

    /**
     * @param config Full application configuration containing a {@code scholargraph} block.
     * @return A new engine; the caller must close it.
     * @throws IllegalArgumentException if a required key is missing or invalid.
     */
    public static ScholarGraphEngine create(Config config) {
        return create(config, Clock.systemDefaultZone());
    }

    /**
     * As {@link #create(Config)}, with the clock that determines the current year.
     */
    public static ScholarGraphEngine create(Config config, Clock clock) {
        Config root = config.hasPath(ROOT) ? config.getConfig(ROOT) : ConfigFactory.empty();
        return new ScholarGraphEngine(root, clock);
    }

    private static Config section(Config root, String path) {
        return root.hasPath(path) ? root.getConfig(path) : ConfigFactory.empty();
    }

    public CorpusFilterPipeline pipeline() {
        return pipeline;
    }

    public GraphBuilder graphBuilder() {
        return graphBuilder;
    }

    public GraphAnalytics analytics() {
        return analytics;
    }

    public CorpusQueryService queryService() {
        return queryService;
    }

    public SampleDatasetExporter sampleExporter() {
        return sampleExporter;
    }

    /**
     * @return The directory the query layer reads its sample files from.
     */
    public Path sampleDirectory() {
        return queryStore.getDataDirectory();
    }

    public int defaultLookbackYears() {
        return defaultLookbackYears;
    }

    /**
     * @return Metrics of the monitored resources, keyed by resource name.
     */
    public Map<String, Map<String, Number>> metrics() {
        Map<String, Map<String, Number>> metrics = new LinkedHashMap<>();
        for (AbstractResource resource : List.of(store, queryStore, cache)) {
            metrics.put(resource.getResourceName(), resource.getMetrics());
        }
        return metrics;
    }

    @Override
    public void close() {
        store.close();
        queryStore.close();
        log.debug("ScholarGraph engine closed");
    }
}
