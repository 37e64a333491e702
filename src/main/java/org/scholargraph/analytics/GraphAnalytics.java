package org.scholargraph.analytics;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.scholargraph.analytics.community.CommunityDetectors;
import org.scholargraph.analytics.community.ICommunityDetector;
import org.scholargraph.api.model.Graph;
import org.scholargraph.api.model.NodeMetrics;
import org.scholargraph.utils.IRandomProvider;
import org.scholargraph.utils.SeededRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes per-node structural metrics and community partitions.
 * <p>
 * Configuration ({@code analytics} block):
 * <ul>
 *   <li>{@code exactBetweennessThreshold} (default 500): graphs with fewer nodes get exact betweenness</li>
 *   <li>{@code betweennessSampleSize} (default 100): source nodes sampled above the threshold</li>
 *   <li>{@code maxIterations} (default 100), {@code tolerance} (default 1e-6): power-iteration limits</li>
 *   <li>{@code damping} (default 0.85): PageRank damping factor</li>
 *   <li>{@code randomSeed} (default 42): seed of the betweenness source sample</li>
 *   <li>{@code communityDetector}: see {@link CommunityDetectors}</li>
 * </ul>
 */
public class GraphAnalytics {

    private static final Logger log = LoggerFactory.getLogger(GraphAnalytics.class);

    private final int exactBetweennessThreshold;
    private final int betweennessSampleSize;
    private final int maxIterations;
    private final double tolerance;
    private final double damping;
    private final IRandomProvider random;
    private final ICommunityDetector communityDetector;

    public GraphAnalytics(Config options) {
        this.exactBetweennessThreshold = options.hasPath("exactBetweennessThreshold")
            ? options.getInt("exactBetweennessThreshold") : 500;
        this.betweennessSampleSize = options.hasPath("betweennessSampleSize")
            ? options.getInt("betweennessSampleSize") : 100;
        this.maxIterations = options.hasPath("maxIterations") ? options.getInt("maxIterations") : 100;
        this.tolerance = options.hasPath("tolerance") ? options.getDouble("tolerance") : 1e-6;
        this.damping = options.hasPath("damping") ? options.getDouble("damping") : 0.85;
        this.random = new SeededRandomProvider(options.hasPath("randomSeed") ? options.getLong("randomSeed") : 42L);
        if (betweennessSampleSize < 1) {
            throw new IllegalArgumentException("betweennessSampleSize must be positive, got: " + betweennessSampleSize);
        }
        if (damping <= 0 || damping >= 1) {
            throw new IllegalArgumentException("damping must be in (0, 1), got: " + damping);
        }
        this.communityDetector = CommunityDetectors.create(options.hasPath("communityDetector")
            ? options.getConfig("communityDetector")
            : ConfigFactory.empty());
        if (communityDetector.isDegenerate()) {
            log.warn("Community detection is unavailable; every node will be reported as its own community");
        }
    }

    /**
     * @return The community strategy chosen at construction.
     */
    public ICommunityDetector communityDetector() {
        return communityDetector;
    }

    /**
     * @param nodeCount Number of nodes of a graph.
     * @return true if betweenness is computed from every source for a graph of that size.
     */
    public boolean usesExactBetweenness(int nodeCount) {
        return nodeCount < exactBetweennessThreshold;
    }

    /**
     * Computes degree, degree centrality, importance, betweenness and clustering for every node.
     * <p>
     * Importance is PageRank on directed graphs and eigenvector centrality on undirected
     * ones; if the power iteration does not converge all importance scores are 0.
     * Clustering is 0 on directed graphs.
     *
     * @param graph The graph.
     * @return Node id to metrics, in node order; empty for an empty graph.
     */
    public Map<String, NodeMetrics> computeNodeMetrics(Graph graph) {
        Map<String, NodeMetrics> metrics = new LinkedHashMap<>();
        int n = graph.nodeCount();
        if (n == 0) {
            return metrics;
        }
        long start = System.currentTimeMillis();
        IndexedGraph indexed = IndexedGraph.of(graph);

        double[] importance = graph.isDirected()
            ? PageRankCentrality.compute(indexed, damping, maxIterations, tolerance)
            : EigenvectorCentrality.compute(indexed, maxIterations, tolerance);
        if (importance == null) {
            log.warn("{} did not converge within {} iterations on {} nodes, reporting zero importance",
                graph.isDirected() ? "PageRank" : "Eigenvector centrality", maxIterations, n);
            importance = new double[n];
        }

        double[] betweenness;
        if (usesExactBetweenness(n)) {
            betweenness = BetweennessCentrality.exact(indexed);
        } else {
            betweenness = BetweennessCentrality.sampled(indexed, sampleSources(n));
        }

        double[] clustering = ClusteringCoefficient.compute(indexed);

        for (int i = 0; i < n; i++) {
            int degree = indexed.degree(i);
            double degreeCentrality = n == 1 ? 1.0 : degree / (double) (n - 1);
            metrics.put(indexed.id(i), new NodeMetrics(degree, degreeCentrality, importance[i], betweenness[i], clustering[i]));
        }
        log.info("Computed metrics for {} nodes ({} betweenness) in {} ms",
            n, usesExactBetweenness(n) ? "exact" : "sampled", System.currentTimeMillis() - start);
        return metrics;
    }

    /**
     * Partitions the undirected projection of the graph.
     *
     * @param graph The graph; directed graphs are projected first.
     * @return Node id to community id.
     */
    public Map<String, Integer> detectCommunities(Graph graph) {
        long start = System.currentTimeMillis();
        Map<String, Integer> partition = communityDetector.detect(graph.toUndirected());
        log.info("Detected {} communities over {} nodes with {} in {} ms",
            partition.values().stream().distinct().count(), graph.nodeCount(),
            communityDetector.name(), System.currentTimeMillis() - start);
        return partition;
    }

    /**
     * Draws min(sampleSize, n) distinct nodes. The stream is derived from the seed and the
     * node count, so the same graph always gets the same sample.
     */
    private int[] sampleSources(int n) {
        int k = Math.min(betweennessSampleSize, n);
        IRandomProvider sampler = random.deriveFor("betweenness", n);
        int[] pool = new int[n];
        for (int i = 0; i < n; i++) {
            pool[i] = i;
        }
        for (int i = 0; i < k; i++) {
            int j = i + sampler.nextInt(n - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sources = new int[k];
        System.arraycopy(pool, 0, sources, 0, k);
        return sources;
    }
}
