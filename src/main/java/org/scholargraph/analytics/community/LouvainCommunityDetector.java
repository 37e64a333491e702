package org.scholargraph.analytics.community;

import com.typesafe.config.Config;
import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.scholargraph.api.model.Edge;
import org.scholargraph.api.model.Graph;
import org.scholargraph.utils.IRandomProvider;
import org.scholargraph.utils.SeededRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted Louvain modularity maximization.
 * <p>
 * Each level moves single nodes to the neighboring community with the largest modularity
 * gain (visiting nodes and candidate communities in seeded random order) until a full pass
 * gains less than {@value #MIN_GAIN}, then collapses every community into one node. Levels
 * repeat until collapsing no longer improves modularity; the partition of the last level is
 * returned. A graph without edges yields one community per node.
 * <p>
 * Options: {@code resolution} (default 1.0), {@code seed} (default 42).
 */
public class LouvainCommunityDetector implements ICommunityDetector {

    private static final Logger log = LoggerFactory.getLogger(LouvainCommunityDetector.class);
    private static final double MIN_GAIN = 1e-7;

    private final double resolution;
    private final long seed;

    public LouvainCommunityDetector(Config options) {
        this.resolution = options.hasPath("resolution") ? options.getDouble("resolution") : 1.0;
        this.seed = options.hasPath("seed") ? options.getLong("seed") : 42L;
        if (resolution <= 0) {
            throw new IllegalArgumentException("resolution must be positive, got: " + resolution);
        }
    }

    @Override
    public Map<String, Integer> detect(Graph graph) {
        Graph undirected = graph.toUndirected();
        String[] ids = undirected.nodeIds().toArray(new String[0]);
        Map<String, Integer> result = new LinkedHashMap<>();
        if (undirected.edgeCount() == 0) {
            for (int i = 0; i < ids.length; i++) {
                result.put(ids[i], i);
            }
            return result;
        }

        IRandomProvider random = new SeededRandomProvider(seed);
        LevelGraph current = LevelGraph.of(undirected, ids);
        List<int[]> dendrogram = new ArrayList<>();

        Status status = new Status(current);
        oneLevel(current, status, random);
        double modularity = status.modularity(resolution);
        int[] partition = renumber(status.nodeToCommunity);
        dendrogram.add(partition);
        current = current.induce(partition);

        while (true) {
            status = new Status(current);
            oneLevel(current, status, random);
            double newModularity = status.modularity(resolution);
            if (newModularity - modularity < MIN_GAIN) {
                break;
            }
            partition = renumber(status.nodeToCommunity);
            dendrogram.add(partition);
            modularity = newModularity;
            current = current.induce(partition);
        }

        for (int node = 0; node < ids.length; node++) {
            int community = node;
            for (int[] level : dendrogram) {
                community = level[community];
            }
            result.put(ids[node], community);
        }
        log.debug("Louvain found {} communities over {} nodes in {} levels (modularity {})",
            current.size(), ids.length, dendrogram.size(), modularity);
        return result;
    }

    @Override
    public boolean isDegenerate() {
        return false;
    }

    @Override
    public String name() {
        return "louvain";
    }

    private void oneLevel(LevelGraph graph, Status status, IRandomProvider random) {
        boolean modified = true;
        double newModularity = status.modularity(resolution);
        while (modified) {
            double currentModularity = newModularity;
            modified = false;
            for (int node : shuffledRange(graph.size(), random)) {
                int home = status.nodeToCommunity[node];
                double degreeShare = status.nodeDegrees[node] / (status.totalWeight * 2.0);
                Int2DoubleOpenHashMap neighborWeights = neighborCommunities(node, graph, status);
                double removeCost = -neighborWeights.get(home)
                    + resolution * (status.communityDegrees[home] - status.nodeDegrees[node]) * degreeShare;
                status.remove(node, home, neighborWeights.get(home));

                int best = home;
                double bestIncrease = 0.0;
                int[] candidates = neighborWeights.keySet().toIntArray();
                shuffle(candidates, random);
                for (int community : candidates) {
                    double increase = removeCost + neighborWeights.get(community)
                        - resolution * status.communityDegrees[community] * degreeShare;
                    if (increase > bestIncrease) {
                        bestIncrease = increase;
                        best = community;
                    }
                }
                status.insert(node, best, neighborWeights.get(best));
                if (best != home) {
                    modified = true;
                }
            }
            newModularity = status.modularity(resolution);
            if (newModularity - currentModularity < MIN_GAIN) {
                break;
            }
        }
    }

    private static Int2DoubleOpenHashMap neighborCommunities(int node, LevelGraph graph, Status status) {
        Int2DoubleOpenHashMap weights = new Int2DoubleOpenHashMap();
        for (Int2DoubleMap.Entry entry : graph.adjacency[node].int2DoubleEntrySet()) {
            weights.addTo(status.nodeToCommunity[entry.getIntKey()], entry.getDoubleValue());
        }
        return weights;
    }

    /**
     * Relabels communities 0..k-1 in order of first appearance.
     */
    private static int[] renumber(int[] nodeToCommunity) {
        Int2IntOpenHashMap labels = new Int2IntOpenHashMap();
        labels.defaultReturnValue(-1);
        int[] renumbered = new int[nodeToCommunity.length];
        for (int node = 0; node < nodeToCommunity.length; node++) {
            int label = labels.get(nodeToCommunity[node]);
            if (label < 0) {
                label = labels.size();
                labels.put(nodeToCommunity[node], label);
            }
            renumbered[node] = label;
        }
        return renumbered;
    }

    private static int[] shuffledRange(int n, IRandomProvider random) {
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        shuffle(order, random);
        return order;
    }

    private static void shuffle(int[] values, IRandomProvider random) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }

    /**
     * Weighted undirected graph of one dendrogram level. Self-loops hold the internal weight
     * of collapsed communities and are kept apart from the adjacency maps.
     */
    private static final class LevelGraph {
        final Int2DoubleOpenHashMap[] adjacency;
        final double[] loops;

        LevelGraph(int n) {
            adjacency = new Int2DoubleOpenHashMap[n];
            for (int i = 0; i < n; i++) {
                adjacency[i] = new Int2DoubleOpenHashMap();
            }
            loops = new double[n];
        }

        static LevelGraph of(Graph graph, String[] ids) {
            Object2IntOpenHashMap<String> index = new Object2IntOpenHashMap<>(ids.length);
            for (int i = 0; i < ids.length; i++) {
                index.put(ids[i], i);
            }
            LevelGraph level = new LevelGraph(ids.length);
            for (Edge edge : graph.edges()) {
                int u = index.getInt(edge.source());
                int v = index.getInt(edge.target());
                level.adjacency[u].addTo(v, edge.weight());
                level.adjacency[v].addTo(u, edge.weight());
            }
            return level;
        }

        int size() {
            return loops.length;
        }

        LevelGraph induce(int[] partition) {
            int communities = 0;
            for (int community : partition) {
                communities = Math.max(communities, community + 1);
            }
            LevelGraph induced = new LevelGraph(communities);
            for (int u = 0; u < size(); u++) {
                int cu = partition[u];
                induced.loops[cu] += loops[u];
                for (Int2DoubleMap.Entry entry : adjacency[u].int2DoubleEntrySet()) {
                    int v = entry.getIntKey();
                    if (v < u) {
                        continue;
                    }
                    int cv = partition[v];
                    double weight = entry.getDoubleValue();
                    if (cu == cv) {
                        induced.loops[cu] += weight;
                    } else {
                        induced.adjacency[cu].addTo(cv, weight);
                        induced.adjacency[cv].addTo(cu, weight);
                    }
                }
            }
            return induced;
        }
    }

    /**
     * Community bookkeeping for one level. Community ids start equal to node ids.
     */
    private static final class Status {
        final int[] nodeToCommunity;
        final double[] nodeDegrees;
        final double[] communityDegrees;
        final double[] internals;
        final double[] loops;
        final double totalWeight;

        Status(LevelGraph graph) {
            int n = graph.size();
            nodeToCommunity = new int[n];
            nodeDegrees = new double[n];
            communityDegrees = new double[n];
            internals = new double[n];
            loops = graph.loops.clone();
            double total = 0.0;
            for (int node = 0; node < n; node++) {
                double adjacent = 0.0;
                for (double weight : graph.adjacency[node].values()) {
                    adjacent += weight;
                }
                nodeToCommunity[node] = node;
                nodeDegrees[node] = adjacent + 2.0 * loops[node];
                communityDegrees[node] = nodeDegrees[node];
                internals[node] = loops[node];
                total += adjacent / 2.0 + loops[node];
            }
            totalWeight = total;
        }

        void remove(int node, int community, double weightToCommunity) {
            communityDegrees[community] -= nodeDegrees[node];
            internals[community] -= weightToCommunity + loops[node];
            nodeToCommunity[node] = -1;
        }

        void insert(int node, int community, double weightToCommunity) {
            nodeToCommunity[node] = community;
            communityDegrees[community] += nodeDegrees[node];
            internals[community] += weightToCommunity + loops[node];
        }

        double modularity(double resolution) {
            if (totalWeight <= 0) {
                return 0.0;
            }
            boolean[] seen = new boolean[nodeToCommunity.length];
            double result = 0.0;
            for (int community : nodeToCommunity) {
                if (community < 0 || seen[community]) {
                    continue;
                }
                seen[community] = true;
                double share = communityDegrees[community] / (2.0 * totalWeight);
                result += internals[community] * resolution / totalWeight - share * share;
            }
            return result;
        }
    }
}
