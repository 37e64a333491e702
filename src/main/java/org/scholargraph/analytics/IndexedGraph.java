package org.scholargraph.analytics;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.scholargraph.api.model.Edge;
import org.scholargraph.api.model.Graph;

import java.util.List;

/**
 * Array-based adjacency view of a {@link Graph}, with nodes numbered 0..n-1 in the graph's
 * node order. For undirected graphs the in- and out-lists are the same neighbor list.
 */
final class IndexedGraph {

    private final String[] ids;
    private final boolean directed;
    private final int[][] out;
    private final double[][] outWeights;
    private final int[][] in;

    private IndexedGraph(String[] ids, boolean directed, int[][] out, double[][] outWeights, int[][] in) {
        this.ids = ids;
        this.directed = directed;
        this.out = out;
        this.outWeights = outWeights;
        this.in = in;
    }

    static IndexedGraph of(Graph graph) {
        int n = graph.nodeCount();
        String[] ids = graph.nodeIds().toArray(new String[0]);
        Object2IntOpenHashMap<String> index = new Object2IntOpenHashMap<>(n);
        for (int i = 0; i < n; i++) {
            index.put(ids[i], i);
        }

        IntArrayList[] outLists = new IntArrayList[n];
        DoubleArrayList[] weightLists = new DoubleArrayList[n];
        IntArrayList[] inLists = graph.isDirected() ? new IntArrayList[n] : null;
        for (int i = 0; i < n; i++) {
            outLists[i] = new IntArrayList();
            weightLists[i] = new DoubleArrayList();
            if (inLists != null) {
                inLists[i] = new IntArrayList();
            }
        }

        List<Edge> edges = graph.edges();
        for (Edge edge : edges) {
            int u = index.getInt(edge.source());
            int v = index.getInt(edge.target());
            outLists[u].add(v);
            weightLists[u].add(edge.weight());
            if (inLists != null) {
                inLists[v].add(u);
            } else {
                outLists[v].add(u);
                weightLists[v].add(edge.weight());
            }
        }

        int[][] out = new int[n][];
        double[][] outWeights = new double[n][];
        int[][] in = new int[n][];
        for (int i = 0; i < n; i++) {
            out[i] = outLists[i].toIntArray();
            outWeights[i] = weightLists[i].toDoubleArray();
            in[i] = inLists != null ? inLists[i].toIntArray() : out[i];
        }
        return new IndexedGraph(ids, graph.isDirected(), out, outWeights, in);
    }

    int size() {
        return ids.length;
    }

    String id(int node) {
        return ids[node];
    }

    boolean isDirected() {
        return directed;
    }

    /** Successors (directed) or neighbors (undirected). */
    int[] out(int node) {
        return out[node];
    }

    double[] outWeights(int node) {
        return outWeights[node];
    }

    /** Predecessors (directed) or neighbors (undirected). */
    int[] in(int node) {
        return in[node];
    }

    /**
     * @return Number of incident edges; in + out on directed graphs.
     */
    int degree(int node) {
        return directed ? out[node].length + in[node].length : out[node].length;
    }
}
