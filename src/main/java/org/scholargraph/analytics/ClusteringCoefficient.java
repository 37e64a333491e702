package org.scholargraph.analytics;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Unweighted local clustering coefficient: the fraction of pairs of a node's neighbors that
 * are themselves adjacent.
 */
final class ClusteringCoefficient {

    private ClusteringCoefficient() {
    }

    static double[] compute(IndexedGraph graph) {
        int n = graph.size();
        double[] clustering = new double[n];
        if (graph.isDirected()) {
            return clustering;
        }
        IntOpenHashSet[] neighborSets = new IntOpenHashSet[n];
        for (int u = 0; u < n; u++) {
            neighborSets[u] = new IntOpenHashSet(graph.out(u));
        }
        for (int u = 0; u < n; u++) {
            int[] neighbors = graph.out(u);
            int k = neighbors.length;
            if (k < 2) {
                continue;
            }
            long links = 0;
            for (int i = 0; i < k; i++) {
                IntOpenHashSet adjacent = neighborSets[neighbors[i]];
                for (int j = i + 1; j < k; j++) {
                    if (adjacent.contains(neighbors[j])) {
                        links++;
                    }
                }
            }
            clustering[u] = 2.0 * links / ((double) k * (k - 1));
        }
        return clustering;
    }
}
