package org.scholargraph.analytics;

import java.util.Arrays;

/**
 * Unweighted eigenvector centrality by power iteration on {@code A + I}, normalized to unit
 * Euclidean length. The identity shift keeps bipartite graphs from oscillating.
 */
final class EigenvectorCentrality {

    private EigenvectorCentrality() {
    }

    /**
     * @return Scores with unit L2 norm, or {@code null} if the L1 change did not fall below
     *         {@code n * tolerance} within {@code maxIterations}.
     */
    static double[] compute(IndexedGraph graph, int maxIterations, double tolerance) {
        int n = graph.size();
        if (n == 0) {
            return new double[0];
        }
        double[] x = new double[n];
        Arrays.fill(x, 1.0 / n);

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double[] last = x;
            x = last.clone();
            for (int u = 0; u < n; u++) {
                for (int v : graph.out(u)) {
                    x[v] += last[u];
                }
            }
            double norm = 0.0;
            for (double value : x) {
                norm += value * value;
            }
            norm = norm == 0.0 ? 1.0 : Math.sqrt(norm);
            double error = 0.0;
            for (int u = 0; u < n; u++) {
                x[u] /= norm;
                error += Math.abs(x[u] - last[u]);
            }
            if (error < n * tolerance) {
                return x;
            }
        }
        return null;
    }
}
