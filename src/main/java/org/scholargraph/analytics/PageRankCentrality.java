package org.scholargraph.analytics;

import java.util.Arrays;

/**
 * Weighted PageRank by power iteration with uniform teleport and uniform redistribution of
 * the rank held by nodes without outgoing edges.
 */
final class PageRankCentrality {

    private PageRankCentrality() {
    }

    /**
     * @return Scores summing to 1, or {@code null} if the L1 change did not fall below
     *         {@code n * tolerance} within {@code maxIterations}.
     */
    static double[] compute(IndexedGraph graph, double damping, int maxIterations, double tolerance) {
        int n = graph.size();
        if (n == 0) {
            return new double[0];
        }
        double[] outWeightSum = new double[n];
        for (int u = 0; u < n; u++) {
            for (double w : graph.outWeights(u)) {
                outWeightSum[u] += w;
            }
        }

        double uniform = 1.0 / n;
        double[] x = new double[n];
        Arrays.fill(x, uniform);

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double[] last = x;
            x = new double[n];
            double danglingSum = 0.0;
            for (int u = 0; u < n; u++) {
                if (outWeightSum[u] == 0.0) {
                    danglingSum += last[u];
                }
            }
            danglingSum *= damping;

            for (int u = 0; u < n; u++) {
                if (outWeightSum[u] == 0.0) {
                    continue;
                }
                int[] targets = graph.out(u);
                double[] weights = graph.outWeights(u);
                for (int i = 0; i < targets.length; i++) {
                    x[targets[i]] += damping * last[u] * weights[i] / outWeightSum[u];
                }
            }
            double error = 0.0;
            for (int u = 0; u < n; u++) {
                x[u] += danglingSum * uniform + (1.0 - damping) * uniform;
                error += Math.abs(x[u] - last[u]);
            }
            if (error < n * tolerance) {
                return x;
            }
        }
        return null;
    }
}
