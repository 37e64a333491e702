package org.scholargraph.analytics;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;

/**
 * Brandes' algorithm for unweighted shortest paths, optionally restricted to a subset of
 * source nodes.
 * <p>
 * Scores are normalized by {@code 1 / ((n - 1)(n - 2))} (no normalization for n &lt;= 2).
 * With {@code k} sampled sources they are additionally scaled by {@code n / k}, which makes
 * the sampled score an unbiased estimate of the exact one.
 */
final class BetweennessCentrality {

    private BetweennessCentrality() {
    }

    static double[] exact(IndexedGraph graph) {
        int n = graph.size();
        int[] sources = new int[n];
        for (int i = 0; i < n; i++) {
            sources[i] = i;
        }
        double[] scores = accumulate(graph, sources);
        rescale(scores, n, n);
        return scores;
    }

    /**
     * @param sources Distinct source nodes to run the shortest-path searches from.
     */
    static double[] sampled(IndexedGraph graph, int[] sources) {
        double[] scores = accumulate(graph, sources);
        rescale(scores, graph.size(), sources.length);
        return scores;
    }

    private static double[] accumulate(IndexedGraph graph, int[] sources) {
        int n = graph.size();
        double[] betweenness = new double[n];
        int[] stack = new int[n];
        int[] queue = new int[n];
        int[] distance = new int[n];
        double[] sigma = new double[n];
        double[] delta = new double[n];
        IntArrayList[] predecessors = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            predecessors[i] = new IntArrayList();
        }

        for (int s : sources) {
            Arrays.fill(distance, -1);
            Arrays.fill(sigma, 0.0);
            Arrays.fill(delta, 0.0);
            for (IntArrayList list : predecessors) {
                list.clear();
            }

            int stackSize = 0;
            int head = 0;
            int tail = 0;
            distance[s] = 0;
            sigma[s] = 1.0;
            queue[tail++] = s;
            while (head < tail) {
                int v = queue[head++];
                stack[stackSize++] = v;
                for (int w : graph.out(v)) {
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue[tail++] = w;
                    }
                    if (distance[w] == distance[v] + 1) {
                        sigma[w] += sigma[v];
                        predecessors[w].add(v);
                    }
                }
            }

            while (stackSize > 0) {
                int w = stack[--stackSize];
                double coefficient = (1.0 + delta[w]) / sigma[w];
                IntArrayList preds = predecessors[w];
                for (int i = 0; i < preds.size(); i++) {
                    int v = preds.getInt(i);
                    delta[v] += sigma[v] * coefficient;
                }
                if (w != s) {
                    betweenness[w] += delta[w];
                }
            }
        }
        return betweenness;
    }

    private static void rescale(double[] scores, int n, int sampleSize) {
        if (n <= 2) {
            return;
        }
        double scale = 1.0 / ((double) (n - 1) * (n - 2));
        if (sampleSize < n) {
            scale *= (double) n / sampleSize;
        }
        for (int i = 0; i < scores.length; i++) {
            scores[i] *= scale;
        }
    }
}
