package org.scholargraph.api.model;

/**
 * Structural metrics of one node.
 *
 * @param degree           Incident edge count; in + out for directed graphs.
 * @param degreeCentrality {@code degree / (n - 1)}.
 * @param importance       PageRank (directed) or eigenvector centrality (undirected).
 * @param betweenness      Normalized betweenness centrality, exact or sampled.
 * @param clustering       Local clustering coefficient; zero on directed graphs.
 */
public record NodeMetrics(int degree, double degreeCentrality, double importance, double betweenness, double clustering) {
}
