package org.scholargraph.api.model;

/**
 * A weighted edge. For undirected graphs {@code source} is the smaller id.
 *
 * @param source Source node id (citing paper, or first author of the pair).
 * @param target Target node id.
 * @param weight Multiplicity of the relation, at least 1.
 */
public record Edge(String source, String target, long weight) {
}
