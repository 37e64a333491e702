package org.scholargraph.analytics.community;

import org.scholargraph.api.model.Graph;

import java.util.Map;

/**
 * Partitions the nodes of an undirected graph into communities.
 * <p>
 * Implementations are selected once at construction time; callers check
 * {@link #isDegenerate()} to tell a real partition from the singleton fallback.
 */
public interface ICommunityDetector {

    /**
     * @param graph An undirected graph.
     * @return Node id to community id, for every node. Community ids are 0..k-1.
     */
    Map<String, Integer> detect(Graph graph);

    /**
     * @return true if this detector puts every node in its own community, meaning that
     *         community structure is unavailable rather than absent.
     */
    boolean isDegenerate();

    /**
     * @return A short name for logs, e.g. {@code "louvain"}.
     */
    String name();
}
