package org.scholargraph.utils;

/**
 * Deterministic randomness for the sampled graph algorithms. Implementations must be a pure
 * function of their seed so that a metric run can be repeated exactly.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Creates an independent provider derived from this provider's seed and the given scope/key.
     *
     * @param scope a stable scope name, e.g. {@code "betweenness"} or {@code "louvain"}
     * @param key   a stable numeric key, e.g. the graph's node count
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
