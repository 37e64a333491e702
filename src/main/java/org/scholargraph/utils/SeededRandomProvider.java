package org.scholargraph.utils;

import org.apache.commons.math3.random.Well19937c;

import java.nio.charset.StandardCharsets;

/**
 * {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Derived providers hash the parent seed with the scope and key, so two algorithms drawing
 * from the same root seed do not share a stream.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    /**
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    /**
     * FNV-1a 64-bit.
     */
    private static long hashString(String s) {
        if (s == null) return 0L;
        long h = 1469598103934665603L;
        for (byte value : s.getBytes(StandardCharsets.UTF_8)) {
            h ^= (value & 0xFF);
            h *= 1099511628211L;
        }
        return h;
    }

    /**
     * SplitMix64 finalizer.
     */
    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
