package org.soulwars.runtime.internal.services;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.soulwars.runtime.spi.IRandomProvider;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Supports deterministic derivation of child providers using a stable hashing scheme, so that a soul's
 * random stream depends only on the world seed and the soul id, not on how many other souls drew before it.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;
    private final Random adaptor;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
        this.adaptor = new RandomAdaptor(rng);
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public Random asJavaRandom() {
        return adaptor;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        long h = mix64(seed);
        h = mix64(h ^ mix64(hashString(scope)));
        h = mix64(h ^ mix64(key));
        return new SeededRandomProvider(h);
    }

    /**
     * FNV-1a 64-bit hash.
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
