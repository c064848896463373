package org.soulwars.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to one game world.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
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
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a random double in the range [min, max).
     *
     * @param min inclusive lower bound
     * @param max exclusive upper bound
     * @return the random double
     */
    default double nextDouble(double min, double max) {
        return min + nextDouble() * (max - min);
    }

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * Use this to create independent sub-streams (e.g., per soul or per disaster plugin).
     *
     * @param scope a stable, descriptive scope name (e.g., "soul", "disaster")
     * @param key a stable numeric key (e.g., soul id, plugin index)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
