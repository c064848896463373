package org.soulwars.runtime.spi;

/**
 * Time source for all timestamp comparisons inside the simulation.
 * <p>
 * Every "wait" in the simulation (preparation delay, cast duration, cooldowns, mating duration,
 * death grace period) is a comparison against this clock. Nothing in the tick ever blocks.
 * </p>
 */
public interface IClock {

    /**
     * Returns the current time in milliseconds. Must never decrease between calls.
     *
     * @return the current time in milliseconds
     */
    long currentTimeMillis();
}
