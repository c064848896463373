package org.soulwars.runtime.disaster;

import org.soulwars.runtime.spi.IDisaster;
import org.soulwars.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Common options of all disaster plugins.
 * <ul>
 *   <li><b>enabled:</b> whether the disaster may be rolled (default true).</li>
 *   <li><b>triggerChance:</b> probability that one roll starts it.</li>
 *   <li><b>cooldownMs:</b> minimum time since the previous disaster of any kind.</li>
 *   <li><b>durationMs:</b> length of one occurrence.</li>
 *   <li><b>deathPercentage:</b> share of the living population at start that dies over one occurrence.</li>
 * </ul>
 */
public abstract class AbstractDisaster implements IDisaster {

    protected final IRandomProvider random;
    protected final double deathPercentage;
    private final boolean enabled;
    private final double triggerChance;
    private final long cooldownMillis;
    private final long durationMillis;

    protected int populationAtStart;
    protected int killed;

    protected AbstractDisaster(IRandomProvider random, Config options) {
        this.random = random;
        this.enabled = !options.hasPath("enabled") || options.getBoolean("enabled");
        this.triggerChance = options.getDouble("triggerChance");
        this.cooldownMillis = options.getLong("cooldownMs");
        this.durationMillis = options.getLong("durationMs");
        this.deathPercentage = options.getDouble("deathPercentage");
        if (triggerChance < 0 || triggerChance > 1) {
            throw new IllegalArgumentException(getClass().getSimpleName() + ": triggerChance must be within [0, 1]");
        }
        if (deathPercentage < 0 || deathPercentage > 1) {
            throw new IllegalArgumentException(getClass().getSimpleName() + ": deathPercentage must be within [0, 1]");
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public double triggerChance() {
        return triggerChance;
    }

    @Override
    public long cooldownMillis() {
        return cooldownMillis;
    }

    @Override
    public long durationMillis() {
        return durationMillis;
    }

    @Override
    public int victims() {
        return killed;
    }

    /**
     * Resets the per-occurrence counters.
     */
    protected void resetOccurrence(DisasterContext context) {
        populationAtStart = context.livingPopulation();
        killed = 0;
    }

    /**
     * Kills souls until {@code targetDeaths} souls have died in this occurrence.
     *
     * @return the number of souls killed by this call
     */
    protected int killUpTo(DisasterContext context, int targetDeaths) {
        int victims = context.killRandomSouls(targetDeaths - killed, random);
        killed += victims;
        return victims;
    }
}
