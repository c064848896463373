package org.soulwars.runtime.spi;

import java.util.Map;

import org.soulwars.runtime.disaster.DisasterContext;

/**
 * A global hazard that can be rolled by the disaster event system.
 * <p>
 * Implementations must provide a constructor with signature:
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)}
 * </p>
 * <p>
 * An instance describes one disaster kind and may be started many times over the lifetime of a
 * world. Per-occurrence state must be reset in {@link #begin(DisasterContext)}.
 * </p>
 */
public interface IDisaster {

    /**
     * @return the wire name of this disaster kind (e.g. {@code "freezing_snow"})
     */
    String name();

    /**
     * @return whether this disaster may be rolled at all
     */
    boolean isEnabled();

    /**
     * @return probability in [0, 1] that a roll starts this disaster
     */
    double triggerChance();

    /**
     * @return minimum time in milliseconds since the previous disaster (of any kind) before this one may start
     */
    long cooldownMillis();

    /**
     * @return how long one occurrence lasts, in milliseconds
     */
    long durationMillis();

    /**
     * Starts a new occurrence. Called once, in the tick the roll succeeded.
     *
     * @param context access to the world for this tick
     * @return additional payload for the {@code disaster_start} event (may be empty, never null)
     */
    Map<String, Object> begin(DisasterContext context);

    /**
     * Applies the disaster's effect for the current tick. Called every tick while the occurrence is active,
     * including the tick it started in.
     *
     * @param context access to the world for this tick
     */
    void tick(DisasterContext context);

    /**
     * Ends the current occurrence. Called once, in the tick the duration elapsed.
     *
     * @param context access to the world for this tick
     */
    void end(DisasterContext context);

    /**
     * @return the number of souls killed by the current (or most recent) occurrence
     */
    int victims();
}
