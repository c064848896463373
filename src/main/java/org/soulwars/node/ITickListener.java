package org.soulwars.node;

import org.soulwars.runtime.TickResult;

/**
 * Receives the result of every tick. Called on the game loop thread; implementations must return quickly
 * and must not touch the simulation.
 */
@FunctionalInterface
public interface ITickListener {

    void onTick(TickResult result);
}
