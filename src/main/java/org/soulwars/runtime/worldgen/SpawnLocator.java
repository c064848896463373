package org.soulwars.runtime.worldgen;

import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.Vec2;
import org.soulwars.runtime.spi.IRandomProvider;
import org.soulwars.runtime.systems.TerritoryGuard;

/**
 * Finds spawn points around a nexus. Candidates are scattered within {@code spawnRadius} of the nexus centre
 * and accepted only if the faction may stand there; after {@link #MAX_ATTEMPTS} misses the nexus centre is used.
 */
public final class SpawnLocator {

    static final int MAX_ATTEMPTS = 50;

    private final TerritoryGuard guard;
    private final double spawnRadius;

    public SpawnLocator(TerritoryGuard guard, double spawnRadius) {
        this.guard = guard;
        this.spawnRadius = spawnRadius;
    }

    public Vec2 near(Nexus nexus, IRandomProvider random) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            Vec2 candidate = nexus.spawnPosition(random, spawnRadius * 2);
            if (candidate.distanceTo(nexus.position()) <= spawnRadius
                && guard.isValidPosition(candidate, nexus.faction())) {
                return candidate;
            }
        }
        return nexus.position();
    }
}
