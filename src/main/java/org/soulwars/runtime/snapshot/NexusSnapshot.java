package org.soulwars.runtime.snapshot;

import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.TilePosition;

public record NexusSnapshot(Faction faction, TilePosition tile, double x, double y, int size, double health,
                            double maxHealth, boolean destroyed) {

    public static NexusSnapshot of(Nexus nexus) {
        return new NexusSnapshot(nexus.faction(), nexus.tile(), nexus.position().x(), nexus.position().y(),
            nexus.size(), nexus.health(), nexus.maxHealth(), nexus.isDestroyed());
    }
}
