package org.soulwars.runtime.snapshot;

import org.soulwars.runtime.model.EnergyOrb;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.OrbId;

public record OrbSnapshot(OrbId id, Faction faction, double x, double y, double energyValue, boolean available,
                          long respawnAt) {

    public static OrbSnapshot of(EnergyOrb orb) {
        return new OrbSnapshot(orb.id(), orb.faction(), orb.position().x(), orb.position().y(), orb.energyValue(),
            orb.isAvailable(), orb.respawnAt());
    }
}
