package org.soulwars.runtime.snapshot;

import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulId;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TilePosition;

/**
 * Immutable view of a soul at the end of a tick.
 *
 * @param sleepProgress fraction of the current sleep already done, 0 when awake
 */
public record SoulSnapshot(
    SoulId id,
    Faction faction,
    double x,
    double y,
    double vx,
    double vy,
    double energy,
    double maxEnergy,
    SoulState state,
    boolean adult,
    boolean casting,
    boolean preparing,
    boolean retreating,
    boolean dead,
    double sleepProgress,
    SoulId matingPartner,
    SoulId trackedEnemy,
    TilePosition castTarget) {

    public static SoulSnapshot of(Soul soul, long now, long sleepDurationMs) {
        return new SoulSnapshot(
            soul.id(),
            soul.faction(),
            soul.x(),
            soul.y(),
            soul.vx(),
            soul.vy(),
            soul.energy(),
            soul.maxEnergy(),
            soul.state(),
            soul.isAdult(),
            soul.isCasting(),
            soul.isPreparing(),
            soul.isRetreating(now),
            soul.isDead(),
            soul.sleepProgress(now, sleepDurationMs),
            soul.matingPartner(),
            soul.trackedEnemy(),
            soul.castTarget());
    }
}
