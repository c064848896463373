package org.soulwars.runtime.event;

import java.util.Map;

import org.soulwars.runtime.model.BuffId;
import org.soulwars.runtime.model.BuffSource;
import org.soulwars.runtime.model.DayPhase;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.OrbId;
import org.soulwars.runtime.model.SoulId;
import org.soulwars.runtime.model.SpellId;
import org.soulwars.runtime.model.TilePosition;
import org.soulwars.runtime.model.Vec2;
import org.soulwars.runtime.snapshot.SoulSnapshot;

/**
 * A domain event produced during one tick. Each kind is a record with a fixed payload; the record
 * components form the payload sent to observers next to the {@link #type()} discriminator.
 */
public interface GameEvent {

    GameEventType type();

    record SoulSpawned(SoulSnapshot soul) implements GameEvent {
        public GameEventType type() { return GameEventType.SOUL_SPAWN; }
    }

    record SoulUpdated(SoulSnapshot soul) implements GameEvent {
        public GameEventType type() { return GameEventType.SOUL_UPDATE; }
    }

    /**
     * @param cause short reason tag: {@code exhausted}, {@code combat}, {@code spell} or {@code disaster}
     */
    record SoulDied(SoulId soulId, Faction faction, double x, double y, String cause) implements GameEvent {
        public GameEventType type() { return GameEventType.SOUL_DEATH; }
    }

    record SoulRemoved(SoulId soulId, Faction faction) implements GameEvent {
        public GameEventType type() { return GameEventType.SOUL_REMOVE; }
    }

    record SoulMatured(SoulId soulId, Faction faction) implements GameEvent {
        public GameEventType type() { return GameEventType.SOUL_MATURED; }
    }

    record Attack(SoulId attackerId, SoulId targetId, double damage, double targetEnergy,
                  Vec2 attackerPosition, Vec2 targetPosition) implements GameEvent {
        public GameEventType type() { return GameEventType.ATTACK; }
    }

    record SpellStarted(SpellId spellId, SoulId casterId, Faction faction, TilePosition target, long duration,
                        Vec2 casterPosition, Vec2 targetPosition) implements GameEvent {
        public GameEventType type() { return GameEventType.SPELL_STARTED; }
    }

    /**
     * @param reason {@code attacked} or {@code died}
     */
    record SpellInterrupted(SpellId spellId, SoulId casterId, Faction faction, TilePosition target,
                            String reason) implements GameEvent {
        public GameEventType type() { return GameEventType.SPELL_INTERRUPTED; }
    }

    record SpellCompleted(SpellId spellId, SoulId casterId, Faction faction, TilePosition target,
                          int tilesCaptured) implements GameEvent {
        public GameEventType type() { return GameEventType.SPELL_COMPLETED; }
    }

    record TileUpdated(int x, int y, Faction owner) implements GameEvent {
        public GameEventType type() { return GameEventType.TILE_UPDATED; }
    }

    record OrbSpawned(OrbId orbId, Faction faction, double x, double y) implements GameEvent {
        public GameEventType type() { return GameEventType.ORB_SPAWNED; }
    }

    record OrbCollected(OrbId orbId, SoulId soulId, Faction faction, double energyGained,
                        long respawnAt) implements GameEvent {
        public GameEventType type() { return GameEventType.ORB_COLLECTED; }
    }

    record MatingStarted(SoulId firstId, SoulId secondId, Faction faction) implements GameEvent {
        public GameEventType type() { return GameEventType.MATING_STARTED; }
    }

    record MatingCompleted(SoulId firstId, SoulId secondId, SoulId childId, Faction faction) implements GameEvent {
        public GameEventType type() { return GameEventType.MATING_COMPLETED; }
    }

    /**
     * @param reason {@code partner_lost}, {@code out_of_range} or {@code population_cap}
     */
    record MatingCancelled(SoulId firstId, SoulId secondId, Faction faction, String reason) implements GameEvent {
        public GameEventType type() { return GameEventType.MATING_CANCELLED; }
    }

    record DisasterStarted(String disaster, long duration, Map<String, Object> details) implements GameEvent {
        public DisasterStarted {
            details = Map.copyOf(details);
        }

        public GameEventType type() { return GameEventType.DISASTER_START; }
    }

    record DisasterEnded(String disaster, int victims) implements GameEvent {
        public GameEventType type() { return GameEventType.DISASTER_END; }
    }

    record MeteoriteImpact(double x, double y, double size) implements GameEvent {
        public GameEventType type() { return GameEventType.METEORITE_IMPACT; }
    }

    /**
     * @param attackerId the soul whose hit caused the update, {@code null} for regeneration
     */
    record NexusUpdated(Faction faction, double health, double maxHealth, SoulId attackerId) implements GameEvent {
        public GameEventType type() { return GameEventType.NEXUS_UPDATE; }
    }

    record NexusDestroyed(Faction faction, SoulId destroyedBy) implements GameEvent {
        public GameEventType type() { return GameEventType.NEXUS_DESTROYED; }
    }

    record BuffApplied(BuffId buffId, Faction faction, BuffSource source, String description,
                       Map<String, Double> multipliers, long expiresAt) implements GameEvent {
        public BuffApplied {
            multipliers = Map.copyOf(multipliers);
        }

        public GameEventType type() { return GameEventType.BUFF_APPLIED; }
    }

    record BuffRemoved(BuffId buffId, Faction faction, BuffSource source) implements GameEvent {
        public GameEventType type() { return GameEventType.BUFF_REMOVED; }
    }

    record DayNightPhaseChanged(DayPhase phase, double ambientLight, double cycleProgress) implements GameEvent {
        public GameEventType type() { return GameEventType.DAY_NIGHT_PHASE_CHANGE; }
    }

    record EmergencyRespawn(Faction faction, SoulId soulId) implements GameEvent {
        public GameEventType type() { return GameEventType.EMERGENCY_RESPAWN; }
    }
}
