package org.soulwars.runtime.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of domain event kinds emitted by the simulation. The wire name is the {@code type}
 * discriminator seen by observers.
 */
public enum GameEventType {
    SOUL_SPAWN("soul_spawn"),
    SOUL_UPDATE("soul_update"),
    SOUL_DEATH("soul_death"),
    SOUL_REMOVE("soul_remove"),
    SOUL_MATURED("soul_matured"),
    ATTACK("attack"),
    SPELL_STARTED("spell_started"),
    SPELL_INTERRUPTED("spell_interrupted"),
    SPELL_COMPLETED("spell_completed"),
    TILE_UPDATED("tile_updated"),
    ORB_SPAWNED("orb_spawned"),
    ORB_COLLECTED("orb_collected"),
    MATING_STARTED("mating_started"),
    MATING_COMPLETED("mating_completed"),
    MATING_CANCELLED("mating_cancelled"),
    DISASTER_START("disaster_start"),
    DISASTER_END("disaster_end"),
    METEORITE_IMPACT("meteorite_impact"),
    NEXUS_UPDATE("nexus_update"),
    NEXUS_DESTROYED("nexus_destroyed"),
    BUFF_APPLIED("buff_applied"),
    BUFF_REMOVED("buff_removed"),
    DAY_NIGHT_PHASE_CHANGE("day_night_phase_change"),
    EMERGENCY_RESPAWN("emergency_respawn");

    private final String wireName;

    GameEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
