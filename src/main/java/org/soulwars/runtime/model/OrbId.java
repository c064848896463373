package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity of an energy orb. Orbs are never destroyed, only relocated, so ids are stable for the world's lifetime.
 */
public record OrbId(Faction faction, int index) {

    @JsonValue
    @Override
    public String toString() {
        return "orb-" + faction.wireName() + "-" + index;
    }
}
