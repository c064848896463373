package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity of a buff. Applying a buff with an id that is already active replaces the old one.
 */
public record BuffId(BuffSource source, Faction faction, String name) {

    @JsonValue
    @Override
    public String toString() {
        return source.wireName() + ":" + faction.wireName() + ":" + name;
    }
}
