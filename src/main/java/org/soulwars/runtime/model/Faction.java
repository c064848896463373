package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One of the two opposing sides. Every tile, soul, orb and nexus belongs to exactly one faction.
 */
public enum Faction {
    LIGHT("light"),
    DARK("dark");

    private final String wireName;

    Faction(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the opposing faction
     */
    public Faction opponent() {
        return this == LIGHT ? DARK : LIGHT;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
