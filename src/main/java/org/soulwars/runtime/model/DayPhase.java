package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase of the day/night cycle, in cycle order.
 */
public enum DayPhase {
    DAY("day"),
    DUSK("dusk"),
    NIGHT("night"),
    DAWN("dawn");

    private final String wireName;

    DayPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @param faction the faction to check
     * @return true if this phase grants {@code faction} its time-of-day buffs
     */
    public boolean favours(Faction faction) {
        return (this == DAY && faction == Faction.LIGHT) || (this == NIGHT && faction == Faction.DARK);
    }

    /**
     * Light souls sleep at night, dark souls in the day.
     *
     * @param faction the faction to check
     * @return true if {@code faction} may rest during this phase
     */
    public boolean isRestPhaseFor(Faction faction) {
        return (this == NIGHT && faction == Faction.LIGHT) || (this == DAY && faction == Faction.DARK);
    }
}
