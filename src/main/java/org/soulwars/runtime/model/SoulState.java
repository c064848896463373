package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Behaviour states of a soul. Every soul starts in {@link #ROAMING}; there is no terminal state,
 * death removes the soul from the world instead.
 * <p>
 * Casting-related flags are derived from the state here and never stored separately on the soul.
 */
public enum SoulState {
    ROAMING("roaming"),
    HUNGRY("hungry"),
    SEEKING("seeking"),
    PREPARING("preparing"),
    CASTING("casting"),
    DEFENDING("defending"),
    ATTACKING("attacking"),
    SEEKING_NEXUS("seeking_nexus"),
    ATTACKING_NEXUS("attacking_nexus"),
    SOCIALISING("socialising"),
    RESTING("resting"),
    MATING("mating");

    private final String wireName;

    SoulState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isCasting() {
        return this == CASTING;
    }

    public boolean isPreparing() {
        return this == PREPARING;
    }

    /**
     * @return true while a spell is being prepared or cast (the states an attack interrupts)
     */
    public boolean isChanneling() {
        return this == PREPARING || this == CASTING;
    }

    /**
     * @return true for the states counted against a faction's seeking allowance
     */
    public boolean isSpellState() {
        return this == SEEKING || this == PREPARING || this == CASTING;
    }

    /**
     * @return true while the soul tracks a specific enemy caster
     */
    public boolean isCombatState() {
        return this == DEFENDING || this == ATTACKING;
    }

    /**
     * @return true for states in which the soul does not move at all
     */
    public boolean holdsPosition() {
        return switch (this) {
            case PREPARING, CASTING, ATTACKING, ATTACKING_NEXUS, RESTING -> true;
            default -> false;
        };
    }
}
