package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Quantities a buff can scale. All effects are multiplicative; {@code 1.0} is neutral.
 */
public enum BuffEffect {
    SPEED("speed"),
    CAST_TIME("castTime"),
    ENERGY("energy"),
    MATING("mating"),
    DAMAGE("damage");

    private final String wireName;

    BuffEffect(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
