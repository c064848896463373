package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity of an active spell.
 */
public record SpellId(long value) {

    @JsonValue
    @Override
    public String toString() {
        return "spell-" + value;
    }
}
