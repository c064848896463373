package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The system that created a buff; buffs can be cleared per source.
 */
public enum BuffSource {
    DAY_NIGHT("daynight"),
    DISASTER("disaster"),
    SPELL("spell"),
    SPECIAL_EVENT("special_event");

    private final String wireName;

    BuffSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
