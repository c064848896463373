package org.soulwars.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identity of a soul. Ids are allocated in ascending order by the world, so ordering by id
 * equals ordering by creation.
 */
public record SoulId(long value) implements Comparable<SoulId> {

    @Override
    public int compareTo(SoulId other) {
        return Long.compare(value, other.value);
    }

    @JsonValue
    @Override
    public String toString() {
        return "soul-" + value;
    }
}
