package org.soulwars.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A multiplicative modifier applied to one faction.
 *
 * @param expiresAt absolute expiry time, or {@link #PERMANENT}
 */
public record Buff(
    BuffId id,
    String description,
    Map<BuffEffect, Double> multipliers,
    long appliedAt,
    long expiresAt) {

    public static final long PERMANENT = -1L;

    public Buff {
        EnumMap<BuffEffect, Double> copy = new EnumMap<>(BuffEffect.class);
        copy.putAll(multipliers);
        multipliers = Collections.unmodifiableMap(copy);
    }

    public BuffSource source() {
        return id.source();
    }

    public Faction faction() {
        return id.faction();
    }

    public double multiplier(BuffEffect effect) {
        return multipliers.getOrDefault(effect, 1.0);
    }

    public boolean isExpired(long now) {
        return expiresAt != PERMANENT && now >= expiresAt;
    }
}
