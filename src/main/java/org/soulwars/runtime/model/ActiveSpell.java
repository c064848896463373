package org.soulwars.runtime.model;

/**
 * A cast in progress. Completion time already includes the caster faction's cast-time multiplier.
 */
public record ActiveSpell(
    SpellId id,
    SoulId casterId,
    Faction faction,
    TilePosition target,
    long startedAt,
    long completesAt,
    Vec2 casterPosition,
    Vec2 targetPosition) {

    public boolean isComplete(long now) {
        return now >= completesAt;
    }

    public long duration() {
        return completesAt - startedAt;
    }
}
