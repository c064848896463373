package org.soulwars.runtime.snapshot;

import org.soulwars.runtime.model.ActiveSpell;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.SoulId;
import org.soulwars.runtime.model.SpellId;
import org.soulwars.runtime.model.TilePosition;
import org.soulwars.runtime.model.Vec2;

/**
 * @param progress completed fraction of the cast in [0, 1]
 */
public record SpellSnapshot(SpellId id, SoulId casterId, Faction faction, TilePosition target, long startedAt,
                            long completesAt, double progress, Vec2 casterPosition, Vec2 targetPosition) {

    public static SpellSnapshot of(ActiveSpell spell, long now) {
        long duration = spell.duration();
        double progress = duration <= 0 ? 1.0 : Math.min(1.0, Math.max(0.0, (now - spell.startedAt()) / (double) duration));
        return new SpellSnapshot(spell.id(), spell.casterId(), spell.faction(), spell.target(), spell.startedAt(),
            spell.completesAt(), progress, spell.casterPosition(), spell.targetPosition());
    }
}
