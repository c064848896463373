package org.soulwars.runtime.systems;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.ActiveSpell;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulId;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TilePosition;

/**
 * Cast lifecycle: starting spells for souls that just entered CASTING, completing them after the
 * (day/night adjusted) cast duration and interrupting them.
 * <p>
 * Invariants kept here: at most one active spell per caster and per target tile. Both are rechecked
 * right before a spell is created; a soul that loses the race drops back to ROAMING.
 * </p>
 * <p>
 * Completion runs as a separate pass after combat, so a hit landing in the same tick still interrupts
 * the cast. A completed spell captures the footprint around its target for the caster's faction and kills
 * the caster. The caster's death event is left to the regular death handling.
 * </p>
 */
public final class SpellSystem {

    private static final Logger LOG = LoggerFactory.getLogger(SpellSystem.class);

    public static final String REASON_ATTACKED = "attacked";
    public static final String REASON_DIED = "died";
    public static final String REASON_TIMEOUT = "timeout";

    private final World world;
    private final GameConfig.SoulSettings settings;
    private final BuffManager buffs;
    private final DefenderSelector defenders;

    public SpellSystem(World world, BuffManager buffs, DefenderSelector defenders) {
        this.world = world;
        this.settings = world.config().soul();
        this.buffs = buffs;
        this.defenders = defenders;
    }

    /**
     * Starts a spell for every living CASTING soul that has none yet.
     */
    public void update(long now) {
        for (Soul soul : world.soulList()) {
            if (soul.isAlive() && soul.isCasting() && world.spellByCaster(soul.id()) == null) {
                startSpell(soul, now);
            }
        }
    }

    /**
     * @return the started spell, or {@code null} if the target was lost or already taken
     */
    ActiveSpell startSpell(Soul caster, long now) {
        TilePosition target = caster.castTarget();
        if (target == null
            || !world.tileMap().isInBounds(target.x(), target.y())
            || world.tileMap().ownerAt(target) == caster.faction()
            || world.isTileUnderSpell(target)) {
            LOG.debug("{} lost its cast target {}, returning to roaming", caster.id(), target);
            caster.transitionTo(SoulState.ROAMING, now);
            return null;
        }

        caster.drainEnergy(settings.castEnergyCost() * caster.maxEnergy());
        if (caster.isDead()) {
            return null;
        }

        long duration = Math.round(settings.spellCastTimeMs() * buffs.multiplier(caster.faction(), BuffEffect.CAST_TIME));
        ActiveSpell spell = new ActiveSpell(world.nextSpellId(), caster.id(), caster.faction(), target, now,
            now + duration, caster.position(), world.tileMap().center(target));
        world.addSpell(spell);
        world.events().emit(new GameEvent.SpellStarted(spell.id(), caster.id(), caster.faction(), target, duration,
            spell.casterPosition(), spell.targetPosition()));
        LOG.debug("{} started {} on tile ({}, {}) for {} ms", caster.id(), spell.id(), target.x(), target.y(), duration);

        Soul defender = defenders.select(caster);
        if (defender != null) {
            DefenderSelector.assign(defender, caster, now);
            LOG.debug("{} assigned to defend against {}", defender.id(), caster.id());
        }
        return spell;
    }

    /**
     * Resolves every spell whose completion time has been reached.
     *
     * @return the number of completed spells
     */
    public int completeSpells(long now) {
        int completed = 0;
        List<ActiveSpell> spells = new ArrayList<>(world.spells().values());
        for (ActiveSpell spell : spells) {
            if (!world.spells().containsKey(spell.id()) || !spell.isComplete(now)) {
                continue;
            }
            world.removeSpell(spell.id());
            Soul caster = world.soul(spell.casterId());
            releaseDefenders(spell.casterId(), now);
            if (caster == null || caster.isDead()) {
                world.events().emit(new GameEvent.SpellInterrupted(spell.id(), spell.casterId(), spell.faction(),
                    spell.target(), REASON_DIED));
                continue;
            }

            List<TilePosition> changed = world.tileMap().capture(spell.target(), settings.captureRadius(), spell.faction());
            caster.transitionTo(SoulState.ROAMING, now);
            caster.kill("spell");

            world.events().emit(new GameEvent.SpellCompleted(spell.id(), caster.id(), spell.faction(), spell.target(),
                changed.size()));
            for (TilePosition tile : changed) {
                world.events().emit(new GameEvent.TileUpdated(tile.x(), tile.y(), spell.faction()));
            }
            LOG.debug("{} completed: {} captured {} tiles around ({}, {})", spell.id(), caster.id(), changed.size(),
                spell.target().x(), spell.target().y());
            completed++;
        }
        return completed;
    }

    /**
     * Cancels the caster's spell (if any), releases its defenders and sends a channeling caster back to ROAMING.
     *
     * @return true if an active spell was removed
     */
    public boolean interrupt(Soul caster, String reason, long now) {
        ActiveSpell spell = world.spellByCaster(caster.id());
        if (spell != null) {
            world.removeSpell(spell.id());
            world.events().emit(new GameEvent.SpellInterrupted(spell.id(), caster.id(), caster.faction(), spell.target(),
                reason));
            LOG.debug("{} of {} interrupted ({})", spell.id(), caster.id(), reason);
        }
        releaseDefenders(caster.id(), now);
        if (caster.state().isChanneling()) {
            caster.transitionTo(SoulState.ROAMING, now);
        }
        return spell != null;
    }

    /**
     * Death path: removes a dead soul's spell without touching the soul's state.
     */
    public void handleSoulDeath(Soul dead, long now) {
        ActiveSpell spell = world.spellByCaster(dead.id());
        if (spell != null) {
            world.removeSpell(spell.id());
            world.events().emit(new GameEvent.SpellInterrupted(spell.id(), dead.id(), dead.faction(), spell.target(),
                REASON_DIED));
        }
        releaseDefenders(dead.id(), now);
    }

    private void releaseDefenders(SoulId casterId, long now) {
        for (Soul soul : world.souls()) {
            if (soul.state().isCombatState() && casterId.equals(soul.trackedEnemy())) {
                soul.transitionTo(SoulState.ROAMING, now);
            }
        }
    }
}
