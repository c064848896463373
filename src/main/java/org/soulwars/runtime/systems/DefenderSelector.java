package org.soulwars.runtime.systems;

import org.soulwars.runtime.World;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;

/**
 * Picks the single soul that intercepts an enemy caster.
 * <p>
 * A caster (a soul in PREPARING or CASTING) has at most one defender at any time: as long as some living
 * soul is DEFENDING or ATTACKING with the caster as tracked enemy, no other defender is selected. Otherwise
 * the candidate with the highest energy among living adult souls of the opposing faction that are ROAMING,
 * HUNGRY, SEEKING or PREPARING is chosen; on equal energy the lower id wins.
 * </p>
 */
public final class DefenderSelector {

    private final World world;

    public DefenderSelector(World world) {
        this.world = world;
    }

    /**
     * @return true if some living soul already tracks {@code caster} as its enemy
     */
    public boolean hasDefender(Soul caster) {
        for (Soul soul : world.souls()) {
            if (soul.isAlive() && soul.state().isCombatState() && caster.id().equals(soul.trackedEnemy())) {
                return true;
            }
        }
        return false;
    }

    public static boolean isEligible(Soul soul) {
        if (!soul.isAlive() || !soul.isAdult()) {
            return false;
        }
        SoulState state = soul.state();
        return state == SoulState.ROAMING || state == SoulState.HUNGRY
            || state == SoulState.SEEKING || state == SoulState.PREPARING;
    }

    /**
     * @return the defender to assign to {@code caster}, or {@code null} if the caster is not channeling,
     *         already has a defender or no candidate is available
     */
    public Soul select(Soul caster) {
        if (!caster.isAlive() || !caster.state().isChanneling() || hasDefender(caster)) {
            return null;
        }
        Soul best = null;
        for (Soul candidate : world.souls()) {
            if (candidate.faction() == caster.faction() || !isEligible(candidate)) {
                continue;
            }
            if (best == null || candidate.energy() > best.energy()) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Moves {@code defender} into DEFENDING against {@code caster}.
     */
    public static void assign(Soul defender, Soul caster, long now) {
        defender.transitionTo(SoulState.DEFENDING, now);
        defender.setTrackedEnemy(caster.id());
    }
}
