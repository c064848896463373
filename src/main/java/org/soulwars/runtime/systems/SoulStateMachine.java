package org.soulwars.runtime.systems;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.TilePosition;
import org.soulwars.runtime.model.Vec2;

/**
 * Per-soul behaviour transitions, evaluated once per tick for every living soul.
 * <p>
 * The machine only decides the next state. Moving, starting spells and dealing damage happen in the
 * systems that run after it; the one exception is a cast timeout, which is delegated to
 * {@link SpellSystem#interrupt} so that the spell and its defenders are released together with the state.
 * </p>
 * <p>
 * Priorities in ROAMING: hunger, then defending against an enemy caster, then (adults only) seeking a
 * cast target or the enemy nexus, then resting. Children only eat and roam.
 * </p>
 * <p>
 * PREPARING, CASTING, DEFENDING and ATTACKING never switch to HUNGRY: a soul committed to a cast or a
 * defence finishes or loses it before it goes looking for food.
 * </p>
 */
public final class SoulStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(SoulStateMachine.class);

    private final World world;
    private final GameConfig config;
    private final ScoringSystem scoring;
    private final DefenderSelector defenders;
    private final SpellSystem spells;
    private final MatingSystem mating;
    private final DayNightSystem dayNight;

    public SoulStateMachine(World world, ScoringSystem scoring, DefenderSelector defenders, SpellSystem spells,
                            MatingSystem mating, DayNightSystem dayNight) {
        this.world = world;
        this.config = world.config();
        this.scoring = scoring;
        this.defenders = defenders;
        this.spells = spells;
        this.mating = mating;
        this.dayNight = dayNight;
    }

    /**
     * Evaluates one transition step for {@code soul}. Dead souls are left untouched.
     */
    public void update(Soul soul, long now) {
        if (soul.isDead()) {
            return;
        }
        switch (soul.state()) {
            case ROAMING -> updateRoaming(soul, now);
            case HUNGRY -> updateHungry(soul, now);
            case SEEKING -> updateSeeking(soul, now);
            case PREPARING -> updatePreparing(soul, now);
            case CASTING -> updateCasting(soul, now);
            case DEFENDING -> updateDefending(soul, now);
            case ATTACKING -> updateAttacking(soul, now);
            case SEEKING_NEXUS -> updateSeekingNexus(soul, now);
            case ATTACKING_NEXUS -> updateAttackingNexus(soul, now);
            case RESTING -> updateResting(soul, now);
            case SOCIALISING -> change(soul, SoulState.ROAMING, now, "socialised");
            case MATING -> updateMating(soul, now);
        }
    }

    private void updateRoaming(Soul soul, long now) {
        if (isHungry(soul)) {
            change(soul, SoulState.HUNGRY, now, "hungry");
            return;
        }
        if (tryDefend(soul, now)) {
            return;
        }
        if (soul.isChild()) {
            return;
        }
        if (mayStartSeeking(soul, now)) {
            if (scoring.hasCapturableTile(soul.faction(), tile -> !world.isTileTargeted(tile, soul.id()))) {
                change(soul, SoulState.SEEKING, now, "capturable tile available");
                return;
            }
            if (isEnemyNexusAlive(soul.faction())) {
                change(soul, SoulState.SEEKING_NEXUS, now, "no capturable tile left");
                return;
            }
        }
        if (shouldRest(soul, now)) {
            change(soul, SoulState.RESTING, now, "rest phase");
            soul.recordSleep(now);
        }
    }

    private void updateHungry(Soul soul, long now) {
        if (soul.isAdult() && tryDefend(soul, now)) {
            return;
        }
        if (!isHungry(soul)) {
            change(soul, SoulState.ROAMING, now, "fed");
        }
    }

    private void updateSeeking(Soul soul, long now) {
        if (world.countLivingAdults(soul.faction()) <= config.mating().minRestingSouls()) {
            change(soul, SoulState.ROAMING, now, "population too small");
            return;
        }
        if (tryDefend(soul, now)) {
            return;
        }
        if (isHungry(soul)) {
            change(soul, SoulState.HUNGRY, now, "hungry");
            return;
        }

        TilePosition best = scoring.bestTile(soul.faction(), tile -> !world.isTileTargeted(tile, soul.id()));
        if (best == null) {
            if (isEnemyNexusAlive(soul.faction())) {
                change(soul, SoulState.SEEKING_NEXUS, now, "no capturable tile left");
            } else {
                change(soul, SoulState.ROAMING, now, "nothing left to seek");
            }
            return;
        }
        if (soul.distanceTo(world.tileMap().center(best)) <= config.soul().spellRange()) {
            prepare(soul, best, now);
            return;
        }

        long inState = soul.timeInState(now);
        if (inState >= config.soul().seekingTimeoutMs() * config.soul().seekingFallbackFraction()) {
            TilePosition fallback = nearestEnemyTileInRange(soul);
            if (fallback != null) {
                prepare(soul, fallback, now);
                return;
            }
        }
        if (inState > config.soul().seekingTimeoutMs()) {
            change(soul, SoulState.ROAMING, now, "seeking timed out");
        }
    }

    private void prepare(Soul soul, TilePosition target, long now) {
        change(soul, SoulState.PREPARING, now, "target in range");
        soul.setCastTarget(target);
    }

    private void updatePreparing(Soul soul, long now) {
        if (tryDefend(soul, now)) {
            return;
        }
        TilePosition target = soul.castTarget();
        if (target == null || world.tileMap().ownerAt(target) == soul.faction()) {
            change(soul, SoulState.ROAMING, now, "target lost");
            return;
        }
        if (soul.timeInState(now) >= config.soul().spellPreparationTimeMs()) {
            change(soul, SoulState.CASTING, now, "prepared");
            soul.setCastTarget(target);
        }
    }

    private void updateCasting(Soul soul, long now) {
        if (soul.timeInState(now) > config.soul().stateTimeoutMs()) {
            LOG.debug("{} cast timed out", soul.id());
            spells.interrupt(soul, SpellSystem.REASON_TIMEOUT, now);
            return;
        }
        if (soul.timeInState(now) > 0 && world.spellByCaster(soul.id()) == null) {
            change(soul, SoulState.ROAMING, now, "no active spell");
        }
    }

    private void updateDefending(Soul soul, long now) {
        Soul enemy = trackedCaster(soul);
        if (enemy == null) {
            change(soul, SoulState.ROAMING, now, "caster gone");
            return;
        }
        if (soul.timeInState(now) > config.soul().stateTimeoutMs()) {
            change(soul, SoulState.ROAMING, now, "defending timed out");
            return;
        }
        if (soul.distanceTo(enemy) <= config.soul().attackRange()) {
            change(soul, SoulState.ATTACKING, now, "caster in range");
            soul.setTrackedEnemy(enemy.id());
        }
    }

    private void updateAttacking(Soul soul, long now) {
        Soul enemy = trackedCaster(soul);
        if (enemy == null) {
            change(soul, SoulState.ROAMING, now, "caster gone");
            return;
        }
        if (soul.distanceTo(enemy) > config.soul().attackRange()) {
            change(soul, SoulState.DEFENDING, now, "caster out of range");
            soul.setTrackedEnemy(enemy.id());
        }
    }

    private void updateSeekingNexus(Soul soul, long now) {
        if (isHungry(soul)) {
            change(soul, SoulState.HUNGRY, now, "hungry");
            return;
        }
        if (tryDefend(soul, now)) {
            return;
        }
        Nexus nexus = world.nexus(soul.faction().opponent());
        if (nexus == null || nexus.isDestroyed()) {
            change(soul, SoulState.ROAMING, now, "enemy nexus destroyed");
            return;
        }
        if (scoring.hasCapturableTile(soul.faction(), tile -> !world.isTileTargeted(tile, soul.id()))) {
            change(soul, SoulState.SEEKING, now, "capturable tile available");
            return;
        }
        if (CombatSystem.distanceToNexus(soul.position(), nexus, world.tileMap()) <= config.soul().attackRange()) {
            change(soul, SoulState.ATTACKING_NEXUS, now, "nexus in range");
            return;
        }
        if (soul.timeInState(now) > config.soul().stateTimeoutMs()) {
            change(soul, SoulState.ROAMING, now, "nexus seeking timed out");
        }
    }

    private void updateAttackingNexus(Soul soul, long now) {
        if (isHungry(soul)) {
            change(soul, SoulState.HUNGRY, now, "hungry");
            return;
        }
        Nexus nexus = world.nexus(soul.faction().opponent());
        if (nexus == null || nexus.isDestroyed()) {
            change(soul, SoulState.ROAMING, now, "enemy nexus destroyed");
            return;
        }
        if (CombatSystem.distanceToNexus(soul.position(), nexus, world.tileMap()) > config.soul().attackRange()) {
            change(soul, SoulState.SEEKING_NEXUS, now, "nexus out of range");
        }
    }

    private void updateResting(Soul soul, long now) {
        if (soul.lastAttackedAt() != Soul.NEVER && soul.lastAttackedAt() >= soul.sleepStartedAt()) {
            change(soul, SoulState.ROAMING, now, "woken by an attack");
            return;
        }
        if (isHungry(soul)) {
            change(soul, SoulState.HUNGRY, now, "hungry");
            return;
        }
        if (soul.sleepProgress(now, config.sleep().durationMs()) >= 1.0) {
            soul.addEnergy(config.sleep().energyRecovery());
            change(soul, SoulState.ROAMING, now, "rested");
        }
    }

    private void updateMating(Soul soul, long now) {
        Soul partner = world.soul(soul.matingPartner());
        if (partner == null || partner.isDead() || !partner.isMating() || !soul.id().equals(partner.matingPartner())) {
            mating.cancel(soul, MatingSystem.REASON_PARTNER_LOST, now);
            return;
        }
        if (soul.distanceTo(partner) > config.mating().range()) {
            mating.cancel(soul, MatingSystem.REASON_OUT_OF_RANGE, now);
            return;
        }
        if (isHungry(soul)) {
            mating.cancel(soul, MatingSystem.REASON_HUNGRY, now);
            return;
        }
        if (now - soul.matingStartedAt() >= config.mating().durationMs()) {
            soul.markReadyToCompleteMating();
        }
    }

    private boolean isHungry(Soul soul) {
        return soul.energyFraction() < config.soul().hungryThreshold();
    }

    /**
     * Switches {@code soul} to DEFENDING if it is the selected defender of some channeling enemy.
     */
    private boolean tryDefend(Soul soul, long now) {
        if (!DefenderSelector.isEligible(soul)) {
            return false;
        }
        for (Soul enemy : world.livingSouls(soul.faction().opponent())) {
            if (enemy.state().isChanneling() && defenders.select(enemy) == soul) {
                DefenderSelector.assign(soul, enemy, now);
                LOG.debug("{} -> defending against {}", soul.id(), enemy.id());
                return true;
            }
        }
        return false;
    }

    /**
     * @return the tracked enemy while it is alive, of the other faction and still channeling, else {@code null}
     */
    private Soul trackedCaster(Soul soul) {
        Soul enemy = world.soul(soul.trackedEnemy());
        if (enemy == null || enemy.isDead() || enemy.faction() == soul.faction() || !enemy.state().isChanneling()) {
            return null;
        }
        return enemy;
    }

    private boolean mayStartSeeking(Soul soul, long now) {
        Faction faction = soul.faction();
        int allowance = world.countLivingAdults(faction) - config.mating().minRestingSouls();
        if (allowance <= 0) {
            return false;
        }
        int seekers = 0;
        for (Soul other : world.livingSouls(faction)) {
            if (other.state().isSpellState()) {
                seekers++;
            }
        }
        if (seekers >= allowance) {
            return false;
        }
        return now - soul.lastCastAt() >= config.soul().spellCooldownMs()
            && soul.energy() >= config.soul().minEnergyToCast();
    }

    private boolean isEnemyNexusAlive(Faction faction) {
        Nexus nexus = world.nexus(faction.opponent());
        return nexus != null && !nexus.isDestroyed();
    }

    private boolean shouldRest(Soul soul, long now) {
        GameConfig.SleepSettings sleep = config.sleep();
        if (!sleep.enabled() || soul.isChild() || !dayNight.isRestPhaseFor(soul.faction())) {
            return false;
        }
        double fraction = soul.energyFraction();
        return fraction >= sleep.minEnergy()
            && fraction <= sleep.maxEnergy()
            && !soul.hasSleptThisCycle()
            && soul.isSleepOffCooldown(now, sleep.cooldownMs());
    }

    /**
     * Closest enemy-owned, untargeted tile whose centre lies within spell range but not closer than the minimum
     * cast distance. Scanned row-major; the first tile wins on equal distance.
     */
    private TilePosition nearestEnemyTileInRange(Soul soul) {
        TileMap tileMap = world.tileMap();
        double range = config.soul().spellRange();
        double minDistance = config.soul().spellMinDistance();
        Faction enemy = soul.faction().opponent();

        int originX = (int) Math.floor(soul.x() / tileMap.tileWidth());
        int originY = (int) Math.floor(soul.y() / tileMap.tileHeight());
        int reachX = (int) Math.ceil(range / tileMap.tileWidth()) + 1;
        int reachY = (int) Math.ceil(range / tileMap.tileHeight()) + 1;

        TilePosition nearest = null;
        double nearestDistance = Double.MAX_VALUE;
        for (int y = Math.max(0, originY - reachY); y <= Math.min(tileMap.rows() - 1, originY + reachY); y++) {
            for (int x = Math.max(0, originX - reachX); x <= Math.min(tileMap.columns() - 1, originX + reachX); x++) {
                if (tileMap.ownerAt(x, y) != enemy) {
                    continue;
                }
                TilePosition tile = new TilePosition(x, y);
                Vec2 center = tileMap.center(tile);
                double distance = soul.distanceTo(center);
                if (distance > range || distance < minDistance || distance >= nearestDistance) {
                    continue;
                }
                if (!world.isTileTargeted(tile, soul.id())) {
                    nearest = tile;
                    nearestDistance = distance;
                }
            }
        }
        return nearest;
    }

    private void change(Soul soul, SoulState next, long now, String reason) {
        SoulState previous = soul.state();
        if (soul.transitionTo(next, now)) {
            LOG.debug("{}: {} -> {} ({})", soul.id(), previous.wireName(), next.wireName(), reason);
        }
    }
}
