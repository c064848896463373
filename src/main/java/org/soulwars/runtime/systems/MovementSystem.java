package org.soulwars.runtime.systems;

import java.util.List;

import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.EnergyOrb;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.TilePosition;
import org.soulwars.runtime.model.Vec2;

/**
 * Turns each soul's state into a velocity and moves it.
 * <p>
 * Targets per state:
 * <ul>
 *   <li>DEFENDING: the tracked enemy, clamped to valid ground so defenders engage at the border.</li>
 *   <li>HUNGRY: the nearest available own orb lying on own territory.</li>
 *   <li>SEEKING: the best scoring free tile, else the enemy nexus. SEEKING_NEXUS: the enemy nexus.</li>
 *   <li>MATING: settles into a separation band around the partner.</li>
 *   <li>ROAMING while retreating: away from nearby enemies.</li>
 *   <li>everything else: random wander. PREPARING, CASTING, ATTACKING, ATTACKING_NEXUS and RESTING hold position.</li>
 * </ul>
 * When the direct route is blocked or the soul has not made progress over its position history window,
 * {@link NavigationFallback} takes over.
 * </p>
 */
public final class MovementSystem {

    private static final int CLAMP_STEPS = 12;
    private static final double MATING_APPROACH_BAND = 0.7;
    private static final double MATING_RETREAT_BAND = 0.3;
    private static final double MATING_APPROACH_SPEED = 0.5;
    private static final double MATING_RETREAT_SPEED = 0.2;
    private static final double MATING_DRIFT = 0.5;

    private final World world;
    private final GameConfig config;
    private final ScoringSystem scoring;
    private final BuffManager buffs;
    private final TerritoryGuard guard;
    private final NavigationFallback navigation;

    public MovementSystem(World world, ScoringSystem scoring, BuffManager buffs, TerritoryGuard guard,
                          NavigationFallback navigation) {
        this.world = world;
        this.config = world.config();
        this.scoring = scoring;
        this.buffs = buffs;
        this.guard = guard;
        this.navigation = navigation;
    }

    /**
     * Moves every living soul in ascending id order, then separates overlapping souls.
     */
    public void update(long now) {
        List<Soul> living = world.livingSouls();
        for (Soul soul : living) {
            move(soul, now);
        }
        separate(living);
    }

    void move(Soul soul, long now) {
        double speed = config.soul().movementSpeed() * buffs.multiplier(soul.faction(), BuffEffect.SPEED);
        SoulState state = soul.state();

        if (state.holdsPosition()) {
            soul.setVelocity(0, 0);
            soul.positionHistory().clear();
            return;
        }
        if (state == SoulState.MATING) {
            steerMating(soul, speed);
            apply(soul);
            return;
        }

        Vec2 target = null;
        switch (state) {
            case DEFENDING -> {
                Soul enemy = world.soul(soul.trackedEnemy());
                if (enemy != null && enemy.isAlive()) {
                    if (soul.distanceTo(enemy) <= config.soul().attackRange()) {
                        soul.setVelocity(0, 0);
                        return;
                    }
                    target = guard.clampTowards(soul.position(), enemy.position(), soul.faction(), CLAMP_STEPS);
                    speed *= config.soul().defendSpeedMultiplier();
                }
            }
            case HUNGRY -> target = nearestOrb(soul);
            case SEEKING -> {
                target = seekTarget(soul);
                if (target == null) {
                    target = enemyNexusTarget(soul);
                }
            }
            case SEEKING_NEXUS -> target = enemyNexusTarget(soul);
            case ROAMING, SOCIALISING -> {
                if (soul.isRetreating(now)) {
                    target = retreatTarget(soul);
                }
            }
            default -> {
            }
        }

        if (target == null) {
            wander(soul, speed);
        } else {
            steerTowards(soul, target, speed);
        }
        apply(soul);
    }

    private void steerTowards(Soul soul, Vec2 target, double speed) {
        Vec2 position = soul.position();
        Vec2 delta = target.minus(position);
        double distance = delta.length();
        if (distance < 1e-9) {
            soul.setVelocity(0, 0);
            return;
        }
        Vec2 velocity = distance <= speed ? delta : delta.times(speed / distance);
        if (isBlocked(soul, velocity) || isStuck(soul)) {
            NavigationFallback.Resolution resolution = navigation.resolve(soul, target, speed);
            velocity = resolution.velocity();
        }
        soul.setVelocity(velocity);
    }

    private boolean isBlocked(Soul soul, Vec2 velocity) {
        int samples = Math.max(1, config.movement().pathSamples());
        Vec2 position = soul.position();
        for (int i = 1; i <= samples; i++) {
            if (!guard.isValidPosition(position.plus(velocity.times(i)), soul.faction())) {
                return true;
            }
        }
        return false;
    }

    private boolean isStuck(Soul soul) {
        return soul.positionHistory().isFull()
            && soul.positionHistory().netDisplacement() < config.movement().stuckDistance();
    }

    private void wander(Soul soul, double maxSpeed) {
        double force = config.movement().wanderForce();
        Vec2 velocity = new Vec2(
            soul.vx() + (soul.random().nextDouble() - 0.5) * force,
            soul.vy() + (soul.random().nextDouble() - 0.5) * force);
        soul.setVelocity(velocity.clampLength(maxSpeed));
    }

    private void steerMating(Soul soul, double speed) {
        Soul partner = world.soul(soul.matingPartner());
        if (partner == null) {
            soul.setVelocity(0, 0);
            return;
        }
        double distance = soul.distanceTo(partner);
        double range = config.mating().range();
        if (distance > range * MATING_APPROACH_BAND) {
            Vec2 direction = partner.position().minus(soul.position()).normalized();
            soul.setVelocity(direction.times(speed * MATING_APPROACH_SPEED));
        } else if (distance < range * MATING_RETREAT_BAND && distance > 0) {
            Vec2 direction = soul.position().minus(partner.position()).normalized();
            soul.setVelocity(direction.times(speed * MATING_RETREAT_SPEED));
        } else {
            soul.setVelocity(
                (soul.random().nextDouble() - 0.5) * MATING_DRIFT,
                (soul.random().nextDouble() - 0.5) * MATING_DRIFT);
        }
    }

    private void apply(Soul soul) {
        double nx = soul.x() + soul.vx();
        double ny = soul.y() + soul.vy();
        if (guard.isValidPosition(nx, ny, soul.faction())) {
            soul.setPosition(nx, ny);
        } else {
            guard.pushAway(soul);
        }
        guard.enforceWorldBounds(soul);
        soul.positionHistory().record(soul.x(), soul.y());
    }

    private Vec2 nearestOrb(Soul soul) {
        TileMap tileMap = world.tileMap();
        EnergyOrb nearest = null;
        double nearestDistance = Double.MAX_VALUE;
        for (EnergyOrb orb : world.orbs().values()) {
            if (orb.faction() != soul.faction() || !orb.isAvailable()) {
                continue;
            }
            Vec2 position = orb.position();
            if (tileMap.ownerAtWorld(position.x(), position.y()) != soul.faction()) {
                continue;
            }
            double distance = soul.distanceTo(position);
            if (distance < nearestDistance) {
                nearestDistance = distance;
                nearest = orb;
            }
        }
        return nearest == null ? null : nearest.position();
    }

    private Vec2 seekTarget(Soul soul) {
        TilePosition best = scoring.bestTile(soul.faction(), tile -> !world.isTileTargeted(tile, soul.id()));
        if (best == null) {
            return null;
        }
        return guard.clampTowards(soul.position(), world.tileMap().center(best), soul.faction(), CLAMP_STEPS);
    }

    private Vec2 enemyNexusTarget(Soul soul) {
        Nexus nexus = world.nexus(soul.faction().opponent());
        if (nexus == null || nexus.isDestroyed()) {
            return null;
        }
        return guard.clampTowards(soul.position(), nexus.position(), soul.faction(), CLAMP_STEPS);
    }

    private Vec2 retreatTarget(Soul soul) {
        double threshold = config.retreat().threshold();
        double awayX = 0;
        double awayY = 0;
        for (Soul other : world.souls()) {
            if (other.faction() == soul.faction() || !other.isAlive()) {
                continue;
            }
            double dx = soul.x() - other.x();
            double dy = soul.y() - other.y();
            double distance = Math.sqrt(dx * dx + dy * dy);
            if (distance > 0 && distance < threshold) {
                awayX += dx / distance;
                awayY += dy / distance;
            }
        }
        if (awayX == 0 && awayY == 0) {
            return null;
        }
        Vec2 away = new Vec2(awayX, awayY).normalized();
        return soul.position().plus(away.times(config.retreat().forceDistance()));
    }

    /**
     * Pushes apart every pair of living souls closer than the collision radius, proportional to the overlap.
     * A soul whose pushed position would be invalid gets a random nudge instead.
     */
    void separate(List<Soul> souls) {
        double radius = config.movement().collisionRadius();
        double force = config.movement().separationForce();
        for (int i = 0; i < souls.size(); i++) {
            Soul a = souls.get(i);
            for (int j = i + 1; j < souls.size(); j++) {
                Soul b = souls.get(j);
                double distance = a.distanceTo(b);
                if (distance >= radius || distance <= 0) {
                    continue;
                }
                double push = (radius - distance) * force;
                double sx = (a.x() - b.x()) / distance * push;
                double sy = (a.y() - b.y()) / distance * push;
                displace(a, sx, sy);
                displace(b, -sx, -sy);
            }
        }
    }

    private void displace(Soul soul, double dx, double dy) {
        double nx = soul.x() + dx;
        double ny = soul.y() + dy;
        if (guard.isValidPosition(nx, ny, soul.faction())) {
            soul.setPosition(nx, ny);
        } else {
            double nudge = config.movement().wanderForce();
            soul.setVelocity(
                soul.vx() + (soul.random().nextDouble() - 0.5) * nudge,
                soul.vy() + (soul.random().nextDouble() - 0.5) * nudge);
        }
    }
}
