package org.soulwars.runtime.systems;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.Vec2;

/**
 * Finds a way forward when the direct route to a movement target is blocked or the soul is stuck.
 * Tried in order:
 * <ol>
 *   <li>single-axis stepping when the soul stands in a narrow corridor (at most two of the four
 *       orthogonal neighbour tiles are own territory),</li>
 *   <li>an 8-direction search for the valid step with the most progress towards the target,</li>
 *   <li>a randomised escape with a radius that doubles up to {@code escapeMaxRadius}.</li>
 * </ol>
 */
public final class NavigationFallback {

    private static final Logger LOG = LoggerFactory.getLogger(NavigationFallback.class);

    /** Fixed search order: E, NE, N, NW, W, SW, S, SE (screen coordinates, north is negative y). */
    private static final double[][] DIRECTIONS = {
        {1, 0}, {Math.sqrt(0.5), -Math.sqrt(0.5)}, {0, -1}, {-Math.sqrt(0.5), -Math.sqrt(0.5)},
        {-1, 0}, {-Math.sqrt(0.5), Math.sqrt(0.5)}, {0, 1}, {Math.sqrt(0.5), Math.sqrt(0.5)}
    };

    /**
     * Which tier produced the velocity.
     */
    public enum Tier {
        TUNNEL, DIRECTIONAL, ESCAPE, NONE
    }

    /**
     * Outcome of a fallback search.
     *
     * @param velocity the velocity to use, {@link Vec2#ZERO} for {@link Tier#NONE}
     */
    public record Resolution(Tier tier, Vec2 velocity) {}

    private final TerritoryGuard guard;
    private final TileMap tileMap;
    private final GameConfig.MovementSettings settings;

    public NavigationFallback(GameConfig config, TerritoryGuard guard) {
        this.guard = guard;
        this.tileMap = guard.tileMap();
        this.settings = config.movement();
    }

    public Resolution resolve(Soul soul, Vec2 target, double speed) {
        Vec2 position = soul.position();
        Faction faction = soul.faction();

        if (isInTunnel(position, faction)) {
            Vec2 step = tunnelStep(position, target, speed, faction);
            if (step != null) {
                return new Resolution(Tier.TUNNEL, step);
            }
        }

        Vec2 directional = bestDirection(position, target, speed, faction);
        if (directional != null) {
            return new Resolution(Tier.DIRECTIONAL, directional);
        }

        Vec2 escape = escape(soul, speed);
        if (escape != null) {
            soul.positionHistory().clear();
            return new Resolution(Tier.ESCAPE, escape);
        }
        LOG.debug("{} found no way out at ({}, {})", soul.id(), position.x(), position.y());
        return new Resolution(Tier.NONE, Vec2.ZERO);
    }

    /**
     * @return true if at most two of the four orthogonal neighbours of the soul's tile belong to its faction
     */
    public boolean isInTunnel(Vec2 position, Faction faction) {
        int tileX = (int) Math.floor(position.x() / tileMap.tileWidth());
        int tileY = (int) Math.floor(position.y() / tileMap.tileHeight());
        int open = 0;
        int[][] neighbours = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
        for (int[] n : neighbours) {
            int nx = tileX + n[0];
            int ny = tileY + n[1];
            if (tileMap.isInBounds(nx, ny) && tileMap.ownerAt(nx, ny) == faction) {
                open++;
            }
        }
        return open <= 2;
    }

    private Vec2 tunnelStep(Vec2 position, Vec2 target, double speed, Faction faction) {
        double dx = target.x() - position.x();
        double dy = target.y() - position.y();
        Vec2 horizontal = dx == 0 ? null : new Vec2(Math.signum(dx) * speed, 0);
        Vec2 vertical = dy == 0 ? null : new Vec2(0, Math.signum(dy) * speed);
        Vec2 first = Math.abs(dx) >= Math.abs(dy) ? horizontal : vertical;
        Vec2 second = first == horizontal ? vertical : horizontal;
        for (Vec2 step : new Vec2[] {first, second}) {
            if (step != null && guard.isValidPosition(position.plus(step), faction)) {
                return step;
            }
        }
        return null;
    }

    private Vec2 bestDirection(Vec2 position, Vec2 target, double speed, Faction faction) {
        double currentDistance = position.distanceTo(target);
        Vec2 best = null;
        double bestProgress = 0;
        for (double[] direction : DIRECTIONS) {
            Vec2 step = new Vec2(direction[0] * speed, direction[1] * speed);
            Vec2 candidate = position.plus(step);
            if (!guard.isValidPosition(candidate, faction)) {
                continue;
            }
            double progress = currentDistance - candidate.distanceTo(target);
            if (progress > bestProgress) {
                bestProgress = progress;
                best = step;
            }
        }
        return best;
    }

    private Vec2 escape(Soul soul, double speed) {
        Vec2 position = soul.position();
        double radius = Math.max(speed * 2, 1.0);
        while (radius <= settings.escapeMaxRadius()) {
            for (int attempt = 0; attempt < settings.escapeAttempts(); attempt++) {
                double angle = soul.random().nextDouble() * Math.PI * 2;
                Vec2 candidate = new Vec2(position.x() + Math.cos(angle) * radius, position.y() + Math.sin(angle) * radius);
                if (guard.isValidPosition(candidate, soul.faction())) {
                    return candidate.minus(position).normalized().times(speed);
                }
            }
            radius *= 2;
        }
        return null;
    }
}
