package org.soulwars.runtime.systems;

import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.Vec2;

/**
 * Decides where a soul may stand.
 * <p>
 * A position is valid for a faction if it lies inside the world minus the boundary buffer, on a tile owned by
 * that faction, and no enemy tile centre within {@code checkRadius} tiles is closer than {@code barrierDistance}.
 * The last rule keeps an invisible buffer zone along every border.
 * </p>
 */
public final class TerritoryGuard {

    private static final int PUSH_RADIUS = 2;
    private static final double PUSH_SPEED_FACTOR = 0.8;

    private final TileMap tileMap;
    private final GameConfig.WorldSettings worldSettings;
    private final GameConfig.TerritorySettings territory;
    private final double movementSpeed;

    public TerritoryGuard(GameConfig config, TileMap tileMap) {
        this.tileMap = tileMap;
        this.worldSettings = config.world();
        this.territory = config.territory();
        this.movementSpeed = config.soul().movementSpeed();
    }

    public boolean isInsideWorld(double x, double y) {
        double buffer = worldSettings.boundaryBuffer();
        return x >= buffer && x <= worldSettings.width() - buffer && y >= buffer && y <= worldSettings.height() - buffer;
    }

    public boolean isValidPosition(double x, double y, Faction faction) {
        if (!isInsideWorld(x, y)) {
            return false;
        }
        if (x < 0 || y < 0) {
            return false;
        }
        int tileX = (int) Math.floor(x / tileMap.tileWidth());
        int tileY = (int) Math.floor(y / tileMap.tileHeight());
        if (!tileMap.isInBounds(tileX, tileY) || tileMap.ownerAt(tileX, tileY) != faction) {
            return false;
        }
        int radius = territory.checkRadius();
        double barrier = territory.barrierDistance();
        Faction enemy = faction.opponent();
        for (int cy = Math.max(0, tileY - radius); cy <= Math.min(tileMap.rows() - 1, tileY + radius); cy++) {
            for (int cx = Math.max(0, tileX - radius); cx <= Math.min(tileMap.columns() - 1, tileX + radius); cx++) {
                if (tileMap.ownerAt(cx, cy) == enemy) {
                    double dx = x - tileMap.centerX(cx);
                    double dy = y - tileMap.centerY(cy);
                    if (Math.sqrt(dx * dx + dy * dy) < barrier) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    public boolean isValidPosition(Vec2 position, Faction faction) {
        return isValidPosition(position.x(), position.y(), faction);
    }

    /**
     * Walks from {@code target} back towards {@code from} until a valid position is found.
     *
     * @param steps number of sample points on the segment
     * @return the valid point closest to {@code target} on the segment, or {@code from} if none is valid
     */
    public Vec2 clampTowards(Vec2 from, Vec2 target, Faction faction, int steps) {
        if (isValidPosition(target, faction)) {
            return target;
        }
        int n = Math.max(1, steps);
        for (int i = n - 1; i >= 1; i--) {
            double t = i / (double) n;
            Vec2 point = new Vec2(from.x() + (target.x() - from.x()) * t, from.y() + (target.y() - from.y()) * t);
            if (isValidPosition(point, faction)) {
                return point;
            }
        }
        return from;
    }

    /**
     * Called when the next step would leave valid ground: steers the soul away from nearby enemy tiles,
     * or bounces it back if none is near.
     */
    public void pushAway(Soul soul) {
        int tileX = (int) Math.floor(soul.x() / tileMap.tileWidth());
        int tileY = (int) Math.floor(soul.y() / tileMap.tileHeight());
        Faction enemy = soul.faction().opponent();
        double pushX = 0;
        double pushY = 0;
        int enemyTiles = 0;
        for (int cy = Math.max(0, tileY - PUSH_RADIUS); cy <= Math.min(tileMap.rows() - 1, tileY + PUSH_RADIUS); cy++) {
            for (int cx = Math.max(0, tileX - PUSH_RADIUS); cx <= Math.min(tileMap.columns() - 1, tileX + PUSH_RADIUS); cx++) {
                if (tileMap.ownerAt(cx, cy) != enemy) {
                    continue;
                }
                double dx = soul.x() - tileMap.centerX(cx);
                double dy = soul.y() - tileMap.centerY(cy);
                double distance = Math.sqrt(dx * dx + dy * dy);
                if (distance > 0) {
                    double force = 100 / (distance + 10);
                    pushX += dx / distance * force;
                    pushY += dy / distance * force;
                    enemyTiles++;
                }
            }
        }
        double magnitude = Math.sqrt(pushX * pushX + pushY * pushY);
        if (enemyTiles > 0 && magnitude > 0) {
            double speed = movementSpeed * PUSH_SPEED_FACTOR;
            soul.setVelocity(pushX / magnitude * speed, pushY / magnitude * speed);
        } else {
            soul.setVelocity(soul.vx() * -0.8, soul.vy() * -0.8);
        }
    }

    /**
     * Clamps the soul into the world and reflects the velocity component that pointed outside.
     */
    public void enforceWorldBounds(Soul soul) {
        double buffer = worldSettings.boundaryBuffer();
        double maxX = worldSettings.width() - buffer;
        double maxY = worldSettings.height() - buffer;
        double x = soul.x();
        double y = soul.y();
        double vx = soul.vx();
        double vy = soul.vy();
        if (x < buffer || x > maxX) {
            vx = -vx;
            x = Math.max(buffer, Math.min(maxX, x));
        }
        if (y < buffer || y > maxY) {
            vy = -vy;
            y = Math.max(buffer, Math.min(maxY, y));
        }
        soul.setPosition(x, y);
        soul.setVelocity(vx, vy);
    }

    public TileMap tileMap() {
        return tileMap;
    }
}
