package org.soulwars.runtime.model;

import org.soulwars.runtime.spi.IRandomProvider;

/**
 * A faction's home objective: spawn point of its souls and a destructible target for the enemy.
 * <p>
 * Health never drops below zero. Once destroyed the nexus stays inactive for the rest of the world's
 * lifetime: it no longer regenerates, can no longer be damaged and spawns no emergency souls.
 * </p>
 */
public final class Nexus {

    private final Faction faction;
    private final TilePosition tile;
    private final Vec2 position;
    private final int size;
    private final double maxHealth;
    private double health;
    private long lastRegenAt;
    private boolean destroyed;

    public Nexus(Faction faction, TilePosition tile, Vec2 position, int size, double maxHealth, long createdAt) {
        this.faction = faction;
        this.tile = tile;
        this.position = position;
        this.size = size;
        this.maxHealth = maxHealth;
        this.health = maxHealth;
        this.lastRegenAt = createdAt;
    }

    public Faction faction() { return faction; }
    public TilePosition tile() { return tile; }
    public Vec2 position() { return position; }
    public int size() { return size; }
    public double maxHealth() { return maxHealth; }
    public double health() { return health; }
    public boolean isDestroyed() { return destroyed; }

    private int left() { return tile.x() - size / 2; }
    private int right() { return tile.x() + size / 2 - 1; }
    private int top() { return tile.y() - size / 2; }
    private int bottom() { return tile.y() + size / 2 - 1; }

    /**
     * @return true if the tile lies inside this nexus' square footprint
     */
    public boolean occupies(int x, int y) {
        return x >= left() && x <= right() && y >= top() && y <= bottom();
    }

    /**
     * @return Manhattan distance in tiles from {@code (x, y)} to the closest footprint tile (0 inside)
     */
    public int manhattanToFootprint(int x, int y) {
        int closestX = Math.max(left(), Math.min(right(), x));
        int closestY = Math.max(top(), Math.min(bottom(), y));
        return Math.abs(x - closestX) + Math.abs(y - closestY);
    }

    /**
     * Applies damage.
     *
     * @param amount damage, non-negative
     * @return true if this hit destroyed the nexus
     */
    public boolean takeDamage(double amount) {
        if (destroyed) {
            return false;
        }
        health = Math.max(0, health - amount);
        if (health <= 0) {
            destroyed = true;
            return true;
        }
        return false;
    }

    /**
     * Regenerates {@code amount} health once per {@code intervalMs}.
     *
     * @return true if health changed
     */
    public boolean regenerate(long now, double amount, long intervalMs) {
        if (destroyed || now - lastRegenAt < intervalMs) {
            return false;
        }
        lastRegenAt = now;
        if (health >= maxHealth) {
            return false;
        }
        health = Math.min(maxHealth, health + amount);
        return true;
    }

    /**
     * @return a point scattered uniformly in a square of {@code spread} around the nexus centre
     */
    public Vec2 spawnPosition(IRandomProvider random, double spread) {
        return new Vec2(
            position.x() + (random.nextDouble() - 0.5) * spread,
            position.y() + (random.nextDouble() - 0.5) * spread);
    }
}
