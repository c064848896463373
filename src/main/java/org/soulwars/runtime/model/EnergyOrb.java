package org.soulwars.runtime.model;

/**
 * Faction-scoped energy pickup. An orb is either available at its position or waiting for
 * {@link #respawnAt()}; it is never collectible while waiting.
 */
public final class EnergyOrb {

    private final OrbId id;
    private final Faction faction;
    private final double energyValue;
    private double x;
    private double y;
    private long respawnAt;

    public EnergyOrb(OrbId id, Faction faction, double energyValue, Vec2 position) {
        this.id = id;
        this.faction = faction;
        this.energyValue = energyValue;
        this.x = position.x();
        this.y = position.y();
    }

    public OrbId id() { return id; }
    public Faction faction() { return faction; }
    public double energyValue() { return energyValue; }
    public Vec2 position() { return new Vec2(x, y); }

    /**
     * @return the time at which a collected orb reappears, {@code 0} while the orb is available
     */
    public long respawnAt() { return respawnAt; }

    public boolean isAvailable() {
        return respawnAt == 0;
    }

    /**
     * @return true if the orb was collected and its respawn time has been reached
     */
    public boolean isDueForRespawn(long now) {
        return respawnAt > 0 && respawnAt <= now;
    }

    public void markCollected(long respawnTime) {
        this.respawnAt = Math.max(1, respawnTime);
    }

    public void respawnAt(Vec2 position) {
        this.x = position.x();
        this.y = position.y();
        this.respawnAt = 0;
    }
}
