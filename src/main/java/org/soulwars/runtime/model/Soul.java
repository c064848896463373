package org.soulwars.runtime.model;

import org.soulwars.runtime.spi.IRandomProvider;

/**
 * Mutable per-soul state. Souls are owned by the world and mutated in place by the systems during a tick.
 * <p>
 * Invariants:
 * <ul>
 *   <li>Energy is always clamped to {@code [0, maxEnergy]}. Energy reaching zero marks the soul dead.</li>
 *   <li>A dead soul takes no further part in behaviour, movement, combat or mating, starting with the tick it died in.</li>
 *   <li>{@link #isCasting()} and {@link #isPreparing()} are derived from {@link #state()}.</li>
 *   <li>Leaving a state clears the references that only make sense inside it (cast target, tracked enemy, mating partner, sleep).</li>
 * </ul>
 */
public final class Soul {

    /** Sentinel for "never happened" timestamps. */
    public static final long NEVER = Long.MIN_VALUE;

    private final SoulId id;
    private final Faction faction;
    private final double maxEnergy;
    private final IRandomProvider random;
    private final PositionHistory history;

    private double x;
    private double y;
    private double vx;
    private double vy;
    private double energy;

    private boolean adult;
    private final long bornAt;

    private SoulState state = SoulState.ROAMING;
    private SoulState previousState;
    private long stateEnteredAt;

    private long lastAttackAt = NEVER;
    private long lastAttackedAt = NEVER;
    private long lastCastAt;
    private long retreatUntil = NEVER;

    private TilePosition castTarget;
    private SoulId trackedEnemy;

    private SoulId matingPartner;
    private long matingStartedAt = NEVER;
    private boolean readyToCompleteMating;
    private long lastMatingAt = NEVER;

    private long sleepStartedAt = NEVER;
    private long lastSleepAt = NEVER;
    private boolean sleptThisCycle;

    private boolean dead;
    private String deathCause;
    private long deathStartedAt = NEVER;

    private Soul(Builder b) {
        this.id = b.id;
        this.faction = b.faction;
        this.maxEnergy = b.maxEnergy;
        this.random = b.random;
        this.history = new PositionHistory(b.historyCapacity);
        this.x = b.position.x();
        this.y = b.position.y();
        this.adult = b.adult;
        this.bornAt = b.bornAt;
        this.stateEnteredAt = b.bornAt;
        this.lastCastAt = b.bornAt;
        setEnergy(b.energy);
    }

    public static Builder builder(SoulId id, Faction faction) {
        return new Builder(id, faction);
    }

    // ==================== Identity & position ====================

    public SoulId id() { return id; }
    public Faction faction() { return faction; }
    public IRandomProvider random() { return random; }
    public PositionHistory positionHistory() { return history; }

    public double x() { return x; }
    public double y() { return y; }
    public double vx() { return vx; }
    public double vy() { return vy; }

    public Vec2 position() {
        return new Vec2(x, y);
    }

    public Vec2 velocity() {
        return new Vec2(vx, vy);
    }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setVelocity(double vx, double vy) {
        this.vx = vx;
        this.vy = vy;
    }

    public void setVelocity(Vec2 velocity) {
        setVelocity(velocity.x(), velocity.y());
    }

    public double distanceTo(Soul other) {
        return distanceTo(other.x, other.y);
    }

    public double distanceTo(double ox, double oy) {
        double dx = ox - x;
        double dy = oy - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public double distanceTo(Vec2 point) {
        return distanceTo(point.x(), point.y());
    }

    // ==================== Energy & life ====================

    public double energy() { return energy; }
    public double maxEnergy() { return maxEnergy; }

    public double energyFraction() {
        return energy / maxEnergy;
    }

    /**
     * Sets energy, clamped to {@code [0, maxEnergy]}. Reaching zero marks the soul dead.
     */
    public void setEnergy(double value) {
        this.energy = Math.max(0, Math.min(maxEnergy, value));
        if (this.energy <= 0) {
            kill("exhausted");
        }
    }

    public void addEnergy(double amount) {
        setEnergy(energy + amount);
    }

    public void drainEnergy(double amount) {
        setEnergy(energy - amount);
    }

    /**
     * Applies a hit: removes energy, records the hit time and starts retreating.
     */
    public void takeDamage(double amount, long now, long retreatDurationMs) {
        lastAttackedAt = now;
        retreatUntil = now + retreatDurationMs;
        if (energy - amount <= 0) {
            kill("combat");
        }
        drainEnergy(amount);
    }

    public boolean isAlive() {
        return !dead;
    }

    public boolean isDead() {
        return dead;
    }

    /**
     * Marks the soul dead without touching its energy (spell completion, disasters). The first cause sticks.
     *
     * @param cause short tag carried by the death event, e.g. {@code spell} or {@code disaster}
     */
    public void kill(String cause) {
        if (!dead) {
            this.dead = true;
            this.deathCause = cause;
        }
    }

    /**
     * @return why the soul died, {@code null} while alive
     */
    public String deathCause() {
        return deathCause;
    }

    public long deathStartedAt() { return deathStartedAt; }

    public boolean isDeathProcessed() {
        return deathStartedAt != NEVER;
    }

    public void markDeathProcessed(long now) {
        this.deathStartedAt = now;
    }

    // ==================== Age ====================

    public boolean isAdult() { return adult; }
    public boolean isChild() { return !adult; }
    public long bornAt() { return bornAt; }

    public void mature() {
        this.adult = true;
    }

    // ==================== State ====================

    public SoulState state() { return state; }
    public SoulState previousState() { return previousState; }
    public long stateEnteredAt() { return stateEnteredAt; }

    public long timeInState(long now) {
        return now - stateEnteredAt;
    }

    public boolean isInState(SoulState s) {
        return state == s;
    }

    public boolean isCasting() {
        return state.isCasting();
    }

    public boolean isPreparing() {
        return state.isPreparing();
    }

    public boolean isResting() {
        return state == SoulState.RESTING;
    }

    public boolean isMating() {
        return state == SoulState.MATING;
    }

    /**
     * Moves the soul into {@code next}, stamping the entry time and clearing references owned by the states being left.
     *
     * @return false if the soul already was in {@code next}
     */
    public boolean transitionTo(SoulState next, long now) {
        if (next == state) {
            return false;
        }
        previousState = state;
        state = next;
        stateEnteredAt = now;

        if (next == SoulState.CASTING) {
            lastCastAt = now;
        }
        if (!next.isChanneling()) {
            castTarget = null;
        }
        if (!next.isCombatState()) {
            trackedEnemy = null;
        }
        if (next != SoulState.MATING) {
            matingPartner = null;
            matingStartedAt = NEVER;
            readyToCompleteMating = false;
        }
        sleepStartedAt = next == SoulState.RESTING ? now : NEVER;
        return true;
    }

    // ==================== Spells & combat ====================

    public TilePosition castTarget() { return castTarget; }

    public void setCastTarget(TilePosition target) {
        this.castTarget = target;
    }

    public long lastCastAt() { return lastCastAt; }

    public SoulId trackedEnemy() { return trackedEnemy; }

    public void setTrackedEnemy(SoulId enemy) {
        this.trackedEnemy = enemy;
    }

    public long lastAttackAt() { return lastAttackAt; }
    public long lastAttackedAt() { return lastAttackedAt; }

    public void recordAttack(long now) {
        this.lastAttackAt = now;
    }

    public boolean isAttackOffCooldown(long now, long cooldownMs) {
        return lastAttackAt == NEVER || now - lastAttackAt >= cooldownMs;
    }

    public boolean isRetreating(long now) {
        return retreatUntil != NEVER && now < retreatUntil;
    }

    public long retreatUntil() { return retreatUntil; }

    // ==================== Mating ====================

    public SoulId matingPartner() { return matingPartner; }
    public long matingStartedAt() { return matingStartedAt; }
    public boolean isReadyToCompleteMating() { return readyToCompleteMating; }
    public long lastMatingAt() { return lastMatingAt; }

    public void beginMating(SoulId partner, long now) {
        transitionTo(SoulState.MATING, now);
        this.matingPartner = partner;
        this.matingStartedAt = now;
        this.readyToCompleteMating = false;
    }

    public void markReadyToCompleteMating() {
        this.readyToCompleteMating = true;
    }

    public void recordMating(long now) {
        this.lastMatingAt = now;
    }

    public boolean isMatingOffCooldown(long now, long cooldownMs) {
        return lastMatingAt == NEVER || now - lastMatingAt >= cooldownMs;
    }

    // ==================== Sleep ====================

    public long sleepStartedAt() { return sleepStartedAt; }
    public long lastSleepAt() { return lastSleepAt; }
    public boolean hasSleptThisCycle() { return sleptThisCycle; }

    public void recordSleep(long now) {
        this.lastSleepAt = now;
        this.sleptThisCycle = true;
    }

    public void resetSleepCycle() {
        this.sleptThisCycle = false;
    }

    public boolean isSleepOffCooldown(long now, long cooldownMs) {
        return lastSleepAt == NEVER || now - lastSleepAt >= cooldownMs;
    }

    /**
     * @return fraction of the sleep duration already slept, 0 when awake
     */
    public double sleepProgress(long now, long sleepDurationMs) {
        if (sleepStartedAt == NEVER || sleepDurationMs <= 0) {
            return 0;
        }
        return Math.min(1.0, (now - sleepStartedAt) / (double) sleepDurationMs);
    }

    @Override
    public String toString() {
        return id + "[" + faction.wireName() + ", " + state.wireName() + ", energy=" + String.format("%.1f", energy) + "]";
    }

    /**
     * Builder for new souls (initial spawn, offspring, emergency respawn and tests).
     */
    public static final class Builder {
        private final SoulId id;
        private final Faction faction;
        private Vec2 position = Vec2.ZERO;
        private double energy;
        private double maxEnergy = 100;
        private boolean adult = true;
        private long bornAt;
        private IRandomProvider random;
        private int historyCapacity = 30;

        private Builder(SoulId id, Faction faction) {
            this.id = id;
            this.faction = faction;
        }

        public Builder position(Vec2 position) { this.position = position; return this; }
        public Builder position(double x, double y) { this.position = new Vec2(x, y); return this; }
        public Builder energy(double energy) { this.energy = energy; return this; }
        public Builder maxEnergy(double maxEnergy) { this.maxEnergy = maxEnergy; return this; }
        public Builder adult(boolean adult) { this.adult = adult; return this; }
        public Builder bornAt(long bornAt) { this.bornAt = bornAt; return this; }
        public Builder random(IRandomProvider random) { this.random = random; return this; }
        public Builder historyCapacity(int capacity) { this.historyCapacity = capacity; return this; }

        public Soul build() {
            if (random == null) {
                throw new IllegalStateException("Soul " + id + " needs a random provider");
            }
            return new Soul(this);
        }
    }
}
