package org.soulwars.runtime.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable tunables of one game world, read from the {@code game} block of the HOCON configuration.
 * <p>
 * A single instance is created at startup and handed by reference to every subsystem constructor.
 * Nothing in the simulation mutates it, so several worlds with different tunables can coexist
 * (e.g. parallel test instances).
 * </p>
 * <p>
 * All durations are milliseconds, all distances world units unless the name says tiles.
 * </p>
 */
public final class GameConfig {

    /** World dimensions in world units. */
    public record WorldSettings(double width, double height, double boundaryBuffer) {}

    /** Tile grid size and tile extent in world units. */
    public record TileMapSettings(int columns, int rows, double tileWidth, double tileHeight) {}

    /** Per-soul energy, timing, combat and spell tunables. */
    public record SoulSettings(
        double maxEnergy,
        double startEnergyMin,
        double startEnergyMax,
        double movementSpeed,
        double defendSpeedMultiplier,
        double hungryThreshold,
        double castEnergyCost,
        double minEnergyToCast,
        long stateTimeoutMs,
        long seekingTimeoutMs,
        double seekingFallbackFraction,
        double attackRange,
        long attackCooldownMs,
        double attackDamageMin,
        double attackDamageMax,
        long spellCooldownMs,
        double spellRange,
        double spellMinDistance,
        long spellCastTimeMs,
        long spellPreparationTimeMs,
        int captureRadius,
        long deathGracePeriodMs,
        double energyDrainChance,
        double energyDrainAmount) {}

    /** Behaviour of a soul after it has been hit. */
    public record RetreatSettings(double threshold, double forceDistance, long durationMs) {}

    /** Collision, wandering and navigation fallback tunables. */
    public record MovementSettings(
        double collisionRadius,
        double separationForce,
        double wanderForce,
        int stuckWindowTicks,
        double stuckDistance,
        int pathSamples,
        int escapeAttempts,
        double escapeMaxRadius) {}

    /** Border buffer zone: minimum distance to enemy tile centres, searched within {@code checkRadius} tiles. */
    public record TerritorySettings(double barrierDistance, int checkRadius, double borderBand) {}

    /** Energy orb placement, value and respawn timing. */
    public record OrbSettings(
        int perTeam,
        double energyValue,
        long respawnMinMs,
        long respawnMaxMs,
        double collectionRadius,
        double spawnOffsetX,
        double spawnOffsetY,
        int edgeBuffer,
        int enemyClearance) {}

    /** Initial population. */
    public record SpawnSettings(int soulsPerTeam, double spawnRadius) {}

    /** Reproduction tunables. */
    public record MatingSettings(
        int minRestingSouls,
        int maxSoulsPerTeam,
        double minEnergy,
        double range,
        long durationMs,
        long cooldownMs,
        long childMaturityMs,
        long pairingIntervalMs,
        double childEnergy) {}

    /** Nexus footprint, health and tile placement of both factions' nexus. */
    public record NexusSettings(
        int size,
        double maxHealth,
        double regenAmount,
        long regenIntervalMs,
        int lightTileX,
        int lightTileY,
        int darkTileX,
        int darkTileY) {}

    /** Day/night cycle shape and the buffs granted to the favoured faction. */
    public record DayNightSettings(
        boolean enabled,
        long cycleDurationMs,
        double dayFraction,
        double transitionFraction,
        double nightFraction,
        double dayAmbientLight,
        double nightAmbientLight,
        double speedMultiplier,
        double castTimeMultiplier,
        double energyMultiplier) {}

    /** Resting (sleep) tunables. Energy bounds are fractions of max energy. */
    public record SleepSettings(
        boolean enabled,
        long durationMs,
        double energyRecovery,
        double minEnergy,
        double maxEnergy,
        long cooldownMs) {}

    /** One configured plugin: class name plus its options block. */
    public record PluginSpec(String className, Config options) {}

    /** Disaster roll cadence and the configured disaster plugins, in roll order. */
    public record DisasterSettings(long checkIntervalMs, List<PluginSpec> types) {}

    /** Tick cadence, snapshot cadence and world seed. */
    public record LoopSettings(long frameMillis, long worldSyncIntervalMs, long seed) {}

    private final WorldSettings world;
    private final TileMapSettings tileMap;
    private final SoulSettings soul;
    private final RetreatSettings retreat;
    private final MovementSettings movement;
    private final TerritorySettings territory;
    private final OrbSettings orb;
    private final SpawnSettings spawn;
    private final MatingSettings mating;
    private final NexusSettings nexus;
    private final DayNightSettings dayNight;
    private final SleepSettings sleep;
    private final DisasterSettings disasters;
    private final LoopSettings loop;

    private GameConfig(Config game) {
        Config w = game.getConfig("world");
        this.world = new WorldSettings(w.getDouble("width"), w.getDouble("height"), w.getDouble("boundaryBuffer"));

        Config t = game.getConfig("tileMap");
        this.tileMap = new TileMapSettings(t.getInt("columns"), t.getInt("rows"),
            t.getDouble("tileWidth"), t.getDouble("tileHeight"));

        Config s = game.getConfig("soul");
        this.soul = new SoulSettings(
            s.getDouble("maxEnergy"),
            s.getDouble("startEnergyMin"),
            s.getDouble("startEnergyMax"),
            s.getDouble("movementSpeed"),
            s.getDouble("defendSpeedMultiplier"),
            s.getDouble("hungryThreshold"),
            s.getDouble("castEnergyCost"),
            s.getDouble("minEnergyToCast"),
            s.getLong("stateTimeoutMs"),
            s.getLong("seekingTimeoutMs"),
            s.getDouble("seekingFallbackFraction"),
            s.getDouble("attackRange"),
            s.getLong("attackCooldownMs"),
            s.getDouble("attackDamageMin"),
            s.getDouble("attackDamageMax"),
            s.getLong("spellCooldownMs"),
            s.getDouble("spellRange"),
            s.getDouble("spellMinDistance"),
            s.getLong("spellCastTimeMs"),
            s.getLong("spellPreparationTimeMs"),
            s.getInt("captureRadius"),
            s.getLong("deathGracePeriodMs"),
            s.getDouble("energyDrainChance"),
            s.getDouble("energyDrainAmount"));

        Config r = game.getConfig("retreat");
        this.retreat = new RetreatSettings(r.getDouble("threshold"), r.getDouble("forceDistance"), r.getLong("durationMs"));

        Config m = game.getConfig("movement");
        this.movement = new MovementSettings(
            m.getDouble("collisionRadius"),
            m.getDouble("separationForce"),
            m.getDouble("wanderForce"),
            m.getInt("stuckWindowTicks"),
            m.getDouble("stuckDistance"),
            m.getInt("pathSamples"),
            m.getInt("escapeAttempts"),
            m.getDouble("escapeMaxRadius"));

        Config ter = game.getConfig("territory");
        this.territory = new TerritorySettings(ter.getDouble("barrierDistance"), ter.getInt("checkRadius"),
            ter.getDouble("borderBand"));

        Config o = game.getConfig("orb");
        this.orb = new OrbSettings(
            o.getInt("perTeam"),
            o.getDouble("energyValue"),
            o.getLong("respawnMinMs"),
            o.getLong("respawnMaxMs"),
            o.getDouble("collectionRadius"),
            o.getDouble("spawnOffsetX"),
            o.getDouble("spawnOffsetY"),
            o.getInt("edgeBuffer"),
            o.getInt("enemyClearance"));

        Config sp = game.getConfig("spawn");
        this.spawn = new SpawnSettings(sp.getInt("soulsPerTeam"), sp.getDouble("spawnRadius"));

        Config ma = game.getConfig("mating");
        this.mating = new MatingSettings(
            ma.getInt("minRestingSouls"),
            ma.getInt("maxSoulsPerTeam"),
            ma.getDouble("minEnergy"),
            ma.getDouble("range"),
            ma.getLong("durationMs"),
            ma.getLong("cooldownMs"),
            ma.getLong("childMaturityMs"),
            ma.getLong("pairingIntervalMs"),
            ma.getDouble("childEnergy"));

        Config n = game.getConfig("nexus");
        this.nexus = new NexusSettings(
            n.getInt("size"),
            n.getDouble("maxHealth"),
            n.getDouble("regenAmount"),
            n.getLong("regenIntervalMs"),
            n.getInt("light.tileX"),
            n.getInt("light.tileY"),
            n.getInt("dark.tileX"),
            n.getInt("dark.tileY"));

        Config d = game.getConfig("dayNight");
        this.dayNight = new DayNightSettings(
            d.getBoolean("enabled"),
            d.getLong("cycleDurationMs"),
            d.getDouble("dayFraction"),
            d.getDouble("transitionFraction"),
            d.getDouble("nightFraction"),
            d.getDouble("dayAmbientLight"),
            d.getDouble("nightAmbientLight"),
            d.getDouble("speedMultiplier"),
            d.getDouble("castTimeMultiplier"),
            d.getDouble("energyMultiplier"));

        Config sl = game.getConfig("sleep");
        this.sleep = new SleepSettings(
            sl.getBoolean("enabled"),
            sl.getLong("durationMs"),
            sl.getDouble("energyRecovery"),
            sl.getDouble("minEnergy"),
            sl.getDouble("maxEnergy"),
            sl.getLong("cooldownMs"));

        Config ds = game.getConfig("disasters");
        List<PluginSpec> specs = new ArrayList<>();
        for (Config entry : ds.getConfigList("types")) {
            Config options = entry.hasPath("options") ? entry.getConfig("options") : ConfigFactory.empty();
            specs.add(new PluginSpec(entry.getString("className"), options));
        }
        this.disasters = new DisasterSettings(ds.getLong("checkIntervalMs"), Collections.unmodifiableList(specs));

        Config l = game.getConfig("loop");
        this.loop = new LoopSettings(l.getLong("frameMillis"), l.getLong("worldSyncIntervalMs"), l.getLong("seed"));

        validate();
    }

    /**
     * Builds the configuration from a {@code game} block.
     *
     * @param game the {@code game} sub-config (resolved)
     * @return the validated configuration
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type
     * @throws IllegalArgumentException if a value violates a world invariant (e.g. zero-sized map)
     */
    public static GameConfig fromConfig(Config game) {
        return new GameConfig(game);
    }

    /**
     * Builds the configuration from an application root config that contains a {@code game} block.
     *
     * @param root the resolved application configuration
     * @return the validated configuration
     */
    public static GameConfig fromRoot(Config root) {
        return fromConfig(root.getConfig("game"));
    }

    /**
     * @return the configuration defined by {@code reference.conf} on the classpath
     */
    public static GameConfig defaults() {
        return fromRoot(ConfigFactory.defaultReference());
    }

    private void validate() {
        require(world.width() > 0 && world.height() > 0, "world size must be positive");
        require(world.boundaryBuffer() >= 0 && world.boundaryBuffer() * 2 < Math.min(world.width(), world.height()),
            "world.boundaryBuffer must leave a playable area");
        require(tileMap.columns() > 0 && tileMap.rows() > 0, "tile map must have at least one column and row");
        require(tileMap.tileWidth() > 0 && tileMap.tileHeight() > 0, "tile size must be positive");
        require(soul.maxEnergy() > 0, "soul.maxEnergy must be positive");
        require(soul.startEnergyMin() <= soul.startEnergyMax(), "soul.startEnergyMin must not exceed startEnergyMax");
        require(soul.startEnergyMax() <= soul.maxEnergy(), "soul.startEnergyMax must not exceed maxEnergy");
        require(soul.attackDamageMin() <= soul.attackDamageMax(), "soul.attackDamageMin must not exceed attackDamageMax");
        require(soul.captureRadius() >= 0, "soul.captureRadius must not be negative");
        requireFraction(soul.hungryThreshold(), "soul.hungryThreshold");
        requireFraction(soul.castEnergyCost(), "soul.castEnergyCost");
        requireFraction(soul.seekingFallbackFraction(), "soul.seekingFallbackFraction");
        requireFraction(soul.energyDrainChance(), "soul.energyDrainChance");
        require(orb.respawnMinMs() <= orb.respawnMaxMs(), "orb.respawnMinMs must not exceed respawnMaxMs");
        require(mating.minRestingSouls() >= 0, "mating.minRestingSouls must not be negative");
        require(mating.maxSoulsPerTeam() > 0, "mating.maxSoulsPerTeam must be positive");
        requireFraction(mating.minEnergy(), "mating.minEnergy");
        require(nexus.size() > 0, "nexus.size must be positive");
        require(nexus.maxHealth() > 0, "nexus.maxHealth must be positive");
        requireTile(nexus.lightTileX(), nexus.lightTileY(), "nexus.light");
        requireTile(nexus.darkTileX(), nexus.darkTileY(), "nexus.dark");
        require(dayNight.cycleDurationMs() > 0, "dayNight.cycleDurationMs must be positive");
        double fractions = dayNight.dayFraction() + dayNight.nightFraction() + 2 * dayNight.transitionFraction();
        require(Math.abs(fractions - 1.0) < 1e-6, "dayNight fractions (day + night + 2 * transition) must sum to 1");
        requireFraction(sleep.minEnergy(), "sleep.minEnergy");
        requireFraction(sleep.maxEnergy(), "sleep.maxEnergy");
        require(disasters.checkIntervalMs() > 0, "disasters.checkIntervalMs must be positive");
        require(loop.frameMillis() > 0, "loop.frameMillis must be positive");
    }

    private void requireTile(int x, int y, String name) {
        require(x >= 0 && x < tileMap.columns() && y >= 0 && y < tileMap.rows(),
            name + " (" + x + "," + y + ") lies outside the tile map");
    }

    private static void requireFraction(double value, String name) {
        require(value >= 0.0 && value <= 1.0, name + " must be within [0, 1] but was " + value);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid game configuration: " + message);
        }
    }

    public WorldSettings world() { return world; }
    public TileMapSettings tileMap() { return tileMap; }
    public SoulSettings soul() { return soul; }
    public RetreatSettings retreat() { return retreat; }
    public MovementSettings movement() { return movement; }
    public TerritorySettings territory() { return territory; }
    public OrbSettings orb() { return orb; }
    public SpawnSettings spawn() { return spawn; }
    public MatingSettings mating() { return mating; }
    public NexusSettings nexus() { return nexus; }
    public DayNightSettings dayNight() { return dayNight; }
    public SleepSettings sleep() { return sleep; }
    public DisasterSettings disasters() { return disasters; }
    public LoopSettings loop() { return loop; }
}
