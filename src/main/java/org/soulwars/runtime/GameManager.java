package org.soulwars.runtime;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.internal.services.SeededRandomProvider;
import org.soulwars.runtime.model.ActiveSpell;
import org.soulwars.runtime.model.EnergyOrb;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.snapshot.NexusSnapshot;
import org.soulwars.runtime.snapshot.OrbSnapshot;
import org.soulwars.runtime.snapshot.SoulSnapshot;
import org.soulwars.runtime.snapshot.SpellSnapshot;
import org.soulwars.runtime.snapshot.WorldSnapshot;
import org.soulwars.runtime.spi.IClock;
import org.soulwars.runtime.spi.IRandomProvider;
import org.soulwars.runtime.systems.BuffManager;
import org.soulwars.runtime.systems.CombatSystem;
import org.soulwars.runtime.systems.DayNightSystem;
import org.soulwars.runtime.systems.DefenderSelector;
import org.soulwars.runtime.systems.DisasterEventSystem;
import org.soulwars.runtime.systems.MatingSystem;
import org.soulwars.runtime.systems.MovementSystem;
import org.soulwars.runtime.systems.NavigationFallback;
import org.soulwars.runtime.systems.OrbSystem;
import org.soulwars.runtime.systems.ScoringSystem;
import org.soulwars.runtime.systems.SoulStateMachine;
import org.soulwars.runtime.systems.SpellSystem;
import org.soulwars.runtime.systems.TerritoryGuard;
import org.soulwars.runtime.worldgen.SpawnLocator;
import org.soulwars.runtime.worldgen.WorldGenerator;

/**
 * Owns one world and advances it tick by tick.
 * <p>
 * Each {@link #tick()} runs the subsystems in a fixed order: per-soul state machine (after energy drain),
 * death cleanup, movement, spell start, combat, spell completion, mating, orbs, emergency repopulation,
 * disasters, day/night, buff expiry and nexus regeneration. It then emits one {@code soul_update} per
 * living soul and returns the drained events together with an immutable snapshot.
 * </p>
 * <p>
 * A failing step is logged and skipped; the tick always completes. Not thread-safe: a single thread
 * (the game loop) calls {@link #tick()}.
 * </p>
 */
public class GameManager {

    private static final Logger LOG = LoggerFactory.getLogger(GameManager.class);

    private final GameConfig config;
    private final IClock clock;
    private final World world;
    private final BuffManager buffs;
    private final ScoringSystem scoring;
    private final MovementSystem movement;
    private final SpellSystem spells;
    private final CombatSystem combat;
    private final MatingSystem mating;
    private final OrbSystem orbs;
    private final DayNightSystem dayNight;
    private final DisasterEventSystem disasters;
    private final SoulStateMachine stateMachine;
    private final SpawnLocator spawnLocator;
    private final IRandomProvider respawnRandom;

    private long tick;

    /**
     * Creates a world seeded from {@code game.loop.seed}.
     */
    public GameManager(GameConfig config, IClock clock) {
        this(config, clock, new SeededRandomProvider(config.loop().seed()));
    }

    /**
     * Generates the initial world and wires the subsystems.
     *
     * @throws IllegalArgumentException if a disaster plugin cannot be created or the nexus placement is invalid
     */
    public GameManager(GameConfig config, IClock clock, IRandomProvider random) {
        this.config = config;
        this.clock = clock;
        long now = clock.currentTimeMillis();

        this.world = new WorldGenerator(config, random).generate(now);
        this.buffs = new BuffManager(world.events());
        this.scoring = new ScoringSystem(world);
        TerritoryGuard guard = new TerritoryGuard(config, world.tileMap());
        this.movement = new MovementSystem(world, scoring, buffs, guard, new NavigationFallback(config, guard));
        DefenderSelector defenders = new DefenderSelector(world);
        this.spells = new SpellSystem(world, buffs, defenders);
        this.combat = new CombatSystem(world, spells, buffs);
        this.mating = new MatingSystem(world);
        this.orbs = new OrbSystem(world, buffs);
        this.dayNight = new DayNightSystem(world, buffs, now);
        this.disasters = new DisasterEventSystem(world, buffs, now);
        this.stateMachine = new SoulStateMachine(world, scoring, defenders, spells, mating, dayNight);
        this.spawnLocator = new SpawnLocator(guard, config.spawn().spawnRadius());
        this.respawnRandom = random.deriveFor("respawn", 0);

        orbs.spawnInitialOrbs();
        LOG.info("World created: {}x{} tiles, {} souls, {} disaster types", world.tileMap().columns(),
            world.tileMap().rows(), world.soulCount(), disasters.disasters().size());
    }

    /**
     * Advances the world to the clock's current time.
     *
     * @return the events of this tick (including any buffered since construction) and the end-of-tick snapshot
     */
    public TickResult tick() {
        long now = clock.currentTimeMillis();
        tick++;

        runStep("state machine", () -> updateSouls(now));
        runStep("death cleanup", () -> cleanupDeaths(now));
        runStep("movement", () -> movement.update(now));
        runStep("spell start", () -> spells.update(now));
        runStep("combat", () -> combat.update(now));
        runStep("spell completion", () -> spells.completeSpells(now));
        runStep("mating", () -> mating.update(now));
        runStep("orbs", () -> orbs.update(now));
        runStep("emergency respawn", () -> emergencyRespawn(now));
        runStep("disasters", () -> disasters.update(now));
        runStep("day/night", () -> dayNight.tick(now));
        runStep("buff expiry", () -> buffs.expire(now));
        runStep("nexus regeneration", () -> regenerateNexuses(now));
        runStep("soul updates", () -> emitSoulUpdates(now));

        return new TickResult(tick, now, world.events().drain(), snapshot(now));
    }

    private void runStep(String name, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            LOG.warn("Step '{}' failed at tick {}, continuing", name, tick, e);
        }
    }

    private void updateSouls(long now) {
        GameConfig.SoulSettings settings = config.soul();
        for (Soul soul : world.soulList()) {
            if (soul.isDead()) {
                continue;
            }
            if (!soul.isResting() && soul.random().nextDouble() < settings.energyDrainChance()) {
                soul.drainEnergy(settings.energyDrainAmount());
            }
            stateMachine.update(soul, now);
        }
    }

    /**
     * Two phases: a newly dead soul loses its spell and pairing and is reported once; after the grace
     * period it is removed from the world.
     */
    private void cleanupDeaths(long now) {
        for (Soul soul : world.soulList()) {
            if (soul.isAlive()) {
                continue;
            }
            if (!soul.isDeathProcessed()) {
                soul.markDeathProcessed(now);
                spells.handleSoulDeath(soul, now);
                if (soul.isMating()) {
                    mating.cancel(soul, MatingSystem.REASON_PARTNER_LOST, now);
                }
                world.events().emit(new GameEvent.SoulDied(soul.id(), soul.faction(), soul.x(), soul.y(),
                    soul.deathCause()));
                LOG.debug("{} died ({})", soul.id(), soul.deathCause());
            } else if (now - soul.deathStartedAt() >= config.soul().deathGracePeriodMs()) {
                world.removeSoul(soul.id());
                mating.forget(soul.id());
                world.events().emit(new GameEvent.SoulRemoved(soul.id(), soul.faction()));
            }
        }
    }

    private void emergencyRespawn(long now) {
        for (Faction faction : Faction.values()) {
            Nexus nexus = world.nexus(faction);
            if (nexus == null || nexus.isDestroyed() || world.countLivingAdults(faction) > 0) {
                continue;
            }
            double energy = respawnRandom.nextDouble(config.soul().startEnergyMin(), config.soul().startEnergyMax());
            Soul soul = world.spawnSoul(faction, spawnLocator.near(nexus, respawnRandom), energy, true, now);
            world.events().emit(new GameEvent.SoulSpawned(SoulSnapshot.of(soul, now, config.sleep().durationMs())));
            world.events().emit(new GameEvent.EmergencyRespawn(faction, soul.id()));
            LOG.info("Faction {} had no adults left, spawned {} at its nexus", faction.wireName(), soul.id());
        }
    }

    private void regenerateNexuses(long now) {
        GameConfig.NexusSettings settings = config.nexus();
        for (Nexus nexus : world.nexuses()) {
            if (nexus.regenerate(now, settings.regenAmount(), settings.regenIntervalMs())) {
                world.events().emit(new GameEvent.NexusUpdated(nexus.faction(), nexus.health(), nexus.maxHealth(), null));
            }
        }
    }

    private void emitSoulUpdates(long now) {
        long sleepDuration = config.sleep().durationMs();
        for (Soul soul : world.livingSouls()) {
            world.events().emit(new GameEvent.SoulUpdated(SoulSnapshot.of(soul, now, sleepDuration)));
        }
    }

    /**
     * @return an immutable picture of the current world
     */
    public WorldSnapshot snapshot(long now) {
        long sleepDuration = config.sleep().durationMs();
        List<SoulSnapshot> souls = new ArrayList<>(world.soulCount());
        for (Soul soul : world.souls()) {
            souls.add(SoulSnapshot.of(soul, now, sleepDuration));
        }
        List<OrbSnapshot> orbSnapshots = new ArrayList<>();
        for (EnergyOrb orb : world.orbs().values()) {
            orbSnapshots.add(OrbSnapshot.of(orb));
        }
        List<SpellSnapshot> spellSnapshots = new ArrayList<>();
        for (ActiveSpell spell : world.spells().values()) {
            spellSnapshots.add(SpellSnapshot.of(spell, now));
        }
        List<NexusSnapshot> nexusSnapshots = new ArrayList<>();
        for (Nexus nexus : world.nexuses()) {
            nexusSnapshots.add(NexusSnapshot.of(nexus));
        }
        return new WorldSnapshot(
            tick,
            now,
            config.world().width(),
            config.world().height(),
            world.tileMap().columns(),
            world.tileMap().rows(),
            world.tileMap().tileWidth(),
            world.tileMap().tileHeight(),
            world.tileMap().encodeRows(),
            souls,
            orbSnapshots,
            spellSnapshots,
            nexusSnapshots,
            world.craters(),
            buffs.activeBuffs(),
            dayNight.phase(),
            dayNight.ambientLight(),
            disasters.activeDisasterName());
    }

    public long currentTick() {
        return tick;
    }

    public GameConfig config() {
        return config;
    }

    public World world() {
        return world;
    }

    public BuffManager buffs() {
        return buffs;
    }

    public ScoringSystem scoring() {
        return scoring;
    }

    public SpellSystem spells() {
        return spells;
    }

    public MatingSystem mating() {
        return mating;
    }

    public DayNightSystem dayNight() {
        return dayNight;
    }

    public DisasterEventSystem disasters() {
        return disasters;
    }
}
