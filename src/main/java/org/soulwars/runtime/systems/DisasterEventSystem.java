package org.soulwars.runtime.systems;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.disaster.DisasterContext;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.spi.IDisaster;
import org.soulwars.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Rolls and runs global disasters.
 * <p>
 * Every {@code checkInterval} ms, and only while no disaster is active, the configured plugins are rolled in
 * order: a plugin qualifies when it is enabled and its cooldown since the last disaster of any kind has passed,
 * and then starts with its trigger chance. The first plugin that starts wins the roll. At most one disaster
 * is active at a time. A disaster whose tick throws is ended on the spot.
 * </p>
 */
public final class DisasterEventSystem {

    private static final Logger LOG = LoggerFactory.getLogger(DisasterEventSystem.class);

    private final World world;
    private final BuffManager buffs;
    private final long checkIntervalMillis;
    private final List<IDisaster> disasters;
    private final IRandomProvider rollRandom;

    private long lastCheckAt;
    private long lastDisasterAt = Long.MIN_VALUE;
    private IDisaster active;
    private long activeSince;

    /**
     * Instantiates the configured disaster plugins.
     *
     * @throws IllegalArgumentException if a plugin class cannot be instantiated
     */
    public DisasterEventSystem(World world, BuffManager buffs, long createdAt) {
        this(world, buffs, createdAt, loadPlugins(world.config().disasters().types(), world.random()));
    }

    public DisasterEventSystem(World world, BuffManager buffs, long createdAt, List<IDisaster> disasters) {
        this.world = world;
        this.buffs = buffs;
        this.checkIntervalMillis = world.config().disasters().checkIntervalMs();
        this.disasters = List.copyOf(disasters);
        this.rollRandom = world.random().deriveFor("disaster-roll", 0);
        this.lastCheckAt = createdAt;
    }

    /**
     * Creates one plugin per configured entry through its {@code (IRandomProvider, Config)} constructor.
     * Each plugin gets its own random stream derived from its position in the list.
     */
    static List<IDisaster> loadPlugins(List<GameConfig.PluginSpec> specs, IRandomProvider random) {
        List<IDisaster> plugins = new ArrayList<>();
        for (int i = 0; i < specs.size(); i++) {
            GameConfig.PluginSpec spec = specs.get(i);
            try {
                Object plugin = Class.forName(spec.className())
                    .getConstructor(IRandomProvider.class, Config.class)
                    .newInstance(random.deriveFor("disaster", i), spec.options());
                if (!(plugin instanceof IDisaster disaster)) {
                    throw new IllegalArgumentException("Plugin " + spec.className() + " does not implement IDisaster");
                }
                plugins.add(disaster);
            } catch (ReflectiveOperationException e) {
                throw new IllegalArgumentException("Failed to instantiate disaster plugin: " + spec.className(), e);
            }
        }
        return Collections.unmodifiableList(plugins);
    }

    public void update(long now) {
        if (active == null && now - lastCheckAt >= checkIntervalMillis) {
            lastCheckAt = now;
            roll(now);
        }
        if (active == null) {
            return;
        }
        DisasterContext context = new DisasterContext(world, buffs, now, activeSince, active.durationMillis());
        try {
            active.tick(context);
        } catch (RuntimeException e) {
            LOG.warn("Disaster {} failed during its tick, ending it early", active.name(), e);
            finish(context);
            return;
        }
        if (now - activeSince >= active.durationMillis()) {
            finish(context);
        }
    }

    private void finish(DisasterContext context) {
        IDisaster ending = active;
        active = null;
        ending.end(context);
        world.events().emit(new GameEvent.DisasterEnded(ending.name(), ending.victims()));
        LOG.info("Disaster {} ended after killing {} souls", ending.name(), ending.victims());
    }

    private void roll(long now) {
        for (IDisaster disaster : disasters) {
            if (!disaster.isEnabled() || !isCooledDown(disaster, now)) {
                continue;
            }
            if (rollRandom.nextDouble() < disaster.triggerChance()) {
                start(disaster, now);
                return;
            }
        }
    }

    private boolean isCooledDown(IDisaster disaster, long now) {
        return lastDisasterAt == Long.MIN_VALUE || now - lastDisasterAt >= disaster.cooldownMillis();
    }

    /**
     * Starts {@code disaster} immediately, bypassing the roll. Ignored while another disaster is active.
     *
     * @return true if the disaster was started
     */
    public boolean start(IDisaster disaster, long now) {
        if (active != null) {
            return false;
        }
        active = disaster;
        activeSince = now;
        lastDisasterAt = now;
        DisasterContext context = new DisasterContext(world, buffs, now, now, disaster.durationMillis());
        world.events().emit(new GameEvent.DisasterStarted(disaster.name(), disaster.durationMillis(),
            disaster.begin(context)));
        LOG.info("Disaster {} started for {} ms", disaster.name(), disaster.durationMillis());
        return true;
    }

    public boolean isActive() {
        return active != null;
    }

    /**
     * @return the wire name of the active disaster, or {@code null} if none is active
     */
    public String activeDisasterName() {
        return active == null ? null : active.name();
    }

    public List<IDisaster> disasters() {
        return disasters;
    }
}
