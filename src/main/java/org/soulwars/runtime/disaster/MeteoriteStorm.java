package org.soulwars.runtime.disaster;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.Crater;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.Vec2;
import org.soulwars.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * A meteorite storm: {@code meteoriteCount} meteorites cross the sky, exactly one of them strikes the map
 * at a point that keeps {@code nexusClearance} to both nexuses and leaves a permanent crater once
 * {@code impactDelayMs} have passed. Souls die in {@code impactWaves} waves, one every {@code waveIntervalMs},
 * each taking {@code floor(populationAtStart * deathPercentage / impactWaves)} souls.
 * <p>
 * The trajectories are part of the {@code disaster_start} payload so observers can animate them.
 * </p>
 */
public class MeteoriteStorm extends AbstractDisaster {

    private static final Logger LOG = LoggerFactory.getLogger(MeteoriteStorm.class);

    public static final String NAME = "meteorite_storm";
    private static final int TARGET_ATTEMPTS = 100;
    private static final double MAP_MARGIN = 100;

    /** One meteorite's flight path in world units. */
    public record Trajectory(int id, Vec2 start, Vec2 target, boolean hitsMap) {}

    private final int impactWaves;
    private final long waveIntervalMillis;
    private final int meteoriteCount;
    private final long impactDelayMillis;
    private final double craterMinSize;
    private final double craterMaxSize;
    private final double nexusClearance;

    private final List<Trajectory> trajectories = new ArrayList<>();
    private int perWave;
    private int wavesDone;
    private boolean impacted;

    public MeteoriteStorm(IRandomProvider random, Config options) {
        super(random, options);
        this.impactWaves = Math.max(1, options.getInt("impactWaves"));
        this.waveIntervalMillis = options.getLong("waveIntervalMs");
        this.meteoriteCount = Math.max(1, options.hasPath("meteoriteCount") ? options.getInt("meteoriteCount") : 5);
        this.impactDelayMillis = options.hasPath("impactDelayMs") ? options.getLong("impactDelayMs") : 2500L;
        this.craterMinSize = options.hasPath("craterMinSize") ? options.getDouble("craterMinSize") : 30;
        this.craterMaxSize = options.hasPath("craterMaxSize") ? options.getDouble("craterMaxSize") : 50;
        this.nexusClearance = options.hasPath("nexusClearance") ? options.getDouble("nexusClearance") : 100;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> begin(DisasterContext context) {
        resetOccurrence(context);
        perWave = (int) Math.floor(populationAtStart * deathPercentage / impactWaves);
        wavesDone = 0;
        impacted = false;
        planTrajectories(context.world());

        List<Map<String, Object>> meteorites = new ArrayList<>();
        for (Trajectory trajectory : trajectories) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", trajectory.id());
            entry.put("startX", trajectory.start().x());
            entry.put("startY", trajectory.start().y());
            entry.put("targetX", trajectory.target().x());
            entry.put("targetY", trajectory.target().y());
            entry.put("willHitMap", trajectory.hitsMap());
            meteorites.add(entry);
        }
        LOG.debug("Meteorite storm puts {} souls at risk, {} per wave", populationAtStart, perWave);
        return Map.of("meteorites", meteorites, "impactWaves", impactWaves);
    }

    private void planTrajectories(World world) {
        trajectories.clear();
        double width = world.config().world().width();
        double height = world.config().world().height();
        for (int i = 0; i < meteoriteCount; i++) {
            Vec2 start = new Vec2(
                width + 100 + i * 150 + random.nextDouble() * 100,
                -100 - i * 80 - random.nextDouble() * 100);
            boolean hitsMap = i == 0;
            Vec2 target = hitsMap ? impactPoint(world, width, height) : new Vec2(-500, height + 500);
            trajectories.add(new Trajectory(i, start, target, hitsMap));
        }
    }

    private Vec2 impactPoint(World world, double width, double height) {
        Vec2 candidate = null;
        for (int attempt = 0; attempt < TARGET_ATTEMPTS; attempt++) {
            candidate = new Vec2(
                random.nextDouble(MAP_MARGIN, Math.max(MAP_MARGIN, width - MAP_MARGIN)),
                random.nextDouble(MAP_MARGIN, Math.max(MAP_MARGIN, height - MAP_MARGIN)));
            if (isClearOfNexuses(world, candidate)) {
                return candidate;
            }
        }
        LOG.debug("No impact point clear of both nexuses found, using {}", candidate);
        return candidate;
    }

    private boolean isClearOfNexuses(World world, Vec2 point) {
        for (Nexus nexus : world.nexuses()) {
            if (nexus.position().distanceTo(point) <= nexusClearance) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void tick(DisasterContext context) {
        if (!impacted && context.elapsed() >= impactDelayMillis) {
            impacted = true;
            for (Trajectory trajectory : trajectories) {
                if (trajectory.hitsMap()) {
                    Crater crater = new Crater(trajectory.target().x(), trajectory.target().y(),
                        random.nextDouble(craterMinSize, craterMaxSize), context.now());
                    context.world().addCrater(crater);
                    context.events().emit(new GameEvent.MeteoriteImpact(crater.x(), crater.y(), crater.size()));
                    LOG.debug("Meteorite impact at ({}, {})", Math.round(crater.x()), Math.round(crater.y()));
                }
            }
        }

        int wave = (int) Math.min(impactWaves, context.elapsed() / Math.max(1, waveIntervalMillis));
        if (wave > wavesDone) {
            wavesDone = wave;
            int victims = killUpTo(context, wave * perWave);
            LOG.debug("Meteorite wave {} killed {} souls ({} so far)", wave, victims, killed);
        }
    }

    @Override
    public void end(DisasterContext context) {
        trajectories.clear();
    }

    /**
     * @return the trajectories of the current occurrence
     */
    public List<Trajectory> trajectories() {
        return List.copyOf(trajectories);
    }
}
