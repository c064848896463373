package org.soulwars.runtime.disaster;

import java.util.Collections;
import java.util.List;

import org.soulwars.runtime.World;
import org.soulwars.runtime.event.EventBuffer;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.spi.IRandomProvider;
import org.soulwars.runtime.systems.BuffManager;

/**
 * What a disaster may touch during one tick: the world, the buff manager and the tick's event buffer.
 * <p>
 * A new context is created for every tick; {@link #startedAt()} stays the same for the whole occurrence.
 * </p>
 */
public final class DisasterContext {

    public static final String DEATH_CAUSE = "disaster";

    private final World world;
    private final BuffManager buffs;
    private final long now;
    private final long startedAt;
    private final long durationMillis;

    public DisasterContext(World world, BuffManager buffs, long now, long startedAt, long durationMillis) {
        this.world = world;
        this.buffs = buffs;
        this.now = now;
        this.startedAt = startedAt;
        this.durationMillis = durationMillis;
    }

    public World world() { return world; }
    public BuffManager buffs() { return buffs; }
    public EventBuffer events() { return world.events(); }
    public long now() { return now; }
    public long startedAt() { return startedAt; }
    public long endsAt() { return startedAt + durationMillis; }

    /**
     * @return elapsed time since the occurrence started
     */
    public long elapsed() {
        return Math.max(0, now - startedAt);
    }

    /**
     * @return progress of the occurrence in [0, 1]
     */
    public double progress() {
        if (durationMillis <= 0) {
            return 1.0;
        }
        return Math.min(1.0, elapsed() / (double) durationMillis);
    }

    public int livingPopulation() {
        return world.livingSouls().size();
    }

    /**
     * Kills up to {@code count} living souls. Candidates are taken in ascending id order and shuffled with
     * {@code random}, so the victims depend only on the world state and the plugin's random stream.
     * The deaths themselves are reported by the regular death handling.
     *
     * @return the number of souls killed
     */
    public int killRandomSouls(int count, IRandomProvider random) {
        if (count <= 0) {
            return 0;
        }
        List<Soul> living = world.livingSouls();
        Collections.shuffle(living, random.asJavaRandom());
        int victims = Math.min(count, living.size());
        for (int i = 0; i < victims; i++) {
            living.get(i).kill(DEATH_CAUSE);
        }
        return victims;
    }
}
