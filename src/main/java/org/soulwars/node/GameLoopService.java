package org.soulwars.node;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import org.soulwars.runtime.GameManager;
import org.soulwars.runtime.TickResult;
import org.soulwars.runtime.event.GameEvent;

import com.typesafe.config.Config;

/**
 * Drives a {@link GameManager} at a fixed frame rate and hands every {@link TickResult} to the registered
 * listeners.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code overrunWarnFactor} - a tick taking longer than this many frames is logged at WARN (default 3)</li>
 *   <li>{@code shutdownTimeout} - seconds to wait for the loop thread on stop (default 5)</li>
 * </ul>
 * The frame length itself comes from {@code game.loop.frameMillis}.
 * </p>
 */
public class GameLoopService extends AbstractService {

    private final GameManager game;
    private final long frameMillis;
    private final double overrunWarnFactor;
    private final List<ITickListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong lastTick = new AtomicLong();
    private final AtomicLong lastTickDurationMs = new AtomicLong();

    public GameLoopService(String name, Config options, GameManager game) {
        super(name, options);
        this.game = game;
        this.frameMillis = game.config().loop().frameMillis();
        this.overrunWarnFactor = options.hasPath("overrunWarnFactor") ? options.getDouble("overrunWarnFactor") : 3.0;
    }

    public void addListener(ITickListener listener) {
        listeners.add(listener);
    }

    @Override
    protected void logStarted() {
        log.info("{} started: frame={}ms, listeners={}", serviceName, frameMillis, listeners.size());
    }

    @Override
    protected void run() throws InterruptedException {
        while (!isStopRequested()) {
            checkPause();
            if (isStopRequested()) {
                break;
            }

            long frameStart = System.nanoTime();
            TickResult result = game.tick();
            lastTick.set(result.tick());
            logNotableEvents(result);
            publish(result);

            long elapsedMs = (System.nanoTime() - frameStart) / 1_000_000L;
            lastTickDurationMs.set(elapsedMs);
            if (elapsedMs > frameMillis * overrunWarnFactor) {
                log.warn("Tick {} took {}ms, frame budget is {}ms", result.tick(), elapsedMs, frameMillis);
            }
            long remaining = frameMillis - elapsedMs;
            if (remaining > 0) {
                Thread.sleep(remaining);
            }
        }
    }

    private void publish(TickResult result) {
        for (ITickListener listener : listeners) {
            try {
                listener.onTick(result);
            } catch (RuntimeException e) {
                recordError();
                log.warn("Tick listener {} failed at tick {}: {}", listener.getClass().getSimpleName(),
                    result.tick(), e.getMessage());
                log.debug("Listener failure details:", e);
            }
        }
    }

    private void logNotableEvents(TickResult result) {
        for (GameEvent event : result.events()) {
            switch (event.type()) {
                case NEXUS_DESTROYED, DAY_NIGHT_PHASE_CHANGE ->
                    log.info("Tick {}: {}", result.tick(), event);
                case SPELL_COMPLETED, MATING_COMPLETED, METEORITE_IMPACT, SOUL_DEATH ->
                    log.debug("Tick {}: {}", result.tick(), event);
                case SOUL_SPAWN, SOUL_UPDATE, SOUL_REMOVE, SOUL_MATURED, ATTACK, SPELL_STARTED, SPELL_INTERRUPTED,
                    TILE_UPDATED, ORB_SPAWNED, ORB_COLLECTED, MATING_STARTED, MATING_CANCELLED, DISASTER_START,
                    DISASTER_END, NEXUS_UPDATE, BUFF_APPLIED, BUFF_REMOVED, EMERGENCY_RESPAWN -> {
                    // reported by the owning system or too frequent to log
                }
            }
        }
    }

    /**
     * @return the number of the last completed tick, 0 before the first
     */
    public long getLastTick() {
        return lastTick.get();
    }

    public long getLastTickDurationMs() {
        return lastTickDurationMs.get();
    }

    public GameManager game() {
        return game;
    }
}
