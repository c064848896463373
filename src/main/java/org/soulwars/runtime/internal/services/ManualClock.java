package org.soulwars.runtime.internal.services;

import java.util.concurrent.atomic.AtomicLong;

import org.soulwars.runtime.spi.IClock;

/**
 * Clock that only moves when told to.
 * <p>
 * Used by the headless {@code simulate} command (advanced by one frame per tick) and by tests,
 * which step the world through exact preparation, cast and mating durations.
 * </p>
 */
public final class ManualClock implements IClock {

    private final AtomicLong now;

    public ManualClock(long startMillis) {
        this.now = new AtomicLong(startMillis);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    /**
     * Moves the clock forward.
     *
     * @param millis non-negative amount to advance
     * @return the new time
     * @throws IllegalArgumentException if {@code millis} is negative
     */
    public long advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("Clock cannot move backwards: " + millis);
        }
        return now.addAndGet(millis);
    }

    /**
     * Sets the clock to an absolute time that is not earlier than the current one.
     *
     * @param millis the new time
     * @throws IllegalArgumentException if {@code millis} lies in the past
     */
    public void set(long millis) {
        if (millis < now.get()) {
            throw new IllegalArgumentException("Clock cannot move backwards: " + millis + " < " + now.get());
        }
        now.set(millis);
    }
}
