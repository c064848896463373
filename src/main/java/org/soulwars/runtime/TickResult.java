package org.soulwars.runtime;

import java.util.List;

import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.snapshot.WorldSnapshot;

/**
 * Output of one tick: the events in emission order and the world as it stood at the end of the tick.
 */
public record TickResult(long tick, long timestamp, List<GameEvent> events, WorldSnapshot snapshot) {

    public TickResult {
        events = List.copyOf(events);
    }
}
