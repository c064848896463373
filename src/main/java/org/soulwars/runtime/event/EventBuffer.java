package org.soulwars.runtime.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the events of one tick in emission order. Systems append, the orchestrator drains once per tick.
 */
public final class EventBuffer {

    private final List<GameEvent> events = new ArrayList<>();

    public void emit(GameEvent event) {
        events.add(event);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * @return a read-only view of the events emitted so far
     */
    public List<GameEvent> view() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Returns the collected events and empties the buffer.
     *
     * @return the events in emission order
     */
    public List<GameEvent> drain() {
        List<GameEvent> drained = List.copyOf(events);
        events.clear();
        return drained;
    }
}
