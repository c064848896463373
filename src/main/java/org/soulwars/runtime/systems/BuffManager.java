package org.soulwars.runtime.systems;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.event.EventBuffer;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.Buff;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.BuffId;
import org.soulwars.runtime.model.BuffSource;
import org.soulwars.runtime.model.Faction;

/**
 * Keeps the active buffs of both factions. The effective multiplier of an effect for a faction is the
 * product of that effect's multipliers over all of the faction's active buffs.
 */
public final class BuffManager {

    private static final Logger LOG = LoggerFactory.getLogger(BuffManager.class);

    private final EventBuffer events;
    private final Map<BuffId, Buff> active = new LinkedHashMap<>();

    public BuffManager(EventBuffer events) {
        this.events = events;
    }

    /**
     * Activates a buff. A buff with the same id is replaced.
     */
    public void apply(Buff buff) {
        active.put(buff.id(), buff);
        Map<String, Double> multipliers = new LinkedHashMap<>();
        buff.multipliers().forEach((effect, value) -> multipliers.put(effect.wireName(), value));
        events.emit(new GameEvent.BuffApplied(buff.id(), buff.faction(), buff.source(), buff.description(),
            multipliers, buff.expiresAt()));
        LOG.debug("Applied buff {} ({})", buff.id(), buff.description());
    }

    /**
     * @return true if a buff with this id was active
     */
    public boolean remove(BuffId id) {
        Buff removed = active.remove(id);
        if (removed == null) {
            return false;
        }
        emitRemoved(removed);
        return true;
    }

    /**
     * Removes every buff created by {@code source}.
     *
     * @return the number of removed buffs
     */
    public int clearSource(BuffSource source) {
        int removed = 0;
        Iterator<Buff> it = active.values().iterator();
        while (it.hasNext()) {
            Buff buff = it.next();
            if (buff.source() == source) {
                it.remove();
                emitRemoved(buff);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Removes all buffs whose expiry time has been reached.
     *
     * @return the number of expired buffs
     */
    public int expire(long now) {
        int removed = 0;
        Iterator<Buff> it = active.values().iterator();
        while (it.hasNext()) {
            Buff buff = it.next();
            if (buff.isExpired(now)) {
                it.remove();
                emitRemoved(buff);
                removed++;
            }
        }
        return removed;
    }

    public double multiplier(Faction faction, BuffEffect effect) {
        double product = 1.0;
        for (Buff buff : active.values()) {
            if (buff.faction() == faction) {
                product *= buff.multiplier(effect);
            }
        }
        return product;
    }

    public boolean isActive(BuffId id) {
        return active.containsKey(id);
    }

    public List<Buff> activeBuffs() {
        return new ArrayList<>(active.values());
    }

    private void emitRemoved(Buff buff) {
        events.emit(new GameEvent.BuffRemoved(buff.id(), buff.faction(), buff.source()));
        LOG.debug("Removed buff {}", buff.id());
    }
}
