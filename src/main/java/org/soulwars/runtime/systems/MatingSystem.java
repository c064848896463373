package org.soulwars.runtime.systems;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.LongPredicate;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulId;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.snapshot.SoulSnapshot;

/**
 * Reproduction: child maturation, throttled pairing of eligible souls and completion of finished pairs.
 * <p>
 * Pairing runs at most once per {@code pairingInterval}. Per faction, souls are visited in ascending id order and
 * each unpaired soul takes the closest still unpaired partner within range (the lower id on equal distance).
 * </p>
 * <p>
 * A pair is completed once: completed pairs are remembered in a set keyed by the unordered id pair, so a pair
 * that is reported ready twice spawns one child. The key is forgotten when the same two souls start mating again.
 * </p>
 */
public final class MatingSystem {

    private static final Logger LOG = LoggerFactory.getLogger(MatingSystem.class);

    public static final String REASON_PARTNER_LOST = "partner_lost";
    public static final String REASON_OUT_OF_RANGE = "out_of_range";
    public static final String REASON_HUNGRY = "hungry";

    private final World world;
    private final GameConfig.MatingSettings settings;
    private final long sleepDurationMs;
    private final LongSet processedPairs = new LongOpenHashSet();
    private long lastPairingAt = Soul.NEVER;

    public MatingSystem(World world) {
        this.world = world;
        this.settings = world.config().mating();
        this.sleepDurationMs = world.config().sleep().durationMs();
    }

    public void update(long now) {
        matureChildren(now);
        if (lastPairingAt == Soul.NEVER || now - lastPairingAt >= settings.pairingIntervalMs()) {
            formPairs(now);
            lastPairingAt = now;
        }
        completeReadyPairs(now);
    }

    void matureChildren(long now) {
        for (Soul soul : world.souls()) {
            if (soul.isAlive() && soul.isChild() && now - soul.bornAt() >= settings.childMaturityMs()) {
                soul.mature();
                world.events().emit(new GameEvent.SoulMatured(soul.id(), soul.faction()));
                LOG.debug("{} matured", soul.id());
            }
        }
    }

    public boolean isEligible(Soul soul, long now) {
        return soul.isAlive()
            && soul.isAdult()
            && soul.state() == SoulState.ROAMING
            && soul.matingPartner() == null
            && soul.energyFraction() >= settings.minEnergy()
            && soul.isMatingOffCooldown(now, settings.cooldownMs());
    }

    /**
     * @return the number of pairs started
     */
    int formPairs(long now) {
        int started = 0;
        for (Faction faction : Faction.values()) {
            if (world.countLiving(faction) >= settings.maxSoulsPerTeam()) {
                continue;
            }
            List<Soul> ready = new ArrayList<>();
            for (Soul soul : world.souls()) {
                if (soul.faction() == faction && isEligible(soul, now)) {
                    ready.add(soul);
                }
            }
            Set<SoulId> paired = new HashSet<>();
            for (int i = 0; i < ready.size(); i++) {
                Soul first = ready.get(i);
                if (paired.contains(first.id())) {
                    continue;
                }
                Soul closest = null;
                double closestDistance = Double.MAX_VALUE;
                for (int j = i + 1; j < ready.size(); j++) {
                    Soul second = ready.get(j);
                    if (paired.contains(second.id())) {
                        continue;
                    }
                    double distance = first.distanceTo(second);
                    if (distance <= settings.range() && distance < closestDistance) {
                        closest = second;
                        closestDistance = distance;
                    }
                }
                if (closest != null) {
                    startPair(first, closest, now);
                    paired.add(first.id());
                    paired.add(closest.id());
                    started++;
                }
            }
        }
        return started;
    }

    private void startPair(Soul first, Soul second, long now) {
        processedPairs.remove(pairKey(first.id(), second.id()));
        first.beginMating(second.id(), now);
        second.beginMating(first.id(), now);
        world.events().emit(new GameEvent.MatingStarted(first.id(), second.id(), first.faction()));
        LOG.debug("{} and {} started mating", first.id(), second.id());
    }

    private void completeReadyPairs(long now) {
        for (Soul soul : world.soulList()) {
            if (!soul.isAlive() || !soul.isMating() || !soul.isReadyToCompleteMating()) {
                continue;
            }
            Soul partner = world.soul(soul.matingPartner());
            if (partner == null || partner.isDead()) {
                cancel(soul, REASON_PARTNER_LOST, now);
                continue;
            }
            completePair(soul, partner, now);
        }
    }

    /**
     * Completes a pair: spawns one child at the midpoint (unless the faction is at its population cap),
     * starts both parents' cooldown and sends them back to ROAMING.
     *
     * @return the child, or {@code null} if none was spawned (pair already processed or population cap reached)
     */
    Soul completePair(Soul first, Soul second, long now) {
        long key = pairKey(first.id(), second.id());
        if (!processedPairs.add(key)) {
            LOG.debug("Pair {} / {} already completed, ignoring", first.id(), second.id());
            return null;
        }
        Soul child = null;
        if (world.countLiving(first.faction()) < settings.maxSoulsPerTeam()) {
            child = world.spawnSoul(first.faction(), first.position().midpoint(second.position()),
                settings.childEnergy(), false, now);
        }
        first.recordMating(now);
        second.recordMating(now);
        first.transitionTo(SoulState.ROAMING, now);
        second.transitionTo(SoulState.ROAMING, now);

        world.events().emit(new GameEvent.MatingCompleted(first.id(), second.id(), child == null ? null : child.id(),
            first.faction()));
        if (child != null) {
            world.events().emit(new GameEvent.SoulSpawned(SoulSnapshot.of(child, now, sleepDurationMs)));
            LOG.debug("{} and {} produced {}", first.id(), second.id(), child.id());
        }
        return child;
    }

    /**
     * Cancels the pairing of {@code soul}. Both partners (if the partner still mates with {@code soul}) return
     * to ROAMING and one {@code mating_cancelled} event is emitted.
     */
    public void cancel(Soul soul, String reason, long now) {
        SoulId partnerId = soul.matingPartner();
        Soul partner = world.soul(partnerId);
        if (soul.isMating()) {
            soul.transitionTo(SoulState.ROAMING, now);
        }
        if (partner != null && partner.isMating() && soul.id().equals(partner.matingPartner())) {
            partner.transitionTo(SoulState.ROAMING, now);
        }
        world.events().emit(new GameEvent.MatingCancelled(soul.id(), partnerId, soul.faction(), reason));
        LOG.debug("Mating of {} and {} cancelled ({})", soul.id(), partnerId, reason);
    }

    /**
     * Drops remembered pairs that involve a removed soul.
     */
    public void forget(SoulId id) {
        long value = id.value();
        LongPredicate involves = key -> (key >>> 32) == value || (key & 0xFFFFFFFFL) == value;
        processedPairs.removeIf(involves);
    }

    public boolean isPairProcessed(SoulId a, SoulId b) {
        return processedPairs.contains(pairKey(a, b));
    }

    static long pairKey(SoulId a, SoulId b) {
        long low = Math.min(a.value(), b.value());
        long high = Math.max(a.value(), b.value());
        return (low << 32) | (high & 0xFFFFFFFFL);
    }
}
