package org.soulwars.runtime.systems;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.event.EventBuffer;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.event.GameEventType;
import org.soulwars.runtime.model.Buff;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.BuffId;
import org.soulwars.runtime.model.BuffSource;
import org.soulwars.runtime.model.Faction;

/**
 * Unit tests for {@link BuffManager}.
 */
class BuffManagerTest {

    private EventBuffer events;
    private BuffManager buffs;

    @BeforeEach
    void setUp() {
        events = new EventBuffer();
        buffs = new BuffManager(events);
    }

    private static Buff buff(BuffSource source, Faction faction, String name, BuffEffect effect, double value,
                             long expiresAt) {
        return new Buff(new BuffId(source, faction, name), name, Map.of(effect, value), 0L, expiresAt);
    }

    @Test
    @Tag("unit")
    void multipliersOfOneFactionAreMultiplied() {
        buffs.apply(buff(BuffSource.DAY_NIGHT, Faction.LIGHT, "fast", BuffEffect.SPEED, 1.2, Buff.PERMANENT));
        buffs.apply(buff(BuffSource.DISASTER, Faction.LIGHT, "frozen", BuffEffect.SPEED, 0.5, Buff.PERMANENT));
        buffs.apply(buff(BuffSource.DISASTER, Faction.DARK, "frozen", BuffEffect.SPEED, 0.7, Buff.PERMANENT));

        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.SPEED)).isCloseTo(0.6, offset(1e-9));
        assertThat(buffs.multiplier(Faction.DARK, BuffEffect.SPEED)).isEqualTo(0.7);
        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.ENERGY)).isEqualTo(1.0);
    }

    @Test
    @Tag("unit")
    void applyingTheSameIdReplacesTheBuff() {
        buffs.apply(buff(BuffSource.SPECIAL_EVENT, Faction.DARK, "rage", BuffEffect.DAMAGE, 1.5, Buff.PERMANENT));
        buffs.apply(buff(BuffSource.SPECIAL_EVENT, Faction.DARK, "rage", BuffEffect.DAMAGE, 2.0, Buff.PERMANENT));

        assertThat(buffs.activeBuffs()).hasSize(1);
        assertThat(buffs.multiplier(Faction.DARK, BuffEffect.DAMAGE)).isEqualTo(2.0);
    }

    @Test
    @Tag("unit")
    void applyEmitsWireNamedMultipliers() {
        buffs.apply(buff(BuffSource.DAY_NIGHT, Faction.LIGHT, "day_blessing", BuffEffect.CAST_TIME, 0.8, Buff.PERMANENT));

        assertThat(events.view()).singleElement().isInstanceOfSatisfying(GameEvent.BuffApplied.class, applied -> {
            assertThat(applied.multipliers()).containsEntry("castTime", 0.8);
            assertThat(applied.expiresAt()).isEqualTo(Buff.PERMANENT);
            assertThat(applied.source()).isEqualTo(BuffSource.DAY_NIGHT);
        });
    }

    @Test
    @Tag("unit")
    void timedBuffsExpireAtTheirDeadline() {
        buffs.apply(buff(BuffSource.DISASTER, Faction.LIGHT, "frozen", BuffEffect.SPEED, 0.7, 1000L));
        buffs.apply(buff(BuffSource.DAY_NIGHT, Faction.LIGHT, "day", BuffEffect.SPEED, 1.2, Buff.PERMANENT));
        events.drain();

        assertThat(buffs.expire(999)).isZero();
        assertThat(buffs.expire(1000)).isEqualTo(1);
        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.SPEED)).isEqualTo(1.2);
        assertThat(events.view()).extracting(GameEvent::type).containsExactly(GameEventType.BUFF_REMOVED);
        assertThat(buffs.expire(Long.MAX_VALUE)).isZero();
    }

    @Test
    @Tag("unit")
    void clearSourceRemovesOnlyThatSource() {
        buffs.apply(buff(BuffSource.DAY_NIGHT, Faction.LIGHT, "a", BuffEffect.SPEED, 1.2, Buff.PERMANENT));
        buffs.apply(buff(BuffSource.DAY_NIGHT, Faction.LIGHT, "b", BuffEffect.ENERGY, 1.5, Buff.PERMANENT));
        buffs.apply(buff(BuffSource.DISASTER, Faction.DARK, "c", BuffEffect.SPEED, 0.7, Buff.PERMANENT));

        assertThat(buffs.clearSource(BuffSource.DAY_NIGHT)).isEqualTo(2);
        assertThat(buffs.activeBuffs()).extracting(Buff::source).containsExactly(BuffSource.DISASTER);
    }

    @Test
    @Tag("unit")
    void removingUnknownBuffIsANoOp() {
        assertThat(buffs.remove(new BuffId(BuffSource.SPELL, Faction.DARK, "none"))).isFalse();
        assertThat(events.isEmpty()).isTrue();
    }
}
