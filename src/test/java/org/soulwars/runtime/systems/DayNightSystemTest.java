package org.soulwars.runtime.systems;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.TestWorlds;
import org.soulwars.runtime.World;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.DayPhase;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;

/**
 * Unit tests for {@link DayNightSystem}. The default cycle is 240 s: day until 96 s, dusk until 120 s,
 * night until 216 s, then dawn.
 */
class DayNightSystemTest {

    private World world;
    private BuffManager buffs;
    private DayNightSystem dayNight;

    @BeforeEach
    void setUp() {
        world = TestWorlds.emptyWorld();
        buffs = new BuffManager(world.events());
        dayNight = new DayNightSystem(world, buffs, 0L);
    }

    @Test
    @Tag("unit")
    void startsInDayWithLightBlessed() {
        assertThat(dayNight.phase()).isEqualTo(DayPhase.DAY);
        assertThat(dayNight.ambientLight()).isEqualTo(1.0);
        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.SPEED)).isEqualTo(1.2);
        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.CAST_TIME)).isEqualTo(0.8);
        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.ENERGY)).isEqualTo(1.5);
        assertThat(buffs.multiplier(Faction.DARK, BuffEffect.SPEED)).isEqualTo(1.0);
    }

    @Test
    @Tag("unit")
    void noChangeWithinAPhase() {
        world.events().drain();

        assertThat(dayNight.tick(50_000)).isFalse();
        assertThat(world.events().isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void duskRemovesBuffsAndDimsTheLight() {
        world.events().drain();

        assertThat(dayNight.tick(100_000)).isTrue();

        assertThat(dayNight.phase()).isEqualTo(DayPhase.DUSK);
        assertThat(dayNight.ambientLight()).isCloseTo(1.0 - 0.7 / 6, offset(1e-9));
        assertThat(buffs.activeBuffs()).isEmpty();
        assertThat(world.events().view()).last().isInstanceOfSatisfying(GameEvent.DayNightPhaseChanged.class,
            changed -> assertThat(changed.phase()).isEqualTo(DayPhase.DUSK));
    }

    @Test
    @Tag("unit")
    void nightBlessesDark() {
        dayNight.tick(130_000);

        assertThat(dayNight.phase()).isEqualTo(DayPhase.NIGHT);
        assertThat(dayNight.ambientLight()).isEqualTo(0.3);
        assertThat(buffs.multiplier(Faction.DARK, BuffEffect.ENERGY)).isEqualTo(1.5);
        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.ENERGY)).isEqualTo(1.0);
        assertThat(dayNight.isRestPhaseFor(Faction.LIGHT)).isTrue();
        assertThat(dayNight.isRestPhaseFor(Faction.DARK)).isFalse();
    }

    @Test
    @Tag("unit")
    void cycleWrapsAround() {
        dayNight.tick(230_000);
        assertThat(dayNight.phase()).isEqualTo(DayPhase.DAWN);

        dayNight.tick(250_000);
        assertThat(dayNight.phase()).isEqualTo(DayPhase.DAY);
        assertThat(dayNight.cycleProgress()).isCloseTo(10_000 / 240_000.0, offset(1e-9));
    }

    @Test
    @Tag("unit")
    void favouredPhaseResetsSleepAllowance() {
        Soul dark = TestWorlds.adult(world, Faction.DARK, 1200, 450, 70);
        Soul light = TestWorlds.adult(world, Faction.LIGHT, 300, 450, 70);
        dark.recordSleep(10_000);
        light.recordSleep(10_000);

        dayNight.tick(130_000);

        assertThat(dark.hasSleptThisCycle()).isFalse();
        assertThat(light.hasSleptThisCycle()).isTrue();
    }

    @Test
    @Tag("unit")
    void disabledCycleNeverChanges() {
        World calm = TestWorlds.emptyWorld(TestWorlds.config("game.dayNight.enabled = false"));
        BuffManager calmBuffs = new BuffManager(calm.events());
        DayNightSystem disabled = new DayNightSystem(calm, calmBuffs, 0L);

        assertThat(disabled.tick(130_000)).isFalse();
        assertThat(disabled.phase()).isEqualTo(DayPhase.DAY);
        assertThat(calmBuffs.activeBuffs()).isEmpty();
        assertThat(disabled.isRestPhaseFor(Faction.DARK)).isFalse();
    }
}
