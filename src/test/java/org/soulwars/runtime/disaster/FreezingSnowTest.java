package org.soulwars.runtime.disaster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.TestWorlds;
import org.soulwars.runtime.World;
import org.soulwars.runtime.internal.services.SeededRandomProvider;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.systems.BuffManager;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link FreezingSnow}.
 */
class FreezingSnowTest {

    private World world;
    private BuffManager buffs;
    private FreezingSnow snow;

    @BeforeEach
    void setUp() {
        world = TestWorlds.emptyWorld();
        buffs = new BuffManager(world.events());
        for (int i = 0; i < 5; i++) {
            TestWorlds.adult(world, Faction.LIGHT, 300 + i * 20, 450, 90);
            TestWorlds.adult(world, Faction.DARK, 1000 + i * 20, 450, 90);
        }
        Config options = ConfigFactory.parseMap(Map.of(
            "triggerChance", 1.0,
            "cooldownMs", 0,
            "durationMs", 20_000,
            "deathPercentage", 0.2,
            "killIntervalMs", 2000,
            "speedMultiplier", 0.7));
        snow = new FreezingSnow(new SeededRandomProvider(3L), options);
    }

    private DisasterContext at(long now) {
        return new DisasterContext(world, buffs, now, 0L, snow.durationMillis());
    }

    @Test
    @Tag("unit")
    void slowsBothFactionsWhileActive() {
        Map<String, Object> details = snow.begin(at(0));

        assertThat(details).containsEntry("deathPercentage", 0.2).containsEntry("speedMultiplier", 0.7);
        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.SPEED)).isEqualTo(0.7);
        assertThat(buffs.multiplier(Faction.DARK, BuffEffect.SPEED)).isEqualTo(0.7);

        snow.end(at(20_000));

        assertThat(buffs.multiplier(Faction.LIGHT, BuffEffect.SPEED)).isEqualTo(1.0);
        assertThat(buffs.activeBuffs()).isEmpty();
    }

    @Test
    @Tag("unit")
    void deathsAreSpreadOverTheDuration() {
        snow.begin(at(0));

        snow.tick(at(1000));
        assertThat(snow.victims()).isZero();

        snow.tick(at(10_000));
        assertThat(snow.victims()).isEqualTo(1);

        snow.tick(at(11_000));
        assertThat(snow.victims()).isEqualTo(1);

        snow.tick(at(20_000));
        assertThat(snow.victims()).isEqualTo(2);
        assertThat(world.livingSouls()).hasSize(8);
        assertThat(world.soulList()).filteredOn(Soul::isDead)
            .allSatisfy(dead -> assertThat(dead.deathCause()).isEqualTo("disaster"));
    }

    @Test
    @Tag("unit")
    void lastTickReachesTheFullDeathCountInsideTheKillInterval() {
        snow.begin(at(0));

        snow.tick(at(19_000));
        assertThat(snow.victims()).isEqualTo(1);

        snow.tick(at(19_500));
        assertThat(snow.victims()).isEqualTo(1);

        snow.tick(at(20_000));
        assertThat(snow.victims()).isEqualTo(2);
        assertThat(world.livingSouls()).hasSize(8);
    }

    @Test
    @Tag("unit")
    void victimsResetWithEachOccurrence() {
        snow.begin(at(0));
        snow.tick(at(20_000));
        assertThat(snow.victims()).isEqualTo(2);

        snow.begin(at(0));

        assertThat(snow.victims()).isZero();
    }

    @Test
    @Tag("unit")
    void rejectsInvalidDeathPercentage() {
        Config options = ConfigFactory.parseMap(Map.of(
            "triggerChance", 0.5, "cooldownMs", 0, "durationMs", 1000, "deathPercentage", 1.5));

        assertThatThrownBy(() -> new FreezingSnow(new SeededRandomProvider(1L), options))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("deathPercentage must be within [0, 1]");
    }
}
