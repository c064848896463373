package org.soulwars.runtime.systems;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.TestWorlds;
import org.soulwars.runtime.World;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;

/**
 * Unit tests for {@link DefenderSelector}.
 */
class DefenderSelectorTest {

    private World world;
    private DefenderSelector selector;
    private Soul caster;

    @BeforeEach
    void setUp() {
        world = TestWorlds.emptyWorld();
        selector = new DefenderSelector(world);
        caster = TestWorlds.adult(world, Faction.DARK, 800, 450, 90);
        caster.transitionTo(SoulState.PREPARING, 0);
    }

    @Test
    @Tag("unit")
    void picksTheStrongestEligibleEnemy() {
        Soul weak = TestWorlds.adult(world, Faction.LIGHT, 300, 450, 60);
        Soul hungryButStrong = TestWorlds.adult(world, Faction.LIGHT, 310, 450, 90);
        hungryButStrong.transitionTo(SoulState.HUNGRY, 0);
        TestWorlds.child(world, Faction.LIGHT, 320, 450, 95);
        Soul sleeping = TestWorlds.adult(world, Faction.LIGHT, 330, 450, 99);
        sleeping.transitionTo(SoulState.RESTING, 0);

        assertThat(selector.select(caster)).isSameAs(hungryButStrong);
        assertThat(DefenderSelector.isEligible(weak)).isTrue();
        assertThat(DefenderSelector.isEligible(sleeping)).isFalse();
    }

    @Test
    @Tag("unit")
    void lowerIdWinsOnEqualEnergy() {
        Soul first = TestWorlds.adult(world, Faction.LIGHT, 300, 450, 80);
        TestWorlds.adult(world, Faction.LIGHT, 310, 450, 80);

        assertThat(selector.select(caster)).isSameAs(first);
    }

    @Test
    @Tag("unit")
    void oneDefenderPerCaster() {
        Soul defender = TestWorlds.adult(world, Faction.LIGHT, 300, 450, 80);
        TestWorlds.adult(world, Faction.LIGHT, 310, 450, 70);

        DefenderSelector.assign(defender, caster, 100);

        assertThat(defender.state()).isEqualTo(SoulState.DEFENDING);
        assertThat(defender.trackedEnemy()).isEqualTo(caster.id());
        assertThat(selector.hasDefender(caster)).isTrue();
        assertThat(selector.select(caster)).isNull();
    }

    @Test
    @Tag("unit")
    void nonChannelingSoulsNeedNoDefender() {
        TestWorlds.adult(world, Faction.LIGHT, 300, 450, 80);
        caster.transitionTo(SoulState.ROAMING, 100);

        assertThat(selector.select(caster)).isNull();
    }

    @Test
    @Tag("unit")
    void deadDefenderDoesNotCount() {
        Soul defender = TestWorlds.adult(world, Faction.LIGHT, 300, 450, 80);
        DefenderSelector.assign(defender, caster, 100);
        defender.kill("combat");

        assertThat(selector.hasDefender(caster)).isFalse();
    }
}
