package org.soulwars.runtime.systems;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.TestWorlds;
import org.soulwars.runtime.World;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.event.GameEventType;
import org.soulwars.runtime.model.Buff;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.BuffId;
import org.soulwars.runtime.model.BuffSource;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TilePosition;

/**
 * Unit tests for {@link SpellSystem}.
 */
class SpellSystemTest {

    private static final TilePosition TARGET = new TilePosition(30, 12);

    private World world;
    private BuffManager buffs;
    private SpellSystem spells;
    private Soul caster;
    private Soul farDefender;
    private Soul nearDefender;

    @BeforeEach
    void setUp() {
        world = TestWorlds.emptyWorld();
        buffs = new BuffManager(world.events());
        spells = new SpellSystem(world, buffs, new DefenderSelector(world));
        caster = TestWorlds.adult(world, Faction.LIGHT, 700, 180, 100);
        farDefender = TestWorlds.adult(world, Faction.DARK, 1200, 450, 60);
        nearDefender = TestWorlds.adult(world, Faction.DARK, 800, 180, 90);
    }

    private void beginCasting(Soul soul, TilePosition target, long now) {
        soul.transitionTo(SoulState.CASTING, now);
        soul.setCastTarget(target);
    }

    @Test
    @Tag("unit")
    void startingASpellCostsEnergyAndAssignsADefender() {
        beginCasting(caster, TARGET, 0);

        spells.update(0);

        assertThat(caster.energy()).isEqualTo(75.0);
        assertThat(world.spellByCaster(caster.id())).isNotNull();
        assertThat(world.isTileUnderSpell(TARGET)).isTrue();
        assertThat(world.events().view()).singleElement().isInstanceOfSatisfying(GameEvent.SpellStarted.class,
            started -> {
                assertThat(started.duration()).isEqualTo(3000L);
                assertThat(started.target()).isEqualTo(TARGET);
            });
        assertThat(nearDefender.state()).isEqualTo(SoulState.DEFENDING);
        assertThat(nearDefender.trackedEnemy()).isEqualTo(caster.id());
        assertThat(farDefender.state()).isEqualTo(SoulState.ROAMING);
    }

    @Test
    @Tag("unit")
    void castTimeBuffShortensTheSpell() {
        buffs.apply(new Buff(new BuffId(BuffSource.DAY_NIGHT, Faction.LIGHT, "day_blessing"), "faster",
            Map.of(BuffEffect.CAST_TIME, 0.8), 0, Buff.PERMANENT));
        world.events().drain();
        beginCasting(caster, TARGET, 0);

        spells.update(0);

        assertThat(world.events().view()).first().isInstanceOfSatisfying(GameEvent.SpellStarted.class,
            started -> assertThat(started.duration()).isEqualTo(2400L));
    }

    @Test
    @Tag("unit")
    void completionCapturesFootprintAndConsumesCaster() {
        beginCasting(caster, TARGET, 0);
        spells.update(0);
        world.events().drain();

        assertThat(spells.completeSpells(2999)).isZero();
        assertThat(spells.completeSpells(3000)).isEqualTo(1);

        assertThat(world.tileMap().ownerAt(31, 13)).isEqualTo(Faction.LIGHT);
        assertThat(caster.isDead()).isTrue();
        assertThat(caster.deathCause()).isEqualTo("spell");
        assertThat(caster.state()).isEqualTo(SoulState.ROAMING);
        assertThat(nearDefender.state()).isEqualTo(SoulState.ROAMING);
        assertThat(world.spells()).isEmpty();
        assertThat(world.events().view()).first().isInstanceOfSatisfying(GameEvent.SpellCompleted.class,
            completed -> assertThat(completed.tilesCaptured()).isEqualTo(6));
        assertThat(world.events().view()).filteredOn(e -> e.type() == GameEventType.TILE_UPDATED).hasSize(6);
    }

    @Test
    @Tag("unit")
    void ownTileTargetSendsCasterBackToRoaming() {
        beginCasting(caster, new TilePosition(10, 10), 0);

        spells.update(0);

        assertThat(caster.state()).isEqualTo(SoulState.ROAMING);
        assertThat(caster.energy()).isEqualTo(100.0);
        assertThat(world.spells()).isEmpty();
    }

    @Test
    @Tag("unit")
    void tileUnderSpellCannotBeTargetedTwice() {
        Soul second = TestWorlds.adult(world, Faction.LIGHT, 710, 190, 100);
        beginCasting(caster, TARGET, 0);
        beginCasting(second, TARGET, 0);

        spells.update(0);

        assertThat(world.spells()).hasSize(1);
        assertThat(second.state()).isEqualTo(SoulState.ROAMING);
    }

    @Test
    @Tag("unit")
    void interruptReleasesCasterAndDefender() {
        beginCasting(caster, TARGET, 0);
        spells.update(0);
        world.events().drain();

        assertThat(spells.interrupt(caster, SpellSystem.REASON_ATTACKED, 500)).isTrue();

        assertThat(caster.state()).isEqualTo(SoulState.ROAMING);
        assertThat(caster.isAlive()).isTrue();
        assertThat(nearDefender.state()).isEqualTo(SoulState.ROAMING);
        assertThat(world.events().view()).singleElement().isInstanceOfSatisfying(GameEvent.SpellInterrupted.class,
            interrupted -> assertThat(interrupted.reason()).isEqualTo("attacked"));
        assertThat(world.tileMap().ownerAt(TARGET)).isEqualTo(Faction.DARK);
    }

    @Test
    @Tag("unit")
    void casterDeathCancelsTheSpellWithoutCapture() {
        beginCasting(caster, TARGET, 0);
        spells.update(0);
        world.events().drain();
        caster.kill("combat");

        spells.handleSoulDeath(caster, 500);

        assertThat(world.spells()).isEmpty();
        assertThat(spells.completeSpells(3000)).isZero();
        assertThat(world.tileMap().ownerAt(TARGET)).isEqualTo(Faction.DARK);
        assertThat(world.events().view()).singleElement().isInstanceOfSatisfying(GameEvent.SpellInterrupted.class,
            interrupted -> assertThat(interrupted.reason()).isEqualTo("died"));
    }
}
