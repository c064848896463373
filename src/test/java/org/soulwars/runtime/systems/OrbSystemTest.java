package org.soulwars.runtime.systems;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.TestWorlds;
import org.soulwars.runtime.World;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.EnergyOrb;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.OrbId;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TilePosition;

/**
 * Unit tests for {@link OrbSystem}.
 */
class OrbSystemTest {

    private World world;
    private BuffManager buffs;
    private OrbSystem orbs;

    private void init(String overrides) {
        world = TestWorlds.emptyWorld(TestWorlds.config(overrides));
        buffs = new BuffManager(world.events());
        orbs = new OrbSystem(world, buffs);
    }

    private EnergyOrb lightOrb() {
        return world.orbs().get(new OrbId(Faction.LIGHT, 0));
    }

    @Test
    @Tag("unit")
    void initialOrbsLieSafelyInsideOwnTerritory() {
        init("");

        orbs.spawnInitialOrbs();

        assertThat(world.orbs()).hasSize(16);
        assertThat(world.events().view()).hasSize(16).allMatch(e -> e instanceof GameEvent.OrbSpawned);
        for (EnergyOrb orb : world.orbs().values()) {
            TilePosition tile = world.tileMap().tileAt(orb.position().x(), orb.position().y());
            assertThat(world.tileMap().ownerAt(tile)).isEqualTo(orb.faction());
            assertThat(world.tileMap().anyOwnedWithin(tile, 3, orb.faction().opponent())).isFalse();
            assertThat(tile.y()).isBetween(3, 56);
            assertThat(orb.isAvailable()).isTrue();
        }
    }

    @Test
    @Tag("unit")
    void hungrySoulCollectsItsFactionsOrb() {
        init("game.orb.perTeam = 1");
        orbs.spawnInitialOrbs();
        EnergyOrb orb = lightOrb();
        Soul soul = TestWorlds.adult(world, Faction.LIGHT, orb.position().x(), orb.position().y(), 30);
        soul.transitionTo(SoulState.HUNGRY, 0);
        world.events().drain();

        assertThat(orbs.collect(1000)).isEqualTo(1);

        assertThat(soul.energy()).isEqualTo(55.0);
        assertThat(orb.isAvailable()).isFalse();
        assertThat(orb.respawnAt()).isBetween(11_000L, 16_000L);
        assertThat(world.events().view()).singleElement().isInstanceOfSatisfying(GameEvent.OrbCollected.class,
            collected -> assertThat(collected.energyGained()).isEqualTo(25.0));
    }

    @Test
    @Tag("unit")
    void onlyHungrySoulsOfTheSameFactionCollect() {
        init("game.orb.perTeam = 1");
        orbs.spawnInitialOrbs();
        EnergyOrb orb = lightOrb();
        TestWorlds.adult(world, Faction.LIGHT, orb.position().x(), orb.position().y(), 30);
        Soul enemy = TestWorlds.adult(world, Faction.DARK, orb.position().x(), orb.position().y(), 30);
        enemy.transitionTo(SoulState.HUNGRY, 0);

        assertThat(orbs.collect(1000)).isZero();
        assertThat(orb.isAvailable()).isTrue();
    }

    @Test
    @Tag("unit")
    void collectedOrbRespawnsWhenDue() {
        init("game.orb.perTeam = 1");
        orbs.spawnInitialOrbs();
        EnergyOrb orb = lightOrb();
        Soul soul = TestWorlds.adult(world, Faction.LIGHT, orb.position().x(), orb.position().y(), 30);
        soul.transitionTo(SoulState.HUNGRY, 0);
        orbs.collect(0);
        world.events().drain();

        assertThat(orbs.respawn(orb.respawnAt() - 1)).isZero();
        assertThat(orbs.respawn(orb.respawnAt())).isEqualTo(1);

        assertThat(orb.isAvailable()).isTrue();
        assertThat(world.events().view()).singleElement().isInstanceOf(GameEvent.OrbSpawned.class);
    }

    @Test
    @Tag("unit")
    void soulTakesOneOrbPerTick() {
        init("game.orb.perTeam = 1");
        orbs.spawnInitialOrbs();
        EnergyOrb first = lightOrb();
        EnergyOrb second = new EnergyOrb(new OrbId(Faction.LIGHT, 1), Faction.LIGHT, 25, first.position());
        world.addOrb(second);
        Soul soul = TestWorlds.adult(world, Faction.LIGHT, first.position().x(), first.position().y(), 10);
        soul.transitionTo(SoulState.HUNGRY, 0);
        world.events().drain();

        assertThat(orbs.collect(1000)).isEqualTo(1);
        assertThat(soul.energy()).isEqualTo(35.0);
        assertThat(first.isAvailable() ^ second.isAvailable()).isTrue();

        assertThat(orbs.collect(1033)).isEqualTo(1);
        assertThat(soul.energy()).isEqualTo(60.0);
        assertThat(first.isAvailable() || second.isAvailable()).isFalse();
    }
}
