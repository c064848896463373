package org.soulwars.runtime.systems;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.TestWorlds;
import org.soulwars.runtime.World;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.event.GameEventType;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TilePosition;
import org.soulwars.runtime.model.Vec2;

/**
 * Unit tests for {@link CombatSystem}.
 */
class CombatSystemTest {

    private World world;
    private SpellSystem spells;
    private CombatSystem combat;

    @BeforeEach
    void setUp() {
        init(TestWorlds.emptyWorld());
    }

    private void init(World w) {
        world = w;
        BuffManager buffs = new BuffManager(world.events());
        spells = new SpellSystem(world, buffs, new DefenderSelector(world));
        combat = new CombatSystem(world, spells, buffs);
    }

    private static void track(Soul attacker, Soul target, long now) {
        attacker.transitionTo(SoulState.ATTACKING, now);
        attacker.setTrackedEnemy(target.id());
    }

    @Test
    @Tag("unit")
    void defenderHitInterruptsTheCast() {
        Soul caster = TestWorlds.adult(world, Faction.LIGHT, 700, 180, 100);
        Soul defender = TestWorlds.adult(world, Faction.DARK, 800, 180, 90);
        caster.transitionTo(SoulState.CASTING, 0);
        caster.setCastTarget(new TilePosition(30, 12));
        spells.update(0);
        world.events().drain();

        combat.update(500);

        assertThat(world.events().view()).extracting(GameEvent::type)
            .containsExactly(GameEventType.ATTACK, GameEventType.SPELL_INTERRUPTED);
        assertThat(caster.energy()).isBetween(50.0, 60.0);
        assertThat(caster.state()).isEqualTo(SoulState.ROAMING);
        assertThat(caster.isRetreating(500)).isTrue();
        assertThat(defender.state()).isEqualTo(SoulState.ROAMING);
        assertThat(world.spells()).isEmpty();

        assertThat(spells.completeSpells(5000)).isZero();
        assertThat(world.tileMap().ownerAt(new TilePosition(30, 12))).isEqualTo(Faction.DARK);
    }

    @Test
    @Tag("unit")
    void attacksRespectTheCooldown() {
        Soul attacker = TestWorlds.adult(world, Faction.LIGHT, 700, 300, 90);
        Soul target = TestWorlds.adult(world, Faction.DARK, 800, 300, 100);
        track(attacker, target, 0);
        combat.update(0);
        assertThat(attacker.lastAttackAt()).isZero();

        track(attacker, target, 0);
        world.events().drain();
        combat.update(1999);
        assertThat(world.events().isEmpty()).isTrue();

        combat.update(2000);
        assertThat(world.events().view()).extracting(GameEvent::type).contains(GameEventType.ATTACK);
    }

    @Test
    @Tag("unit")
    void targetsOutOfRangeAreNotHit() {
        Soul attacker = TestWorlds.adult(world, Faction.LIGHT, 500, 300, 90);
        Soul target = TestWorlds.adult(world, Faction.DARK, 800, 300, 100);
        track(attacker, target, 0);

        combat.update(0);

        assertThat(target.energy()).isEqualTo(100.0);
        assertThat(world.events().isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void childrenAndRetreatingSoulsNeverAttack() {
        Soul child = TestWorlds.child(world, Faction.LIGHT, 700, 300, 90);
        Soul retreating = TestWorlds.adult(world, Faction.LIGHT, 710, 300, 90);
        Soul target = TestWorlds.adult(world, Faction.DARK, 800, 300, 100);
        track(child, target, 0);
        track(retreating, target, 0);
        retreating.takeDamage(1, 0, 5000);

        combat.update(100);

        assertThat(target.energy()).isEqualTo(100.0);
        assertThat(world.events().isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void lethalHitKillsInCombat() {
        Soul attacker = TestWorlds.adult(world, Faction.LIGHT, 700, 300, 90);
        Soul target = TestWorlds.adult(world, Faction.DARK, 800, 300, 10);
        track(attacker, target, 0);

        combat.update(0);

        assertThat(target.isDead()).isTrue();
        assertThat(target.deathCause()).isEqualTo("combat");
    }

    @Test
    @Tag("unit")
    void destroyingTheNexusIsAnnouncedOnce() {
        init(TestWorlds.emptyWorld(TestWorlds.config("game.nexus.maxHealth = 10")));
        Nexus dark = world.nexus(Faction.DARK);
        Soul raider = TestWorlds.adult(world, Faction.LIGHT, dark.position().x(), dark.position().y(), 90);
        raider.transitionTo(SoulState.ATTACKING_NEXUS, 0);

        combat.update(0);

        assertThat(dark.isDestroyed()).isTrue();
        assertThat(world.events().view()).satisfiesExactly(
            updated -> assertThat(updated).isInstanceOfSatisfying(GameEvent.NexusUpdated.class,
                e -> assertThat(e.health()).isZero()),
            destroyed -> assertThat(destroyed).isEqualTo(new GameEvent.NexusDestroyed(Faction.DARK, raider.id())));

        world.events().drain();
        combat.update(5000);
        assertThat(world.events().isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void nexusOutOfRangeIsNotDamaged() {
        Soul raider = TestWorlds.adult(world, Faction.LIGHT, 300, 450, 90);
        raider.transitionTo(SoulState.ATTACKING_NEXUS, 0);

        combat.update(0);

        assertThat(world.nexus(Faction.DARK).health()).isEqualTo(1000.0);
    }

    @Test
    @Tag("unit")
    void distanceToNexusIsMeasuredToItsFootprint() {
        Nexus dark = world.nexus(Faction.DARK);

        assertThat(CombatSystem.distanceToNexus(dark.position(), dark, world.tileMap())).isZero();
        assertThat(CombatSystem.distanceToNexus(new Vec2(1100, 120), dark, world.tileMap()))
            .isCloseTo(75.0, offset(1e-9));
    }
}
