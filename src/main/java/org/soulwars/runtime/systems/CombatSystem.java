package org.soulwars.runtime.systems;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.Vec2;

/**
 * Resolves attacks. A soul attacks only the enemy it was assigned to (while DEFENDING or ATTACKING) or,
 * while ATTACKING_NEXUS, the enemy nexus. Attacks need range and an elapsed per-soul cooldown; retreating
 * souls and children never attack. Every hit on a soul interrupts whatever spell it was channeling.
 */
public final class CombatSystem {

    private static final Logger LOG = LoggerFactory.getLogger(CombatSystem.class);

    private final World world;
    private final GameConfig config;
    private final SpellSystem spells;
    private final BuffManager buffs;

    public CombatSystem(World world, SpellSystem spells, BuffManager buffs) {
        this.world = world;
        this.config = world.config();
        this.spells = spells;
        this.buffs = buffs;
    }

    public void update(long now) {
        for (Soul attacker : world.soulList()) {
            if (!attacker.isAlive() || attacker.isChild() || attacker.isRetreating(now)) {
                continue;
            }
            if (!attacker.isAttackOffCooldown(now, config.soul().attackCooldownMs())) {
                continue;
            }
            if (attacker.state().isCombatState()) {
                Soul target = world.soul(attacker.trackedEnemy());
                if (target == null || target.isDead() || target.faction() == attacker.faction()) {
                    continue;
                }
                if (attacker.distanceTo(target) <= config.soul().attackRange()) {
                    attack(attacker, target, now);
                }
            } else if (attacker.state() == SoulState.ATTACKING_NEXUS) {
                Nexus nexus = world.nexus(attacker.faction().opponent());
                if (nexus != null && !nexus.isDestroyed()
                    && distanceToNexus(attacker.position(), nexus, world.tileMap()) <= config.soul().attackRange()) {
                    attackNexus(attacker, nexus, now);
                }
            }
        }
    }

    void attack(Soul attacker, Soul target, long now) {
        double damage = rollDamage(attacker);
        attacker.recordAttack(now);
        target.takeDamage(damage, now, config.retreat().durationMs());
        world.events().emit(new GameEvent.Attack(attacker.id(), target.id(), damage, target.energy(),
            attacker.position(), target.position()));
        LOG.debug("{} hit {} for {}", attacker.id(), target.id(), damage);
        spells.interrupt(target, SpellSystem.REASON_ATTACKED, now);
    }

    void attackNexus(Soul attacker, Nexus nexus, long now) {
        double damage = rollDamage(attacker);
        attacker.recordAttack(now);
        boolean destroyed = nexus.takeDamage(damage);
        world.events().emit(new GameEvent.NexusUpdated(nexus.faction(), nexus.health(), nexus.maxHealth(), attacker.id()));
        if (destroyed) {
            world.events().emit(new GameEvent.NexusDestroyed(nexus.faction(), attacker.id()));
            LOG.info("The {} nexus was destroyed by {}", nexus.faction().wireName(), attacker.id());
        }
    }

    private double rollDamage(Soul attacker) {
        GameConfig.SoulSettings soul = config.soul();
        double base = attacker.random().nextDouble(soul.attackDamageMin(), soul.attackDamageMax());
        return base * buffs.multiplier(attacker.faction(), BuffEffect.DAMAGE);
    }

    /**
     * @return distance in world units from {@code point} to the nexus footprint rectangle, 0 inside it
     */
    public static double distanceToNexus(Vec2 point, Nexus nexus, TileMap tileMap) {
        int half = nexus.size() / 2;
        double left = (nexus.tile().x() - half) * tileMap.tileWidth();
        double right = (nexus.tile().x() + half) * tileMap.tileWidth();
        double top = (nexus.tile().y() - half) * tileMap.tileHeight();
        double bottom = (nexus.tile().y() + half) * tileMap.tileHeight();
        double dx = Math.max(0, Math.max(left - point.x(), point.x() - right));
        double dy = Math.max(0, Math.max(top - point.y(), point.y() - bottom));
        return Math.sqrt(dx * dx + dy * dy);
    }
}
