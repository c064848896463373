package org.soulwars.runtime.systems;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.EnergyOrb;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.OrbId;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulState;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.TilePosition;
import org.soulwars.runtime.model.Vec2;
import org.soulwars.runtime.spi.IRandomProvider;

/**
 * Energy orb placement, collection and respawn.
 * <p>
 * Orbs are placed on a random own tile that keeps {@code edgeBuffer} tiles to the map edge and has no enemy
 * tile within {@code enemyClearance} tiles. If no tile qualifies the orb is placed at the world centre.
 * Only HUNGRY souls of the orb's faction collect, at most one orb per soul and tick, and an orb waiting for
 * respawn is never collectible.
 * </p>
 */
public final class OrbSystem {

    private static final Logger LOG = LoggerFactory.getLogger(OrbSystem.class);

    private final World world;
    private final GameConfig.OrbSettings settings;
    private final BuffManager buffs;
    private final IRandomProvider random;

    public OrbSystem(World world, BuffManager buffs) {
        this.world = world;
        this.settings = world.config().orb();
        this.buffs = buffs;
        this.random = world.random().deriveFor("orb", 0);
    }

    /**
     * Creates {@code perTeam} orbs for both factions and emits an {@code orb_spawned} event for each.
     */
    public void spawnInitialOrbs() {
        for (int i = 0; i < settings.perTeam(); i++) {
            for (Faction faction : Faction.values()) {
                EnergyOrb orb = new EnergyOrb(new OrbId(faction, i), faction, settings.energyValue(),
                    findSpawnPosition(faction));
                world.addOrb(orb);
                emitSpawned(orb);
            }
        }
        LOG.debug("Placed {} energy orbs per faction", settings.perTeam());
    }

    public void update(long now) {
        collect(now);
        respawn(now);
    }

    /**
     * @return the number of orbs collected in this call
     */
    int collect(long now) {
        int collected = 0;
        for (Soul soul : world.souls()) {
            if (!soul.isAlive() || soul.state() != SoulState.HUNGRY) {
                continue;
            }
            for (EnergyOrb orb : world.orbs().values()) {
                if (!orb.isAvailable() || orb.faction() != soul.faction()) {
                    continue;
                }
                if (soul.distanceTo(orb.position()) >= settings.collectionRadius()) {
                    continue;
                }
                double gained = orb.energyValue() * buffs.multiplier(soul.faction(), BuffEffect.ENERGY);
                soul.addEnergy(gained);
                long respawnAt = now + Math.round(random.nextDouble(settings.respawnMinMs(), settings.respawnMaxMs()));
                orb.markCollected(respawnAt);
                world.events().emit(new GameEvent.OrbCollected(orb.id(), soul.id(), soul.faction(), gained, orb.respawnAt()));
                collected++;
                break;
            }
        }
        return collected;
    }

    /**
     * @return the number of orbs that reappeared
     */
    int respawn(long now) {
        int respawned = 0;
        for (EnergyOrb orb : world.orbs().values()) {
            if (orb.isDueForRespawn(now)) {
                orb.respawnAt(findSpawnPosition(orb.faction()));
                emitSpawned(orb);
                respawned++;
            }
        }
        return respawned;
    }

    Vec2 findSpawnPosition(Faction faction) {
        TileMap tileMap = world.tileMap();
        int buffer = settings.edgeBuffer();
        List<TilePosition> candidates = new ArrayList<>();
        for (int y = buffer; y < tileMap.rows() - buffer; y++) {
            for (int x = buffer; x < tileMap.columns() - buffer; x++) {
                if (tileMap.ownerAt(x, y) != faction) {
                    continue;
                }
                TilePosition tile = new TilePosition(x, y);
                if (!tileMap.anyOwnedWithin(tile, settings.enemyClearance(), faction.opponent())) {
                    candidates.add(tile);
                }
            }
        }
        if (candidates.isEmpty()) {
            LOG.debug("No safe orb tile left for {}, using the world centre", faction.wireName());
            GameConfig.WorldSettings size = world.config().world();
            return new Vec2(size.width() / 2, size.height() / 2);
        }
        Vec2 center = tileMap.center(candidates.get(random.nextInt(candidates.size())));
        return new Vec2(
            center.x() + (random.nextDouble() - 0.5) * settings.spawnOffsetX(),
            center.y() + (random.nextDouble() - 0.5) * settings.spawnOffsetY());
    }

    private void emitSpawned(EnergyOrb orb) {
        Vec2 position = orb.position();
        world.events().emit(new GameEvent.OrbSpawned(orb.id(), orb.faction(), position.x(), position.y()));
    }
}
