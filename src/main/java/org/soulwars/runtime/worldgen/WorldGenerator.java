package org.soulwars.runtime.worldgen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.TilePosition;
import org.soulwars.runtime.snapshot.SoulSnapshot;
import org.soulwars.runtime.spi.IRandomProvider;
import org.soulwars.runtime.systems.TerritoryGuard;

/**
 * Builds the starting world: a tile map split vertically between the factions, one nexus per faction at its
 * configured tile, and {@code spawn.soulsPerTeam} adult souls around each nexus.
 * <p>
 * Souls are created alternating Dark then Light, so ids interleave between the factions.
 * </p>
 */
public final class WorldGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(WorldGenerator.class);

    private final GameConfig config;
    private final IRandomProvider random;

    public WorldGenerator(GameConfig config, IRandomProvider random) {
        this.config = config;
        this.random = random;
    }

    /**
     * @param now creation time of the world; nexus regeneration and soul ages start here
     * @return the populated world, with a {@code soul_spawn} event buffered per initial soul
     */
    public World generate(long now) {
        TileMap tileMap = TileMap.splitVertically(config.tileMap());
        World world = new World(config, random, tileMap);
        GameConfig.NexusSettings nexus = config.nexus();
        world.putNexus(createNexus(tileMap, Faction.LIGHT, new TilePosition(nexus.lightTileX(), nexus.lightTileY()), now));
        world.putNexus(createNexus(tileMap, Faction.DARK, new TilePosition(nexus.darkTileX(), nexus.darkTileY()), now));

        spawnInitialSouls(world, now);
        LOG.debug("Generated {}x{} world with {} souls", tileMap.columns(), tileMap.rows(), world.soulCount());
        return world;
    }

    private Nexus createNexus(TileMap tileMap, Faction faction, TilePosition tile, long now) {
        if (tileMap.ownerAt(tile) != faction) {
            throw new IllegalArgumentException("The " + faction.wireName() + " nexus tile (" + tile.x() + ","
                + tile.y() + ") lies outside its faction's starting territory");
        }
        GameConfig.NexusSettings settings = config.nexus();
        return new Nexus(faction, tile, tileMap.center(tile), settings.size(), settings.maxHealth(), now);
    }

    private void spawnInitialSouls(World world, long now) {
        SpawnLocator locator = new SpawnLocator(new TerritoryGuard(config, world.tileMap()), config.spawn().spawnRadius());
        IRandomProvider spawnRandom = random.deriveFor("spawn", 0);
        GameConfig.SoulSettings soul = config.soul();
        for (int i = 0; i < config.spawn().soulsPerTeam(); i++) {
            for (Faction faction : new Faction[] {Faction.DARK, Faction.LIGHT}) {
                double energy = spawnRandom.nextDouble(soul.startEnergyMin(), soul.startEnergyMax());
                Soul spawned = world.spawnSoul(faction, locator.near(world.nexus(faction), spawnRandom), energy, true, now);
                world.events().emit(new GameEvent.SoulSpawned(SoulSnapshot.of(spawned, now, config.sleep().durationMs())));
            }
        }
    }
}
