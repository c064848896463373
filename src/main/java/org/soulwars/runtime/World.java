package org.soulwars.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.EventBuffer;
import org.soulwars.runtime.model.ActiveSpell;
import org.soulwars.runtime.model.Crater;
import org.soulwars.runtime.model.EnergyOrb;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.OrbId;
import org.soulwars.runtime.model.Soul;
import org.soulwars.runtime.model.SoulId;
import org.soulwars.runtime.model.SpellId;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.TilePosition;
import org.soulwars.runtime.model.Vec2;
import org.soulwars.runtime.spi.IRandomProvider;

/**
 * The authoritative state of one game world: souls, orbs, active spells, nexuses, the tile map and craters.
 * <p>
 * The world is owned by the {@link GameManager}. Systems receive it by reference and mutate entities in place;
 * none of them keeps cross-tick state of its own about entities stored here.
 * </p>
 * <p>
 * Souls are kept sorted by id so every iteration over them is in ascending id order.
 * Lookups of entities that no longer exist return {@code null} or an empty {@link Optional}.
 * </p>
 */
public final class World {

    private final GameConfig config;
    private final IRandomProvider random;
    private final TileMap tileMap;
    private final EventBuffer events = new EventBuffer();

    private final TreeMap<SoulId, Soul> souls = new TreeMap<>();
    private final Map<OrbId, EnergyOrb> orbs = new LinkedHashMap<>();
    private final Map<SpellId, ActiveSpell> spells = new LinkedHashMap<>();
    private final Map<Faction, Nexus> nexuses = new EnumMap<>(Faction.class);
    private final List<Crater> craters = new ArrayList<>();

    private long nextSoulId = 1;
    private long nextSpellId = 1;

    public World(GameConfig config, IRandomProvider random, TileMap tileMap) {
        this.config = config;
        this.random = random;
        this.tileMap = tileMap;
    }

    public GameConfig config() {
        return config;
    }

    public IRandomProvider random() {
        return random;
    }

    public TileMap tileMap() {
        return tileMap;
    }

    public EventBuffer events() {
        return events;
    }

    // ==================== Souls ====================

    /**
     * Creates a soul with the next free id and adds it to the world. The soul gets its own random sub-stream.
     *
     * @return the new soul
     */
    public Soul spawnSoul(Faction faction, Vec2 position, double energy, boolean adult, long now) {
        SoulId id = new SoulId(nextSoulId++);
        Soul soul = Soul.builder(id, faction)
            .position(position)
            .energy(energy)
            .maxEnergy(config.soul().maxEnergy())
            .adult(adult)
            .bornAt(now)
            .random(random.deriveFor("soul", id.value()))
            .historyCapacity(Math.max(2, config.movement().stuckWindowTicks()))
            .build();
        souls.put(id, soul);
        return soul;
    }

    /**
     * Adds an externally built soul. Used by tests that need full control over a soul's state.
     */
    public void addSoul(Soul soul) {
        souls.put(soul.id(), soul);
        nextSoulId = Math.max(nextSoulId, soul.id().value() + 1);
    }

    public Soul removeSoul(SoulId id) {
        return souls.remove(id);
    }

    /**
     * @return the soul, or {@code null} if it does not exist (anymore)
     */
    public Soul soul(SoulId id) {
        return id == null ? null : souls.get(id);
    }

    public Optional<Soul> findSoul(SoulId id) {
        return Optional.ofNullable(soul(id));
    }

    /**
     * @return all souls in ascending id order, including dead souls awaiting removal (live view)
     */
    public Collection<Soul> souls() {
        return Collections.unmodifiableCollection(souls.values());
    }

    /**
     * @return a copy of the soul list, safe to iterate while souls are added or removed
     */
    public List<Soul> soulList() {
        return new ArrayList<>(souls.values());
    }

    public List<Soul> livingSouls() {
        List<Soul> living = new ArrayList<>(souls.size());
        for (Soul soul : souls.values()) {
            if (soul.isAlive()) {
                living.add(soul);
            }
        }
        return living;
    }

    public List<Soul> livingSouls(Faction faction) {
        List<Soul> living = new ArrayList<>();
        for (Soul soul : souls.values()) {
            if (soul.isAlive() && soul.faction() == faction) {
                living.add(soul);
            }
        }
        return living;
    }

    public int countLiving(Faction faction) {
        int count = 0;
        for (Soul soul : souls.values()) {
            if (soul.isAlive() && soul.faction() == faction) {
                count++;
            }
        }
        return count;
    }

    public int countLivingAdults(Faction faction) {
        int count = 0;
        for (Soul soul : souls.values()) {
            if (soul.isAlive() && soul.isAdult() && soul.faction() == faction) {
                count++;
            }
        }
        return count;
    }

    public int soulCount() {
        return souls.size();
    }

    // ==================== Spells ====================

    public SpellId nextSpellId() {
        return new SpellId(nextSpellId++);
    }

    public Map<SpellId, ActiveSpell> spells() {
        return spells;
    }

    public void addSpell(ActiveSpell spell) {
        spells.put(spell.id(), spell);
    }

    public ActiveSpell removeSpell(SpellId id) {
        return spells.remove(id);
    }

    /**
     * @return the active spell cast by {@code casterId}, or {@code null}
     */
    public ActiveSpell spellByCaster(SoulId casterId) {
        for (ActiveSpell spell : spells.values()) {
            if (spell.casterId().equals(casterId)) {
                return spell;
            }
        }
        return null;
    }

    public boolean isTileUnderSpell(TilePosition tile) {
        for (ActiveSpell spell : spells.values()) {
            if (spell.target().equals(tile)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if an active spell targets {@code tile} or another living soul has reserved it as cast target
     */
    public boolean isTileTargeted(TilePosition tile, SoulId except) {
        if (isTileUnderSpell(tile)) {
            return true;
        }
        for (Soul soul : souls.values()) {
            if (soul.isAlive() && !soul.id().equals(except) && tile.equals(soul.castTarget())) {
                return true;
            }
        }
        return false;
    }

    // ==================== Orbs, nexuses, craters ====================

    public Map<OrbId, EnergyOrb> orbs() {
        return orbs;
    }

    public void addOrb(EnergyOrb orb) {
        orbs.put(orb.id(), orb);
    }

    public Nexus nexus(Faction faction) {
        return nexuses.get(faction);
    }

    public Collection<Nexus> nexuses() {
        return Collections.unmodifiableCollection(nexuses.values());
    }

    public void putNexus(Nexus nexus) {
        nexuses.put(nexus.faction(), nexus);
    }

    public List<Crater> craters() {
        return Collections.unmodifiableList(craters);
    }

    public void addCrater(Crater crater) {
        craters.add(crater);
    }
}
