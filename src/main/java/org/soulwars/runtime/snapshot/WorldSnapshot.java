package org.soulwars.runtime.snapshot;

import java.util.List;

import org.soulwars.runtime.model.Buff;
import org.soulwars.runtime.model.Crater;
import org.soulwars.runtime.model.DayPhase;

/**
 * Immutable picture of the whole world at the end of a tick. This is the only object the network
 * layer reads; it shares no mutable state with the simulation.
 *
 * @param tiles ownership grid, one string per row of {@code 'L'} and {@code 'D'} codes
 * @param activeDisaster wire name of the running disaster, {@code null} if none
 */
public record WorldSnapshot(
    long tick,
    long timestamp,
    double width,
    double height,
    int columns,
    int rows,
    double tileWidth,
    double tileHeight,
    List<String> tiles,
    List<SoulSnapshot> souls,
    List<OrbSnapshot> orbs,
    List<SpellSnapshot> spells,
    List<NexusSnapshot> nexuses,
    List<Crater> craters,
    List<Buff> buffs,
    DayPhase phase,
    double ambientLight,
    String activeDisaster) {

    public WorldSnapshot {
        tiles = List.copyOf(tiles);
        souls = List.copyOf(souls);
        orbs = List.copyOf(orbs);
        spells = List.copyOf(spells);
        nexuses = List.copyOf(nexuses);
        craters = List.copyOf(craters);
        buffs = List.copyOf(buffs);
    }
}
