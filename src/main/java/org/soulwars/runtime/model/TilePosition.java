package org.soulwars.runtime.model;

/**
 * Grid coordinate of a tile (column {@code x}, row {@code y}).
 */
public record TilePosition(int x, int y) {

    public int manhattanDistance(TilePosition other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }
}
