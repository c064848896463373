package org.soulwars.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.soulwars.runtime.config.GameConfig;

/**
 * The territory grid. Every tile is owned by exactly one faction.
 * <p>
 * Ownership is stored in a flat row-major array ({@code index = y * columns + x}). After construction
 * the only mutator is {@link #capture(TilePosition, int, Faction)}, which converts a whole footprint
 * at once. Each capture that changes at least one tile bumps {@link #version()}, which the scoring
 * system uses to decide when to recompute.
 * </p>
 */
public final class TileMap {

    /**
     * Supplies the initial owner of each tile.
     */
    @FunctionalInterface
    public interface OwnerLayout {
        Faction ownerAt(int x, int y);
    }

    private final int columns;
    private final int rows;
    private final double tileWidth;
    private final double tileHeight;
    private final Faction[] owners;
    private long version;

    public TileMap(int columns, int rows, double tileWidth, double tileHeight, OwnerLayout layout) {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("Tile map must have at least one column and row: " + columns + "x" + rows);
        }
        this.columns = columns;
        this.rows = rows;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.owners = new Faction[columns * rows];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                Faction owner = layout.ownerAt(x, y);
                if (owner == null) {
                    throw new IllegalArgumentException("Tile (" + x + "," + y + ") has no owner");
                }
                owners[y * columns + x] = owner;
            }
        }
    }

    /**
     * Creates the starting map: the left half belongs to {@link Faction#LIGHT}, the right half to {@link Faction#DARK}.
     *
     * @param settings tile map dimensions
     * @return the new map
     */
    public static TileMap splitVertically(GameConfig.TileMapSettings settings) {
        int half = settings.columns() / 2;
        return new TileMap(settings.columns(), settings.rows(), settings.tileWidth(), settings.tileHeight(),
            (x, y) -> x < half ? Faction.LIGHT : Faction.DARK);
    }

    public int columns() {
        return columns;
    }

    public int rows() {
        return rows;
    }

    public double tileWidth() {
        return tileWidth;
    }

    public double tileHeight() {
        return tileHeight;
    }

    public long version() {
        return version;
    }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && x < columns && y >= 0 && y < rows;
    }

    /**
     * @throws IndexOutOfBoundsException if the coordinate lies outside the map
     */
    public Faction ownerAt(int x, int y) {
        if (!isInBounds(x, y)) {
            throw new IndexOutOfBoundsException("Tile (" + x + "," + y + ") outside " + columns + "x" + rows + " map");
        }
        return owners[y * columns + x];
    }

    public Faction ownerAt(TilePosition tile) {
        return ownerAt(tile.x(), tile.y());
    }

    /**
     * @return the tile containing the world point, or {@code null} if the point lies outside the grid
     */
    public TilePosition tileAt(double worldX, double worldY) {
        if (worldX < 0 || worldY < 0) {
            return null;
        }
        int x = (int) Math.floor(worldX / tileWidth);
        int y = (int) Math.floor(worldY / tileHeight);
        return isInBounds(x, y) ? new TilePosition(x, y) : null;
    }

    /**
     * @return the owner of the tile containing the world point, or {@code null} outside the grid
     */
    public Faction ownerAtWorld(double worldX, double worldY) {
        TilePosition tile = tileAt(worldX, worldY);
        return tile == null ? null : owners[tile.y() * columns + tile.x()];
    }

    public double centerX(int x) {
        return x * tileWidth + tileWidth / 2.0;
    }

    public double centerY(int y) {
        return y * tileHeight + tileHeight / 2.0;
    }

    public Vec2 center(TilePosition tile) {
        return new Vec2(centerX(tile.x()), centerY(tile.y()));
    }

    /**
     * Converts the square footprint of {@code radius} tiles around {@code center}, clipped to the map, to {@code faction}.
     * Tiles already owned by {@code faction} are left untouched.
     *
     * @param center footprint centre
     * @param radius footprint half-size ({@code 1} = 3x3)
     * @param faction new owner
     * @return the tiles whose owner actually changed, in row-major order
     */
    public List<TilePosition> capture(TilePosition center, int radius, Faction faction) {
        List<TilePosition> changed = new ArrayList<>();
        for (int y = Math.max(0, center.y() - radius); y <= Math.min(rows - 1, center.y() + radius); y++) {
            for (int x = Math.max(0, center.x() - radius); x <= Math.min(columns - 1, center.x() + radius); x++) {
                int index = y * columns + x;
                if (owners[index] != faction) {
                    owners[index] = faction;
                    changed.add(new TilePosition(x, y));
                }
            }
        }
        if (!changed.isEmpty()) {
            version++;
        }
        return Collections.unmodifiableList(changed);
    }

    public int countOwnedBy(Faction faction) {
        int count = 0;
        for (Faction owner : owners) {
            if (owner == faction) {
                count++;
            }
        }
        return count;
    }

    /**
     * @param tile the tile to inspect
     * @param radius search radius in tiles (Chebyshev)
     * @param faction the faction to look for
     * @return true if any tile within {@code radius} of {@code tile} is owned by {@code faction}
     */
    public boolean anyOwnedWithin(TilePosition tile, int radius, Faction faction) {
        for (int y = Math.max(0, tile.y() - radius); y <= Math.min(rows - 1, tile.y() + radius); y++) {
            for (int x = Math.max(0, tile.x() - radius); x <= Math.min(columns - 1, tile.x() + radius); x++) {
                if (owners[y * columns + x] == faction) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @return a copy of the ownership grid as rows of faction wire codes ({@code 'L'} or {@code 'D'})
     */
    public List<String> encodeRows() {
        List<String> encoded = new ArrayList<>(rows);
        StringBuilder row = new StringBuilder(columns);
        for (int y = 0; y < rows; y++) {
            row.setLength(0);
            for (int x = 0; x < columns; x++) {
                row.append(owners[y * columns + x] == Faction.LIGHT ? 'L' : 'D');
            }
            encoded.add(row.toString());
        }
        return Collections.unmodifiableList(encoded);
    }
}
