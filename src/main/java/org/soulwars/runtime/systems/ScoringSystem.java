package org.soulwars.runtime.systems;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Nexus;
import org.soulwars.runtime.model.TileMap;
import org.soulwars.runtime.model.TilePosition;

/**
 * Per-faction desirability of every tile, used to pick seek and cast targets.
 * <p>
 * Both nexuses span a rectangular frontier ({@code borderRect}). Light may only target the top and left
 * bands of that rectangle, Dark only the right and bottom bands. Within its bands a tile not owned by the
 * faction scores the Manhattan distance to the nearest enemy nexus footprint tile, so tiles far from the
 * enemy core (close to the own base) are preferred and the front advances incrementally.
 * </p>
 * <p>
 * Scores are held in one row-major matrix per faction and recomputed in full when the tile map's
 * version changes. All scans run row-major (y outer, x inner); on equal scores the first visited tile wins.
 * </p>
 */
public final class ScoringSystem {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringSystem.class);

    private final TileMap tileMap;
    private final Nexus lightNexus;
    private final Nexus darkNexus;
    private final int borderWidthX;
    private final int borderWidthY;
    private final int left;
    private final int top;
    private final int right;
    private final int bottom;

    private final Map<Faction, int[]> scores = new EnumMap<>(Faction.class);
    private long computedVersion = -1;

    public ScoringSystem(World world) {
        this(world.config(), world.tileMap(), world.nexus(Faction.LIGHT), world.nexus(Faction.DARK));
    }

    public ScoringSystem(GameConfig config, TileMap tileMap, Nexus lightNexus, Nexus darkNexus) {
        this.tileMap = tileMap;
        this.lightNexus = lightNexus;
        this.darkNexus = darkNexus;
        double band = config.territory().borderBand();
        this.borderWidthX = (int) Math.ceil(band / tileMap.tileWidth());
        this.borderWidthY = (int) Math.ceil(band / tileMap.tileHeight());
        this.left = lightNexus.tile().x() - borderWidthX / 2;
        this.top = darkNexus.tile().y() - borderWidthY / 2;
        this.right = darkNexus.tile().x() + borderWidthX / 2;
        this.bottom = lightNexus.tile().y() + borderWidthY / 2;
        for (Faction faction : Faction.values()) {
            scores.put(faction, new int[tileMap.columns() * tileMap.rows()]);
        }
        refresh();
    }

    /**
     * Recomputes both score matrices if tile ownership changed since the last computation.
     *
     * @return true if a recomputation happened
     */
    public boolean refresh() {
        if (computedVersion == tileMap.version()) {
            return false;
        }
        int columns = tileMap.columns();
        for (Faction faction : Faction.values()) {
            int[] matrix = scores.get(faction);
            for (int y = 0; y < tileMap.rows(); y++) {
                for (int x = 0; x < columns; x++) {
                    matrix[y * columns + x] = computeScore(x, y, faction);
                }
            }
        }
        computedVersion = tileMap.version();
        LOG.debug("Recomputed territory scores for map version {}", computedVersion);
        return true;
    }

    private int computeScore(int x, int y, Faction faction) {
        if (!isInBorderRect(x, y)) {
            return 0;
        }
        if (tileMap.ownerAt(x, y) == faction) {
            return 0;
        }
        Nexus enemyNexus = faction == Faction.LIGHT ? darkNexus : lightNexus;
        if (enemyNexus.occupies(x, y)) {
            return 0;
        }
        if (!isOnAssignedBand(x, y, faction)) {
            return 0;
        }
        return enemyNexus.manhattanToFootprint(x, y);
    }

    private boolean isInBorderRect(int x, int y) {
        return x >= left && x <= right && y >= top && y <= bottom;
    }

    /**
     * @return true if the tile lies inside the frontier rectangle on one of the two sides assigned to {@code faction}
     */
    public boolean isOnAssignedBand(int x, int y, Faction faction) {
        if (!isInBorderRect(x, y)) {
            return false;
        }
        if (faction == Faction.LIGHT) {
            return y <= top + borderWidthY || x <= left + borderWidthX;
        }
        return x >= right - borderWidthX || y >= bottom - borderWidthY;
    }

    /**
     * @return the score of the tile for {@code faction}, 0 outside the map
     */
    public int score(Faction faction, int x, int y) {
        refresh();
        if (!tileMap.isInBounds(x, y)) {
            return 0;
        }
        return scores.get(faction)[y * tileMap.columns() + x];
    }

    public int score(Faction faction, TilePosition tile) {
        return score(faction, tile.x(), tile.y());
    }

    /**
     * Finds the highest scoring tile for {@code faction} among the tiles accepted by {@code available}.
     *
     * @param faction the faction looking for a target
     * @param available filter applied to tiles with a positive score (e.g. "not already targeted")
     * @return the best tile, the first in row-major order on ties, or {@code null} if no tile has a positive score
     */
    public TilePosition bestTile(Faction faction, Predicate<TilePosition> available) {
        refresh();
        int[] matrix = scores.get(faction);
        int columns = tileMap.columns();
        int bestScore = 0;
        TilePosition best = null;
        for (int y = 0; y < tileMap.rows(); y++) {
            for (int x = 0; x < columns; x++) {
                int score = matrix[y * columns + x];
                if (score > bestScore) {
                    TilePosition candidate = new TilePosition(x, y);
                    if (available.test(candidate)) {
                        bestScore = score;
                        best = candidate;
                    }
                }
            }
        }
        return best;
    }

    /**
     * @return true if at least one tile scores above zero for {@code faction} and passes {@code available}
     */
    public boolean hasCapturableTile(Faction faction, Predicate<TilePosition> available) {
        return bestTile(faction, available) != null;
    }

    public int borderWidthX() {
        return borderWidthX;
    }

    public int borderWidthY() {
        return borderWidthY;
    }

    /**
     * @return the frontier rectangle as {@code [left, top, right, bottom]} in tiles
     */
    public int[] borderRect() {
        return new int[] {left, top, right, bottom};
    }
}
