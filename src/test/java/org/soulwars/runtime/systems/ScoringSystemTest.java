package org.soulwars.runtime.systems;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.TestWorlds;
import org.soulwars.runtime.World;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.TilePosition;

/**
 * Unit tests for {@link ScoringSystem}. With the default layout the frontier rectangle spans tiles
 * (6, 5) to (53, 54); light works the top and left bands, dark the right and bottom bands.
 */
class ScoringSystemTest {

    private World world;
    private ScoringSystem scoring;

    @BeforeEach
    void setUp() {
        world = TestWorlds.emptyWorld();
        scoring = new ScoringSystem(world);
    }

    @Test
    @Tag("unit")
    void frontierRectangleFollowsTheNexuses() {
        assertThat(scoring.borderWidthX()).isEqualTo(4);
        assertThat(scoring.borderWidthY()).isEqualTo(7);
        assertThat(scoring.borderRect()).containsExactly(6, 5, 53, 54);
    }

    @Test
    @Tag("unit")
    void ownTilesAndTilesOffTheBandScoreZero() {
        assertThat(scoring.score(Faction.LIGHT, 20, 10)).isZero();
        assertThat(scoring.score(Faction.LIGHT, 40, 40)).isZero();
        assertThat(scoring.score(Faction.LIGHT, 30, 2)).isZero();
        assertThat(scoring.score(Faction.LIGHT, -1, 0)).isZero();
    }

    @Test
    @Tag("unit")
    void scoreIsManhattanDistanceToTheEnemyNexus() {
        assertThat(scoring.score(Faction.LIGHT, 30, 12)).isEqualTo(18);
        assertThat(scoring.score(Faction.LIGHT, 40, 8)).isEqualTo(7);
        assertThat(scoring.score(Faction.LIGHT, 50, 8)).isZero();
    }

    @Test
    @Tag("unit")
    void bestTileIsTheFarthestFrontierTile() {
        assertThat(scoring.bestTile(Faction.LIGHT, tile -> true)).isEqualTo(new TilePosition(30, 12));
        assertThat(scoring.bestTile(Faction.DARK, tile -> true)).isEqualTo(new TilePosition(29, 47));
    }

    @Test
    @Tag("unit")
    void bestTileSkipsUnavailableTiles() {
        TilePosition taken = new TilePosition(30, 12);

        TilePosition best = scoring.bestTile(Faction.LIGHT, tile -> !tile.equals(taken));

        assertThat(best).isEqualTo(new TilePosition(30, 5));
        assertThat(scoring.hasCapturableTile(Faction.LIGHT, tile -> false)).isFalse();
    }

    @Test
    @Tag("unit")
    void capturedTilesAreRescored() {
        assertThat(scoring.refresh()).isFalse();

        world.tileMap().capture(new TilePosition(30, 12), 1, Faction.LIGHT);

        assertThat(scoring.refresh()).isTrue();
        assertThat(scoring.score(Faction.LIGHT, 30, 12)).isZero();
        assertThat(scoring.score(Faction.DARK, 30, 12)).isZero();
        assertThat(scoring.bestTile(Faction.LIGHT, tile -> true)).isEqualTo(new TilePosition(30, 5));
    }
}
