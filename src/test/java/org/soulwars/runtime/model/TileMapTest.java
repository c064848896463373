package org.soulwars.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.config.GameConfig;

/**
 * Unit tests for {@link TileMap}.
 */
class TileMapTest {

    private TileMap tileMap;

    @BeforeEach
    void setUp() {
        tileMap = TileMap.splitVertically(new GameConfig.TileMapSettings(10, 4, 25, 15));
    }

    @Test
    @Tag("unit")
    void startingMapIsSplitDownTheMiddle() {
        assertThat(tileMap.ownerAt(4, 0)).isEqualTo(Faction.LIGHT);
        assertThat(tileMap.ownerAt(5, 0)).isEqualTo(Faction.DARK);
        assertThat(tileMap.countOwnedBy(Faction.LIGHT)).isEqualTo(20);
        assertThat(tileMap.countOwnedBy(Faction.DARK)).isEqualTo(20);
        assertThat(tileMap.version()).isZero();
    }

    @Test
    @Tag("unit")
    void worldCoordinatesMapToTiles() {
        assertThat(tileMap.tileAt(30, 20)).isEqualTo(new TilePosition(1, 1));
        assertThat(tileMap.tileAt(-1, 20)).isNull();
        assertThat(tileMap.tileAt(250, 0)).isNull();
        assertThat(tileMap.ownerAtWorld(130, 5)).isEqualTo(Faction.DARK);
        assertThat(tileMap.center(new TilePosition(2, 1))).isEqualTo(new Vec2(62.5, 22.5));
    }

    @Test
    @Tag("unit")
    void outOfBoundsOwnerLookupThrows() {
        assertThatThrownBy(() -> tileMap.ownerAt(10, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    @Tag("unit")
    void captureReportsOnlyChangedTilesInRowMajorOrder() {
        List<TilePosition> changed = tileMap.capture(new TilePosition(5, 1), 1, Faction.LIGHT);

        assertThat(changed).containsExactly(
            new TilePosition(5, 0), new TilePosition(6, 0),
            new TilePosition(5, 1), new TilePosition(6, 1),
            new TilePosition(5, 2), new TilePosition(6, 2));
        assertThat(tileMap.ownerAt(6, 2)).isEqualTo(Faction.LIGHT);
        assertThat(tileMap.version()).isEqualTo(1L);
    }

    @Test
    @Tag("unit")
    void captureIsClippedAtTheEdgeAndIdempotent() {
        List<TilePosition> first = tileMap.capture(new TilePosition(9, 0), 1, Faction.LIGHT);
        List<TilePosition> second = tileMap.capture(new TilePosition(9, 0), 1, Faction.LIGHT);

        assertThat(first).hasSize(4);
        assertThat(second).isEmpty();
        assertThat(tileMap.version()).isEqualTo(1L);
    }

    @Test
    @Tag("unit")
    void findsOwnersWithinRadius() {
        assertThat(tileMap.anyOwnedWithin(new TilePosition(2, 2), 2, Faction.DARK)).isFalse();
        assertThat(tileMap.anyOwnedWithin(new TilePosition(2, 2), 3, Faction.DARK)).isTrue();
    }

    @Test
    @Tag("unit")
    void encodesRowsAsFactionCodes() {
        tileMap.capture(new TilePosition(0, 0), 0, Faction.DARK);

        assertThat(tileMap.encodeRows()).hasSize(4);
        assertThat(tileMap.encodeRows().get(0)).isEqualTo("DLLLLDDDDD");
        assertThat(tileMap.encodeRows().get(1)).isEqualTo("LLLLLDDDDD");
    }

    @Test
    @Tag("unit")
    void layoutMustAssignEveryTile() {
        assertThatThrownBy(() -> new TileMap(2, 2, 10, 10, (x, y) -> x == 0 ? Faction.LIGHT : null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("has no owner");
    }
}
