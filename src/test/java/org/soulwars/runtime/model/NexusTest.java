package org.soulwars.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Nexus}.
 */
class NexusTest {

    private Nexus nexus;

    @BeforeEach
    void setUp() {
        nexus = new Nexus(Faction.DARK, new TilePosition(51, 8), new Vec2(1287.5, 127.5), 8, 100, 0L);
    }

    @Test
    @Tag("unit")
    void footprintIsCentredOnTheTile() {
        assertThat(nexus.occupies(47, 4)).isTrue();
        assertThat(nexus.occupies(54, 11)).isTrue();
        assertThat(nexus.occupies(55, 8)).isFalse();
        assertThat(nexus.occupies(51, 3)).isFalse();
    }

    @Test
    @Tag("unit")
    void manhattanDistanceIsMeasuredToTheFootprintEdge() {
        assertThat(nexus.manhattanToFootprint(50, 8)).isZero();
        assertThat(nexus.manhattanToFootprint(30, 12)).isEqualTo(17 + 1);
        assertThat(nexus.manhattanToFootprint(57, 2)).isEqualTo(3 + 2);
    }

    @Test
    @Tag("unit")
    void onlyTheDestroyingHitReportsDestruction() {
        assertThat(nexus.takeDamage(60)).isFalse();
        assertThat(nexus.takeDamage(60)).isTrue();
        assertThat(nexus.health()).isZero();
        assertThat(nexus.isDestroyed()).isTrue();
        assertThat(nexus.takeDamage(10)).isFalse();
    }

    @Test
    @Tag("unit")
    void regeneratesOncePerIntervalUpToMaximum() {
        nexus.takeDamage(8);

        assertThat(nexus.regenerate(999, 5, 1000)).isFalse();
        assertThat(nexus.regenerate(1000, 5, 1000)).isTrue();
        assertThat(nexus.health()).isEqualTo(97.0);
        assertThat(nexus.regenerate(1500, 5, 1000)).isFalse();
        assertThat(nexus.regenerate(2000, 5, 1000)).isTrue();
        assertThat(nexus.health()).isEqualTo(100.0);
        assertThat(nexus.regenerate(3000, 5, 1000)).isFalse();
    }

    @Test
    @Tag("unit")
    void destroyedNexusNeverRegenerates() {
        nexus.takeDamage(100);

        assertThat(nexus.regenerate(5000, 5, 1000)).isFalse();
        assertThat(nexus.health()).isZero();
    }
}
