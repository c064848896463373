package org.soulwars.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.runtime.GameManager;
import org.soulwars.runtime.TestWorlds;
import org.soulwars.runtime.internal.services.SeededRandomProvider;
import org.soulwars.runtime.internal.services.SystemClock;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link GameLoopService}.
 */
class GameLoopServiceTest {

    private GameLoopService loop;

    @BeforeEach
    void setUp() {
        GameManager game = new GameManager(TestWorlds.config("game.loop.frameMillis = 5"), new SystemClock(),
            new SeededRandomProvider(42L));
        Config options = ConfigFactory.parseMap(Map.of("shutdownTimeout", 2));
        loop = new GameLoopService("game-loop", options, game);
    }

    @AfterEach
    void tearDown() {
        IService.State state = loop.getCurrentState();
        if (state == IService.State.RUNNING || state == IService.State.PAUSED) {
            loop.stop();
        }
    }

    @Test
    @Tag("unit")
    void runsTicksAndNotifiesListeners() {
        AtomicInteger seen = new AtomicInteger();
        loop.addListener(result -> seen.incrementAndGet());

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> loop.getLastTick() >= 5);
        assertThat(seen.get()).isGreaterThanOrEqualTo(5);
        assertThat(loop.getCurrentState()).isEqualTo(IService.State.RUNNING);
        assertThat(loop.isHealthy()).isTrue();
    }

    @Test
    @Tag("unit")
    void pauseHaltsTheLoopUntilResumed() {
        loop.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> loop.getLastTick() >= 2);

        loop.pause();
        assertThat(loop.getCurrentState()).isEqualTo(IService.State.PAUSED);
        long pausedAt = loop.getLastTick();

        await().pollDelay(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
            .untilAsserted(() -> assertThat(loop.getLastTick()).isLessThanOrEqualTo(pausedAt + 1));

        loop.resume();
        await().atMost(Duration.ofSeconds(5)).until(() -> loop.getLastTick() > pausedAt + 3);

        loop.stop();
        assertThat(loop.getCurrentState()).isEqualTo(IService.State.STOPPED);
    }

    @Test
    @Tag("unit")
    void refusesToStartTwice() {
        loop.start();

        assertThatThrownBy(() -> loop.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("game-loop");
    }

    @Test
    @Tag("unit")
    void failingListenerIsCountedAndLoopKeepsRunning() {
        loop.addListener(result -> {
            throw new IllegalStateException("observer gone");
        });

        loop.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> loop.getLastTick() >= 3);
        assertThat(loop.getCurrentState()).isEqualTo(IService.State.RUNNING);
        assertThat(loop.getErrorCount()).isPositive();
        assertThat(loop.isHealthy()).isFalse();
    }
}
