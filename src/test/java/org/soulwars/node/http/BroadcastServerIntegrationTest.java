package org.soulwars.node.http;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.soulwars.node.GameLoopService;
import org.soulwars.runtime.GameManager;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.internal.services.ManualClock;
import org.soulwars.runtime.internal.services.SeededRandomProvider;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Integration tests for {@link BroadcastServer} on an ephemeral port.
 */
class BroadcastServerIntegrationTest {

    private GameManager game;
    private ManualClock clock;
    private BroadcastServer server;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(0L);
        game = new GameManager(GameConfig.defaults(), clock, new SeededRandomProvider(42L));
        Config loopOptions = ConfigFactory.parseString("shutdownTimeout = 1");
        GameLoopService loop = new GameLoopService("game-loop", loopOptions, game);
        server = new BroadcastServer(ConfigFactory.parseString("host = \"127.0.0.1\"\nport = 0"), loop);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @Tag("integration")
    void worldIsUnavailableBeforeTheFirstTick() {
        given().port(server.port())
            .when().get("/api/world")
            .then().statusCode(503)
            .body("status", equalTo(503))
            .body("message", equalTo("No tick has completed yet"));
    }

    @Test
    @Tag("integration")
    void worldReturnsTheLatestSnapshot() {
        server.onTick(game.tick());

        given().port(server.port())
            .when().get("/api/world")
            .then().statusCode(200)
            .body("tick", equalTo(1))
            .body("souls", hasSize(16))
            .body("tiles", hasSize(60));
    }

    @Test
    @Tag("integration")
    void healthReportsLoopState() {
        given().port(server.port())
            .when().get("/api/health")
            .then().statusCode(200)
            .body("state", equalTo("STOPPED"))
            .body("healthy", equalTo(true))
            .body("observers", equalTo(0));
    }

    @Test
    @Tag("integration")
    void observerReceivesWorldStateAndEvents() throws Exception {
        server.onTick(game.tick());
        List<String> received = new CopyOnWriteArrayList<>();

        WebSocket socket = HttpClient.newHttpClient().newWebSocketBuilder()
            .buildAsync(URI.create("ws://127.0.0.1:" + server.port() + "/ws"), new WebSocket.Listener() {
                private final StringBuilder partial = new StringBuilder();

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    partial.append(data);
                    if (last) {
                        received.add(partial.toString());
                        partial.setLength(0);
                    }
                    webSocket.request(1);
                    return null;
                }
            })
            .join();

        try {
            await().atMost(Duration.ofSeconds(5)).until(() -> !received.isEmpty());
            assertThat(received.get(0)).startsWith("{\"type\":\"world_state\"");

            await().atMost(Duration.ofSeconds(5)).until(() -> server.observerCount() == 1);
            clock.advance(33L);
            server.onTick(game.tick());

            await().atMost(Duration.ofSeconds(5)).until(() -> received.size() >= 2);
            assertThat(received.get(1)).startsWith("[");
        } finally {
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "done").join();
        }
    }
}
