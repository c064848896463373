package org.soulwars.node.http;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.node.GameLoopService;
import org.soulwars.node.ITickListener;
import org.soulwars.runtime.TickResult;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.json.JavalinJackson;
import io.javalin.websocket.WsContext;

/**
 * Publishes the running world to observers.
 * <p>
 * Routes:
 * <ul>
 *   <li>{@code /ws} - WebSocket; sends a {@code world_state} message on connect, then one JSON array of events
 *       per tick and a fresh {@code world_state} every {@code game.loop.worldSyncIntervalMs}</li>
 *   <li>{@code GET /api/world} - the latest world snapshot</li>
 *   <li>{@code GET /api/health} - loop state, last tick and connected observers</li>
 * </ul>
 * Only immutable {@link TickResult}s cross from the game loop into this class.
 * </p>
 */
public class BroadcastServer implements ITickListener {

    private static final Logger LOG = LoggerFactory.getLogger(BroadcastServer.class);

    private final Config options;
    private final GameLoopService loop;
    private final ObjectMapper mapper;
    private final EventMessageMapper messages;
    private final long worldSyncIntervalMs;
    private final Set<WsContext> sessions = ConcurrentHashMap.newKeySet();
    private final AtomicReference<TickResult> latest = new AtomicReference<>();
    private long lastSyncAt = Long.MIN_VALUE;
    private Javalin app;

    /**
     * @param options the {@code node.http} block: {@code host} and {@code port}
     * @param loop    the loop whose state is reported by the health route
     */
    public BroadcastServer(Config options, GameLoopService loop) {
        this(options, loop, new ObjectMapper());
    }

    public BroadcastServer(Config options, GameLoopService loop, ObjectMapper mapper) {
        this.options = options;
        this.loop = loop;
        this.mapper = mapper;
        this.messages = new EventMessageMapper(mapper);
        this.worldSyncIntervalMs = loop.game().config().loop().worldSyncIntervalMs();
    }

    public void start() {
        if (app != null) {
            LOG.warn("Broadcast server is already running.");
            return;
        }
        String host = options.getString("host");
        int port = options.getInt("port");

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jsonMapper(new JavalinJackson(mapper, false));
            config.requestLogger.http((ctx, ms) -> {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Request: {} {} (completed in {} ms)", ctx.method(), ctx.path(), ms);
                }
            });
        });
        registerRoutes(app);
        app.start(host, port);
        LOG.info("Broadcast server started on {}:{}", host, app.port());
    }

    void registerRoutes(Javalin javalin) {
        javalin.get("/api/world", this::getWorld);
        javalin.get("/api/health", this::getHealth);
        javalin.ws("/ws", ws -> {
            ws.onConnect(ctx -> {
                sessions.add(ctx);
                LOG.debug("Observer {} connected ({} total)", ctx.sessionId(), sessions.size());
                TickResult current = latest.get();
                if (current != null) {
                    ctx.send(messages.worldState(current.snapshot()));
                }
            });
            ws.onClose(ctx -> {
                sessions.remove(ctx);
                LOG.debug("Observer {} disconnected ({} left)", ctx.sessionId(), sessions.size());
            });
            ws.onError(ctx -> {
                sessions.remove(ctx);
                LOG.debug("Observer {} dropped after error", ctx.sessionId());
            });
        });
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            sessions.clear();
            LOG.info("Broadcast server stopped.");
        }
    }

    /**
     * @return the bound port, useful when configured with port 0
     */
    public int port() {
        if (app == null) {
            throw new IllegalStateException("Broadcast server is not running");
        }
        return app.port();
    }

    @Override
    public void onTick(TickResult result) {
        latest.set(result);
        if (sessions.isEmpty()) {
            return;
        }
        if (!result.events().isEmpty()) {
            broadcast(messages.eventBatch(result.events()));
        }
        if (lastSyncAt == Long.MIN_VALUE || result.timestamp() - lastSyncAt >= worldSyncIntervalMs) {
            broadcast(messages.worldState(result.snapshot()));
            lastSyncAt = result.timestamp();
        }
    }

    private void broadcast(String message) {
        for (WsContext session : sessions) {
            try {
                session.send(message);
            } catch (RuntimeException e) {
                sessions.remove(session);
                LOG.debug("Dropping observer {}: {}", session.sessionId(), e.getMessage());
            }
        }
    }

    private void getWorld(Context ctx) {
        TickResult current = latest.get();
        if (current == null) {
            ctx.status(HttpStatus.SERVICE_UNAVAILABLE).json(ErrorResponseDto.of(
                HttpStatus.SERVICE_UNAVAILABLE.getCode(), HttpStatus.SERVICE_UNAVAILABLE.getMessage(),
                "No tick has completed yet"));
            return;
        }
        ctx.json(current.snapshot());
    }

    private void getHealth(Context ctx) {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("state", loop.getCurrentState().name());
        health.put("healthy", loop.isHealthy());
        health.put("tick", loop.getLastTick());
        health.put("lastTickDurationMs", loop.getLastTickDurationMs());
        health.put("observers", sessions.size());
        ctx.json(health);
    }

    public int observerCount() {
        return sessions.size();
    }
}
