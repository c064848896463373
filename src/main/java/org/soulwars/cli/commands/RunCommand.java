package org.soulwars.cli.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.cli.CommandLineInterface;
import org.soulwars.node.GameLoopService;
import org.soulwars.node.IService;
import org.soulwars.node.http.BroadcastServer;
import org.soulwars.runtime.GameManager;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.internal.services.SystemClock;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * Runs the world in real time and serves it to observers until the process is terminated.
 */
@Command(
    name = "run",
    description = "Run the simulation in real time and serve it over HTTP and WebSocket"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws InterruptedException {
        Config config = parent.getConfig();
        GameConfig gameConfig = GameConfig.fromRoot(config);

        GameManager game = new GameManager(gameConfig, new SystemClock());
        GameLoopService loop = new GameLoopService("game-loop", config.getConfig("node.loop"), game);
        BroadcastServer server = new BroadcastServer(config.getConfig("node.http"), loop);
        loop.addListener(server);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            if (loop.getCurrentState() == IService.State.RUNNING || loop.getCurrentState() == IService.State.PAUSED) {
                loop.stop();
            }
            server.stop();
            stopped.countDown();
        }, "shutdown"));

        server.start();
        loop.start();
        while (!stopped.await(1, TimeUnit.SECONDS)) {
            if (loop.getCurrentState() == IService.State.ERROR) {
                LOG.error("Game loop failed, shutting down");
                server.stop();
                return 1;
            }
        }
        return 0;
    }
}
