package org.soulwars.cli.commands;

import java.io.PrintWriter;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.cli.CommandLineInterface;
import org.soulwars.runtime.GameManager;
import org.soulwars.runtime.TickResult;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.event.GameEventType;
import org.soulwars.runtime.internal.services.ManualClock;
import org.soulwars.runtime.internal.services.SeededRandomProvider;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Nexus;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs a fixed number of ticks on a simulated clock, as fast as possible, and prints a summary.
 * Two runs with the same seed and configuration produce the same summary.
 */
@Command(
    name = "simulate",
    description = "Run a headless, deterministic simulation and print a summary"
)
public class SimulateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SimulateCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-t", "--ticks"}, defaultValue = "1000", description = "Number of ticks to run (default: ${DEFAULT-VALUE})")
    private int ticks;

    @Option(names = {"-s", "--seed"}, description = "Random seed (default: game.loop.seed)")
    private Long seed;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (ticks <= 0) {
            spec.commandLine().getErr().println("--ticks must be positive");
            return 2;
        }
        GameConfig config = GameConfig.fromRoot(parent.getConfig());
        long effectiveSeed = seed != null ? seed : config.loop().seed();
        ManualClock clock = new ManualClock(0L);
        GameManager game = new GameManager(config, clock, new SeededRandomProvider(effectiveSeed));

        LOG.info("Simulating {} ticks with seed {}", ticks, effectiveSeed);
        Map<GameEventType, Integer> eventCounts = new EnumMap<>(GameEventType.class);
        long started = System.nanoTime();
        for (int i = 0; i < ticks; i++) {
            clock.advance(config.loop().frameMillis());
            TickResult result = game.tick();
            for (GameEvent event : result.events()) {
                eventCounts.merge(event.type(), 1, Integer::sum);
            }
        }
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        LOG.info("Simulation finished in {}ms", elapsedMs);

        printSummary(out, game, clock.currentTimeMillis(), eventCounts);
        return 0;
    }

    private static void printSummary(PrintWriter out, GameManager game, long simulatedMillis,
                                     Map<GameEventType, Integer> eventCounts) {
        out.printf("Ticks: %d (%.1fs simulated)%n", game.currentTick(), simulatedMillis / 1000.0);
        for (Faction faction : Faction.values()) {
            Nexus nexus = game.world().nexus(faction);
            out.printf("%-5s souls=%d adults=%d tiles=%d nexus=%.0f/%.0f%s%n",
                faction.wireName(),
                game.world().countLiving(faction),
                game.world().countLivingAdults(faction),
                game.world().tileMap().countOwnedBy(faction),
                nexus.health(),
                nexus.maxHealth(),
                nexus.isDestroyed() ? " (destroyed)" : "");
        }
        out.println("Events:");
        for (Map.Entry<GameEventType, Integer> entry : eventCounts.entrySet()) {
            out.printf("  %-24s %d%n", entry.getKey().wireName(), entry.getValue());
        }
        out.flush();
    }
}
