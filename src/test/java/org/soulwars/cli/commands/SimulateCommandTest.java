package org.soulwars.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.soulwars.cli.CommandLineInterface;

import picocli.CommandLine;

/**
 * Tests for {@link SimulateCommand} through the full command line.
 */
class SimulateCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    @Tag("unit")
    void printsSummaryAfterTheRequestedTicks() {
        int exitCode = run("simulate", "--ticks", "50");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Ticks: 50 (")
            .contains("light souls=")
            .contains("dark  souls=")
            .contains("Events:")
            .contains("soul_spawn");
    }

    @Test
    @Tag("unit")
    void rejectsNonPositiveTicks() {
        int exitCode = run("simulate", "--ticks", "0");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--ticks must be positive");
    }

    @Test
    @Tag("unit")
    void missingConfigFileExitsWithOne() {
        String missing = tempDir.resolve("missing.conf").toString();

        assertThat(run("--config", missing, "simulate", "--ticks", "5")).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void sameSeedGivesSameSummary() {
        run("simulate", "--ticks", "300", "--seed", "9");
        String first = out.toString();
        run("simulate", "--ticks", "300", "--seed", "9");

        assertThat(out.toString()).isEqualTo(first);
    }
}
