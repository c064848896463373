package org.soulwars.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.cli.commands.RunCommand;
import org.soulwars.cli.commands.SimulateCommand;
import org.soulwars.cli.config.ConfigLoader;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "soulwars",
    mixinStandardHelpOptions = true,
    version = "Soul Wars 1.0",
    description = "Soul Wars - autonomous two-faction territory simulation",
    subcommands = {
        RunCommand.class,
        SimulateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: config/soulwars.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with the same setup as the entry point. Configuration errors raised by a
     * subcommand are logged and turned into exit code 1.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("soulwars");
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            if (e instanceof IllegalArgumentException || e instanceof ConfigException) {
                LOG.error(e.getMessage());
                return 1;
            }
            throw e;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws IllegalArgumentException if the configuration file is missing or invalid
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        try {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.info(message);
                    case WARN -> LOG.warn(message);
                }
            });
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
        applyLogging(config);
        return config;
    }

    private static void applyLogging(Config config) {
        if (!config.hasPath("logging")) {
            return;
        }
        if (config.hasPath("logging.format")) {
            String format = config.getString("logging.format");
            System.setProperty("soulwars.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
        }
        if (config.hasPath("logging.level")) {
            System.setProperty("soulwars.logging.level", config.getString("logging.level"));
        }
        reconfigureLogback();
    }

    private static void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
