package org.soulwars.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Composes the application configuration for the CLI.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dgame.loop.seed=7})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are stacked, so an override of a referenced value
 * reaches every place that references it.
 * </p>
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "soulwars.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and composes the full configuration. The file is looked up in
     * this order: the {@code --config} option, the {@code -Dconfig.file} property, then
     * {@code config/soulwars.conf} in the working directory. Without any of them only the classpath
     * defaults apply.
     *
     * @param explicitConfigFile file given on the command line, or {@code null}
     * @param handler            receives the resolution messages
     * @return the resolved configuration
     * @throws IllegalArgumentException                if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException     if a file cannot be parsed or resolved
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                    "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                    "Configuration file specified via -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + "' found, using default configuration from classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
