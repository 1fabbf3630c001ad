package org.cachegrid.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "cachegrid.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration without explicit file or overrides.
     *
     * @return The resolved configuration.
     * @see #load(File, Map)
     */
    public static Config load() {
        return load(null, Map.of());
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Explicit overrides (CLI {@code -Dkey=value} options)
     * 2. Java System Properties
     * 3. Environment Variables
     * 4. Configuration File (the given file, else cachegrid.conf in the working directory)
     * 5. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null} to look for cachegrid.conf.
     * @param overrides Explicit key/value overrides, may be {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit configuration file does not exist.
     * @throws com.typesafe.config.ConfigException if a source cannot be parsed or resolved.
     */
    public static Config load(final File configFile, final Map<String, String> overrides) {
        // 1. Explicit overrides (highest precedence).
        final Config overrideConfig = (overrides == null || overrides.isEmpty())
            ? ConfigFactory.empty()
            : ConfigFactory.parseMap(overrides, "command line overrides");

        // 2. System properties passed to the JVM.
        final Config systemConfig = ConfigFactory.systemProperties();

        // 3. Environment variables, reachable from the files through substitutions such as ${?CACHEGRID_SEED}.
        final Config envConfig = ConfigFactory.systemEnvironment();

        // 4. Configuration file from the filesystem.
        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using classpath defaults.", cwdFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        // 5. Default values from reference.conf in the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = overrideConfig
            .withFallback(systemConfig)
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        // Resolve all substitutions (e.g., ${?CACHEGRID_SEED}) within the configuration.
        return combinedConfig.resolve();
    }
}
