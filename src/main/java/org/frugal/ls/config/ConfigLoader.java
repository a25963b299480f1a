package org.frugal.ls.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "frugal-ls.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, using {@value #CONFIG_FILE_NAME} from the working directory if it exists.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dfrugal-ls.diagnostics.naming-conventions=false)
     * 3. Configuration File (the given file, or frugal-ls.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A configuration file chosen by the user, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed.
     */
    public static Config load(File explicitFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final File configFile = explicitFile != null ? explicitFile : new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            if (explicitFile != null) {
                LOG.warn("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            } else {
                LOG.debug("Configuration file '{}' not found. Skipping file-based configuration.", configFile.getPath());
            }
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(propertiesConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
