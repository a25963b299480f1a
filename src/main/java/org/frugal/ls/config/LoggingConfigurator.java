package org.frugal.ls.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.frugal.ls.features" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures the logging system based on the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The application configuration containing logging settings.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOGGER.debug("Logback is not the active SLF4J binding, ignoring logging configuration.");
            return;
        }

        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            int configuredCount = 0;
            for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
                final String loggerName = entry.getKey();
                final Level level = Level.toLevel(entry.getValue().unwrapped().toString(), Level.INFO);
                context.getLogger(loggerName).setLevel(level);
                configuredCount++;
                LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
            }
            LOGGER.debug("Configured {} specific logger levels.", configuredCount);
        }
    }

    /**
     * Resets the configuration state. Only useful for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
