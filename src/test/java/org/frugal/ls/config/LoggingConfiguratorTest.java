package org.frugal.ls.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LOGGER = "org.frugal.ls.sample";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesConfiguredLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER + "\" = ERROR }"));

        assertThat(context.getLogger(LOGGER).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configuresOnlyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER + "\" = ERROR }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER + "\" = DEBUG }"));

        assertThat(context.getLogger(LOGGER).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void ignoresConfigWithoutLoggingBlock() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(LOGGER).getLevel()).isNull();
    }
}
