package org.frugal.ls.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.frugal.ls.junit.extensions.logging.ExpectLog;
import org.frugal.ls.junit.extensions.logging.LogLevel;
import org.frugal.ls.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties over the configuration file over reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("frugal-ls.diagnostics.naming-conventions");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no file is present")
    void load_shouldUseReferenceDefaults() {
        // Act
        Config config = ConfigLoader.load();

        // Assert
        assertTrue(config.getBoolean("frugal-ls.diagnostics.naming-conventions"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Configuration file should override reference.conf")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = tempDir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "frugal-ls.diagnostics.type-references = false\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertFalse(config.getBoolean("frugal-ls.diagnostics.type-references"));
        assertTrue(config.getBoolean("frugal-ls.diagnostics.naming-conventions"));
    }

    @Test
    @DisplayName("System property should override the configuration file")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        File file = tempDir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "frugal-ls.diagnostics.naming-conventions = true\n");
        System.setProperty("frugal-ls.diagnostics.naming-conventions", "false");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertFalse(config.getBoolean("frugal-ls.diagnostics.naming-conventions"));
    }

    @Test
    @DisplayName("A missing explicit file should warn and use defaults")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Configuration file '.*missing.conf' not found. Using defaults.")
    void load_missingExplicitFileShouldWarn() {
        // Act
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        // Assert
        assertEquals(AnalysisOptions.defaults(), AnalysisOptions.fromConfig(config));
    }
}
