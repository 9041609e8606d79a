package org.scallopsim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.scallopsim.junit.logging.LogWatchExtension;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Environment overrides
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
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
        System.clearProperty("scallop.time.step");
        System.clearProperty("scallop.filament.segments");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference defaults when no file is given")
    void load_shouldUseReferenceDefaults() {
        Config config = ConfigLoader.load();

        assertEquals("boundary-element", config.getString("scallop.model"));
        assertEquals("explicit-euler", config.getString("scallop.integrator"));
        assertEquals(100, config.getInt("scallop.filament.segments"));
        assertEquals(0.002, config.getDouble("scallop.time.step"));
        assertEquals(0.01, config.getDouble("scallop.boundary-element.regularization"));
        assertEquals(6, config.getInt("scallop.boundary-element.quadrature-order"));
        assertEquals("scallop_results.txt", config.getString("scallop.output.file"));
    }

    @Test
    @DisplayName("Configuration file should override defaults and keep the rest")
    void load_fileShouldOverrideDefaults() throws IOException {
        File file = writeConfig("scallop { filament.segments = 40, time.duration = 2.0 }");

        Config config = ConfigLoader.load(file);

        assertEquals(40, config.getInt("scallop.filament.segments"));
        assertEquals(2.0, config.getDouble("scallop.time.duration"));
        assertEquals(1.0, config.getDouble("scallop.kinematics.amplitude")); // default kept
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        File file = writeConfig("scallop { filament.segments = 40, time.step = 0.01 }");
        System.setProperty("scallop.time.step", "0.004");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertEquals(0.004, config.getDouble("scallop.time.step"));
        assertEquals(40, config.getInt("scallop.filament.segments")); // file value (no override)
    }

    @Test
    @DisplayName("System property should override defaults without a file")
    void load_systemPropertyShouldOverrideDefaults() {
        System.setProperty("scallop.filament.segments", "12");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load();

        assertEquals(12, config.getInt("scallop.filament.segments"));
    }

    @Test
    @DisplayName("Should resolve substitutions across layers")
    void load_shouldResolveSubstitutions() throws IOException {
        File file = writeConfig("scallop { time.duration = ${scallop.kinematics.period} }");

        Config config = ConfigLoader.load(file);

        assertEquals(1.0, config.getDouble("scallop.time.duration"));
    }

    @Test
    @DisplayName("Should reject an explicit file that does not exist")
    void load_shouldRejectMissingExplicitFile() {
        File missing = tempDir.resolve("missing.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("missing.conf"));
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("scallop.conf");
        Files.writeString(file, content);
        return file.toFile();
    }
}
