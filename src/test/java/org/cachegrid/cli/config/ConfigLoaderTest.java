package org.cachegrid.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.cachegrid.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. Command line overrides (highest priority)
 * 2. System Properties
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
        System.clearProperty("cachegrid.seed");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("test.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void load_shouldProvideReferenceDefaults() {
        Config config = ConfigLoader.load();

        assertEquals(3, config.getInt("cachegrid.interaction.proximity-radius"));
        assertEquals(8, config.getInt("cachegrid.grid.neighborhood-size"));
        assertEquals("tiered", config.getString("cachegrid.generation.strategy.type"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("File values override reference.conf, untouched keys keep their defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        File file = writeConfig("cachegrid { seed = 7, interaction.win-threshold = 64 }");

        Config config = ConfigLoader.load(file, null);

        assertEquals(7L, config.getLong("cachegrid.seed"));
        assertEquals(64, config.getInt("cachegrid.interaction.win-threshold"));
        assertEquals(3, config.getInt("cachegrid.interaction.proximity-radius"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        File file = writeConfig("cachegrid.seed = 7");
        System.setProperty("cachegrid.seed", "11");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file, Map.of());

        assertEquals(11L, config.getLong("cachegrid.seed"));
    }

    @Test
    @DisplayName("Command line overrides win over system properties and files")
    void load_overridesShouldWin() throws IOException {
        File file = writeConfig("cachegrid.seed = 7");
        System.setProperty("cachegrid.seed", "11");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file, Map.of("cachegrid.seed", "13", "cachegrid.generation.spawn-probability", "0.5"));

        assertEquals(13L, config.getLong("cachegrid.seed"));
        assertEquals(0.5, config.getDouble("cachegrid.generation.spawn-probability"));
    }

    @Test
    @DisplayName("Substitutions across sources are resolved")
    void load_shouldResolveSubstitutions() throws IOException {
        File file = writeConfig("base = 5\ncachegrid.interaction.proximity-radius = ${base}");

        Config config = ConfigLoader.load(file, null);

        assertEquals(5, config.getInt("cachegrid.interaction.proximity-radius"));
        assertTrue(config.isResolved());
    }

    @Test
    void load_missingExplicitFileShouldFail() {
        File missing = tempDir.resolve("missing.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(missing, null));
        assertTrue(e.getMessage().contains("missing.conf"));
    }
}
