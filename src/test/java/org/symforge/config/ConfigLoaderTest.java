package org.symforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.symforge.junit.extensions.logging.LogWatchExtension;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. Environment variables and system properties
 * 2. Configuration file
 * 3. Defaults from reference.conf
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String BASIC_TYPES = "symforge.symbol-set.add-basic-c-types";
    private static final String ARRAY_TYPES = "symforge.symbol-set.demand-create-array-types";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(BASIC_TYPES);
        System.clearProperty(ARRAY_TYPES);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference defaults when the file is missing")
    void load_missingFileUsesDefaults() {
        Config config = ConfigLoader.load(tempDir.resolve("absent.conf").toFile());

        assertTrue(config.getBoolean(BASIC_TYPES));
        assertTrue(config.getBoolean(ARRAY_TYPES));
        assertEquals("INFO", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Should treat a directory like a missing file")
    void load_directoryIsIgnored() {
        Config config = ConfigLoader.load(tempDir.toFile());

        assertTrue(config.getBoolean(BASIC_TYPES));
    }

    @Test
    @DisplayName("File configuration should override reference defaults")
    void load_fileOverridesDefaults() throws IOException {
        File file = write("symforge.symbol-set.add-basic-c-types = false\n");

        Config config = ConfigLoader.load(file);

        assertFalse(config.getBoolean(BASIC_TYPES));
        assertTrue(config.getBoolean(ARRAY_TYPES));
        assertTrue(config.getStringList("symforge.range-builder.alias-mnemonics").contains("mov"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyOverridesFile() throws IOException {
        File file = write("""
            symforge.symbol-set {
              add-basic-c-types = false
              demand-create-array-types = false
            }
            """);
        System.setProperty(BASIC_TYPES, "true");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertTrue(config.getBoolean(BASIC_TYPES));
        assertFalse(config.getBoolean(ARRAY_TYPES));
    }

    @Test
    @DisplayName("Should resolve substitutions across layers")
    void load_resolvesSubstitutions() throws IOException {
        File file = write("""
            base-level = "DEBUG"
            logging.levels { "org.symforge.ranges" = ${base-level} }
            """);

        Config config = ConfigLoader.load(file);

        assertEquals("DEBUG", config.getString("logging.levels.\"org.symforge.ranges\""));
    }

    private File write(String content) throws IOException {
        Path file = tempDir.resolve("symforge.conf");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }
}
