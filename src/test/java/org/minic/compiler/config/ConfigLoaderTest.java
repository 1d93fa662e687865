package org.minic.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader and LoweringConfig, covering the precedence of the layers:
 * 1. System Properties
 * 2. Configuration File
 * 3. Default reference configuration
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("minic.lowering.validate-ast");
        System.clearProperty("minic.lowering.verbosity");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults from reference.conf apply when no file is present")
    void load_shouldFallBackToReferenceDefaults() {
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        assertEquals(LoweringConfig.DEFAULT, LoweringConfig.fromConfig(config));
    }

    @Test
    @DisplayName("File configuration overrides defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        Path file = tempDir.resolve("minic.conf");
        Files.writeString(file, "minic.lowering.validate-ast = true\nminic.lowering.verbosity = 4\n", StandardCharsets.UTF_8);

        LoweringConfig lowering = LoweringConfig.fromConfig(ConfigLoader.load(file.toFile()));

        assertTrue(lowering.validateAst());
        assertFalse(lowering.dumpAst());
        assertEquals(4, lowering.verbosity());
    }

    @Test
    @DisplayName("System property overrides file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        Path file = tempDir.resolve("minic.conf");
        Files.writeString(file, "minic.lowering.verbosity = 4\n", StandardCharsets.UTF_8);
        System.setProperty("minic.lowering.verbosity", "1");
        ConfigFactory.invalidateCaches();

        LoweringConfig lowering = LoweringConfig.fromConfig(ConfigLoader.load(file.toFile()));

        assertEquals(1, lowering.verbosity());
    }

    @Test
    @DisplayName("A directory in place of the file is skipped")
    void load_shouldSkipDirectory() {
        Config config = ConfigLoader.load(tempDir.toFile());

        assertFalse(config.getBoolean("minic.lowering.validate-ast"));
    }

    @Test
    @DisplayName("Classpath resource is layered over reference.conf")
    void loadResource_shouldReadTestResource() {
        LoweringConfig lowering = LoweringConfig.fromConfig(ConfigLoader.loadResource("lowering-test.conf"));

        assertEquals(new LoweringConfig(true, true, 3), lowering);
    }

    @Test
    @DisplayName("Missing section and keys fall back to defaults")
    void fromConfig_shouldUseDefaultsForMissingKeys() {
        assertEquals(LoweringConfig.DEFAULT, LoweringConfig.fromConfig(ConfigFactory.empty()));

        LoweringConfig partial = LoweringConfig.fromConfig(ConfigFactory.parseString("minic.lowering.dump-ast = true"));
        assertEquals(new LoweringConfig(false, true, -1), partial);
    }
}
