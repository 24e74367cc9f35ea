package org.pysymphony.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: file selection and the override order
 * system properties, environment, file, reference defaults.
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
        System.clearProperty("pysymphony.merge.output-suffix");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void loadDefaults_shouldContainReferenceValues() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals("_merged", config.getString("pysymphony.merge.output-suffix"));
        assertTrue(config.getBoolean("pysymphony.merge.verify"));
        assertEquals("INFO", config.getConfig("logging.levels").root().get("org.pysymphony").unwrapped());
    }

    @Test
    @DisplayName("File values override defaults and keep the rest")
    void loadFromFile_shouldOverrideDefaults() throws IOException {
        File file = writeConfig("custom.conf", "pysymphony.merge.verify = false\n");

        Config config = ConfigLoader.loadFromFile(file);

        assertFalse(config.getBoolean("pysymphony.merge.verify"));
        assertEquals("_merged", config.getString("pysymphony.merge.output-suffix"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() throws IOException {
        File file = writeConfig("custom.conf", "pysymphony.merge.output-suffix = \"_file\"\n");
        System.setProperty("pysymphony.merge.output-suffix", "_system");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(file);

        assertEquals("_system", config.getString("pysymphony.merge.output-suffix"));
    }

    @Test
    @DisplayName("Explicit --config file is used and reported")
    void resolve_shouldUseExplicitFile() throws IOException {
        File file = writeConfig("explicit.conf", "pysymphony.merge.output-suffix = \"_explicit\"\n");
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(message));

        assertEquals("_explicit", config.getString("pysymphony.merge.output-suffix"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).contains("--config"));
    }

    @Test
    @DisplayName("Missing explicit file is an error")
    void resolve_missingExplicitFileShouldThrow() {
        File missing = tempDir.resolve("missing.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("missing.conf"));
    }

    @Test
    @DisplayName("-Dconfig.file is honoured when no --config is given")
    void resolve_shouldUseConfigFileProperty() throws IOException {
        File file = writeConfig("property.conf", "pysymphony.merge.output-suffix = \"_property\"\n");
        System.setProperty("config.file", file.getAbsolutePath());
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.resolve(null, (level, message) -> { });

        assertEquals("_property", config.getString("pysymphony.merge.output-suffix"));
    }
}
