package com.calc.config;

import com.calc.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load the bundled configuration")
    void shouldLoadBundledConfig() {
        CalcConfig config = ConfigLoader.load("classpath:calc.yaml");

        assertEquals("default-calculator", config.name());
        assertTrue(config.functions().contains("sin"));
    }

    @Test
    @DisplayName("Should add configured functions to the defaults")
    void shouldAddFunctionsToDefaults() {
        CalcConfig config = ConfigLoader.load("classpath:calc-test.yaml");

        assertEquals("scientific", config.name());
        assertTrue(config.functions().contains("erf"));
        assertTrue(config.functions().contains("gamma"));
        assertTrue(config.functions().contains("sin"));
    }

    @Test
    @DisplayName("Should use only configured functions when defaults are excluded")
    void shouldUseOnlyConfiguredFunctions() {
        CalcConfig config = ConfigLoader.load("classpath:calc-custom-only.yaml");

        assertEquals(2, config.functions().size());
        assertTrue(config.functions().contains("f"));
        assertFalse(config.functions().contains("sin"));
    }

    @Test
    @DisplayName("Should accept a configuration without the calc section")
    void shouldAcceptRootLevelConfig() {
        CalcConfig config = ConfigLoader.load("classpath:calc-root.yaml");

        assertEquals("root-level", config.name());
        assertTrue(config.functions().contains("erf"));
    }

    @Test
    @DisplayName("Should load from the file system")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("calc.yaml");
        Files.writeString(file, "calc:\n  name: from-file\n");

        CalcConfig config = ConfigLoader.load(file.toString());

        assertEquals("from-file", config.name());
        assertTrue(config.functions().contains("cos"));
    }

    @Test
    @DisplayName("Should fail on a missing file")
    void shouldFailOnMissingFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:does-not-exist.yaml"));

        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("Should fail on an empty document")
    void shouldFailOnEmptyFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:calc-empty.yaml"));
    }

    @Test
    @DisplayName("Should fail on a function name that is not an identifier")
    void shouldFailOnInvalidName() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:calc-invalid.yaml"));

        assertTrue(e.getMessage().contains("2bad"));
    }

    @Test
    @DisplayName("Should fail when defaults are excluded and nothing is added")
    void shouldFailOnEmptyFunctionTable() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml(
                "calc:\n  functions:\n    include-defaults: false\n")));
    }

    @Test
    @DisplayName("Should fail on malformed structure")
    void shouldFailOnMalformedStructure() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("- a\n- b\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml("calc:\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml(
                "calc:\n  functions: [sin]\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(yaml(
                "calc:\n  functions:\n    additional: erf\n")));
    }
}
