package com.raditha.cildiff.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CilDiffSettingsTest {

    @TempDir
    Path tempDir;

    private Map<String, Object> yaml(String content) throws IOException {
        Path file = tempDir.resolve("cildiff.yml");
        Files.writeString(file, content);
        return CilDiffSettings.loadYaml(file.toString());
    }

    @Test
    void testDefaults() {
        CilDiffConfig config = CilDiffSettings.loadConfig(Map.of(), null, null, null);

        assertEquals(CilDiffConfig.defaults(), config);
        assertEquals(OutputFormat.CIL, config.format());
        assertFalse(config.pretty());
        assertTrue(config.rootHashes());
        assertTrue(config.describeChanges());
    }

    @Test
    void testBundledConfigurationMatchesDefaults() throws IOException {
        Map<String, Object> bundled = CilDiffSettings.loadYaml(null);

        assertEquals(CilDiffConfig.defaults(), CilDiffSettings.loadConfig(bundled, null, null, null));
    }

    @Test
    void testYamlValues() throws IOException {
        Map<String, Object> yaml = yaml("""
                cildiff:
                  output:
                    format: json
                    pretty: true
                    root_hashes: false
                  report:
                    describe_changes: false
                """);

        CilDiffConfig config = CilDiffSettings.loadConfig(yaml, null, null, null);

        assertEquals(new CilDiffConfig(OutputFormat.JSON, true, false, false), config);
    }

    @Test
    void testCliOverridesYaml() throws IOException {
        Map<String, Object> yaml = yaml("""
                cildiff:
                  output:
                    format: json
                    pretty: true
                    root_hashes: true
                """);

        CilDiffConfig config = CilDiffSettings.loadConfig(yaml, OutputFormat.CIL, false, false);

        assertEquals(OutputFormat.CIL, config.format());
        assertFalse(config.pretty());
        assertFalse(config.rootHashes());
    }

    @Test
    void testMissingSectionUsesDefaults() throws IOException {
        Map<String, Object> yaml = yaml("other:\n  key: value\n");

        assertTrue(yaml.isEmpty());
        assertEquals(CilDiffConfig.defaults(), CilDiffSettings.loadConfig(yaml, null, null, null));
    }

    @Test
    void testEmptyFile() throws IOException {
        assertTrue(yaml("").isEmpty());
    }

    @Test
    void testInvalidFormat() throws IOException {
        Map<String, Object> yaml = yaml("cildiff:\n  output:\n    format: xml\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CilDiffSettings.loadConfig(yaml, null, null, null));
        assertTrue(e.getMessage().contains("output.format"));
    }

    @Test
    void testInvalidBoolean() throws IOException {
        Map<String, Object> yaml = yaml("cildiff:\n  output:\n    pretty: sometimes\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CilDiffSettings.loadConfig(yaml, null, null, null));
        assertEquals("Invalid value for output.pretty: expected true or false, got sometimes", e.getMessage());
    }

    @Test
    void testSectionMustBeMap() {
        assertThrows(IllegalArgumentException.class, () -> yaml("cildiff: 42\n"));
        assertThrows(IllegalArgumentException.class, () -> yaml("- just\n- a list\n"));
    }

    @Test
    void testMalformedYaml() {
        assertThrows(IllegalArgumentException.class, () -> yaml("cildiff: [unclosed\n"));
    }

    @Test
    void testMissingExplicitFile() {
        assertThrows(NoSuchFileException.class,
                () -> CilDiffSettings.loadYaml(tempDir.resolve("absent.yml").toString()));
    }

    @Test
    void testOutputFormatFromString() {
        assertEquals(OutputFormat.JSON, OutputFormat.fromString("JSON"));
        assertEquals(OutputFormat.CIL, OutputFormat.fromString("cil"));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromString("xml"));
    }
}
