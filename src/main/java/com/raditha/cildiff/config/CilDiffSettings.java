package com.raditha.cildiff.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the output configuration from {@code cildiff.yml} with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > cildiff.yml > defaults
 */
public class CilDiffSettings {

    private static final Logger logger = LoggerFactory.getLogger(CilDiffSettings.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "cildiff.yml";
    private static final String CONFIG_KEY = "cildiff";

    private CilDiffSettings() {
    }

    /**
     * Read the YAML configuration file.
     *
     * @param configFile explicit file, or null to look for {@code cildiff.yml} on the classpath
     * @return the {@code cildiff} section, empty when there is none
     * @throws IOException if an explicit file cannot be read
     */
    public static Map<String, Object> loadYaml(String configFile) throws IOException {
        if (configFile != null) {
            try (InputStream in = Files.newInputStream(Path.of(configFile))) {
                return section(parse(in, configFile));
            }
        }
        try (InputStream in = CilDiffSettings.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_CONFIG_RESOURCE);
                return Map.of();
            }
            return section(parse(in, DEFAULT_CONFIG_RESOURCE));
        }
    }

    /**
     * Build the configuration, applying CLI overrides where provided.
     *
     * @param yaml          the {@code cildiff} section of the configuration file
     * @param formatCLI     CLI output format (null = use YAML/default)
     * @param prettyCLI     CLI JSON indentation (null = use YAML/default)
     * @param rootHashesCLI CLI root hash header (null = use YAML/default)
     * @return complete configuration
     * @throws IllegalArgumentException if a YAML value has the wrong type or an unknown value
     */
    public static CilDiffConfig loadConfig(Map<String, Object> yaml, OutputFormat formatCLI, Boolean prettyCLI,
                                           Boolean rootHashesCLI) {
        CilDiffConfig defaults = CilDiffConfig.defaults();
        Map<String, Object> output = getMap(yaml, "output");
        Map<String, Object> report = getMap(yaml, "report");

        OutputFormat format = formatCLI;
        if (format == null) {
            String yamlFormat = getString(output, "output.format", "format");
            format = yamlFormat != null ? formatFromYaml(yamlFormat) : defaults.format();
        }
        boolean pretty = prettyCLI != null ? prettyCLI : getBoolean(output, "output.pretty", "pretty", defaults.pretty());
        boolean rootHashes = rootHashesCLI != null
                ? rootHashesCLI
                : getBoolean(output, "output.root_hashes", "root_hashes", defaults.rootHashes());
        boolean describeChanges = getBoolean(report, "report.describe_changes", "describe_changes",
                defaults.describeChanges());

        return new CilDiffConfig(format, pretty, rootHashes, describeChanges);
    }

    private static Object parse(InputStream in, String source) {
        try {
            return new Yaml().load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid configuration file " + source + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> section(Object document) {
        if (document == null) {
            return Map.of();
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Configuration must be a map with a '" + CONFIG_KEY + "' key");
        }
        Object section = ((Map<?, ?>) document).get(CONFIG_KEY);
        if (section == null) {
            logger.warn("Configuration has no '{}' section, using defaults", CONFIG_KEY);
            return Map.of();
        }
        return asMap(section, CONFIG_KEY);
    }

    private static OutputFormat formatFromYaml(String value) {
        try {
            return OutputFormat.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for output.format: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        return asMap(value, key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": expected a map, got " + value);
    }

    private static boolean getBoolean(Map<String, Object> map, String path, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("Invalid value for " + path + ": expected true or false, got " + value);
    }

    private static String getString(Map<String, Object> map, String path, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return (String) value;
        }
        throw new IllegalArgumentException("Invalid value for " + path + ": expected a string, got " + value);
    }
}
