package com.raditha.divergence.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.divergence.extraction.HeaderDialect;
import com.raditha.divergence.model.ExclusionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads analyzer configuration from YAML with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > defaults
 */
public class AnalyzerSettings {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerSettings.class);

    public static final String DEFAULT_CONFIG_FILE = "divergence.yml";
    static final String BUNDLED_DEFAULTS = "/divergence-defaults.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final Map<String, Object> values;

    AnalyzerSettings(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    /**
     * Settings with no YAML at all; every key falls back to its default.
     */
    public static AnalyzerSettings empty() {
        return new AnalyzerSettings(Map.of());
    }

    /**
     * Load from an explicit file.
     *
     * @throws IllegalArgumentException if the file is missing or is not a YAML mapping
     */
    public static AnalyzerSettings load(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        try (InputStream in = Files.newInputStream(configFile)) {
            logger.debug("Loading configuration from {}", configFile);
            return new AnalyzerSettings(readMap(in, configFile.toString()));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load {@code divergence.yml} from the working directory when present,
     * otherwise the defaults bundled on the classpath.
     */
    public static AnalyzerSettings loadDefault(Path workingDirectory) {
        Path local = workingDirectory.resolve(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(local)) {
            return load(local);
        }
        try (InputStream in = AnalyzerSettings.class.getResourceAsStream(BUNDLED_DEFAULTS)) {
            if (in == null) {
                logger.debug("No bundled defaults found, using built-in values");
                return empty();
            }
            return new AnalyzerSettings(readMap(in, BUNDLED_DEFAULTS));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read bundled defaults: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readMap(InputStream in, String source) throws IOException {
        Object root;
        try {
            root = YAML.readValue(in, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid YAML in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map)) {
            throw new IllegalArgumentException("Configuration in " + source + " must be a mapping");
        }
        return (Map<String, Object>) root;
    }

    /**
     * Build the run configuration, applying CLI overrides on top of the YAML values.
     */
    public AnalyzerConfig toConfig(CliOverrides overrides) {
        Map<String, Object> normalization = getMap(values, "normalization");
        NormalizationOptions options = new NormalizationOptions(
                getBoolean(normalization, "ignore_empty_lines", true),
                !overrides.keepMetadata() && getBoolean(normalization, "ignore_metadata", true),
                overrides.stripComments() || getBoolean(normalization, "ignore_comments", false),
                getBoolean(normalization, "ignore_debug_info", true),
                !overrides.noRenameTemporaries() && getBoolean(normalization, "ignore_temp_vars", true),
                !overrides.noRenameLabels() && getBoolean(normalization, "ignore_labels", true),
                getBoolean(normalization, "ignore_whitespace", true));

        Map<String, Object> excluded = getMap(values, "excluded_passes");
        ExclusionSet exclusions = ExclusionSet.of(
                getListString(excluded, "pipeline_a"),
                getListString(excluded, "pipeline_b"));

        Map<String, Object> dialects = getMap(values, "dialects");
        HeaderDialect dialectA = overrides.dialectA() != null
                ? overrides.dialectA()
                : HeaderDialect.fromString(getString(dialects, "pipeline_a", "legacy"));
        HeaderDialect dialectB = overrides.dialectB() != null
                ? overrides.dialectB()
                : HeaderDialect.fromString(getString(dialects, "pipeline_b", "new-pm"));

        return new AnalyzerConfig(options, exclusions, dialectA, dialectB);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
