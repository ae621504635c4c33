package com.raditha.divergence.config;

import com.raditha.divergence.extraction.HeaderDialect;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void testEmptySettingsGiveDefaults() {
        AnalyzerConfig config = AnalyzerSettings.empty().toConfig(CliOverrides.none());

        assertEquals(NormalizationOptions.defaults(), config.normalization());
        assertTrue(config.exclusions().excludeA().isEmpty());
        assertEquals(HeaderDialect.LEGACY, config.dialectA());
        assertEquals(HeaderDialect.NEW_PM, config.dialectB());
    }

    @Test
    void testBundledDefaultsMatchBuiltIns() {
        AnalyzerConfig config = AnalyzerSettings.loadDefault(tempDir).toConfig(CliOverrides.none());
        assertEquals(AnalyzerConfig.defaults(), config);
    }

    @Test
    void testYamlValues() throws IOException {
        Path file = tempDir.resolve("custom.yml");
        Files.writeString(file, """
                normalization:
                  ignore_comments: true
                  ignore_labels: false
                excluded_passes:
                  pipeline_a: [verify, print]
                  pipeline_b:
                    - VerifierPass
                dialects:
                  pipeline_a: new-pm
                """);

        AnalyzerConfig config = AnalyzerSettings.load(file).toConfig(CliOverrides.none());

        assertTrue(config.normalization().stripComments());
        assertFalse(config.normalization().renameLabels());
        assertTrue(config.normalization().renameTemporaries());
        assertTrue(config.exclusions().excludesA("verify"));
        assertTrue(config.exclusions().excludesA("print"));
        assertTrue(config.exclusions().excludesB("VerifierPass"));
        assertEquals(HeaderDialect.NEW_PM, config.dialectA());
        assertEquals(HeaderDialect.NEW_PM, config.dialectB());
    }

    @Test
    void testCliOverridesWin() {
        AnalyzerSettings settings = new AnalyzerSettings(Map.of(
                "normalization", Map.of("ignore_temp_vars", true, "ignore_comments", false),
                "dialects", Map.of("pipeline_b", "new-pm")));
        CliOverrides overrides = new CliOverrides(true, true, true, true, null, HeaderDialect.LEGACY);

        AnalyzerConfig config = settings.toConfig(overrides);

        assertFalse(config.normalization().renameTemporaries());
        assertFalse(config.normalization().renameLabels());
        assertFalse(config.normalization().dropMetadata());
        assertTrue(config.normalization().stripComments());
        assertEquals(HeaderDialect.LEGACY, config.dialectB());
    }

    @Test
    void testWorkingDirectoryFileIsPreferred() throws IOException {
        Files.writeString(tempDir.resolve(AnalyzerSettings.DEFAULT_CONFIG_FILE), """
                excluded_passes:
                  pipeline_a: [verify]
                """);

        AnalyzerConfig config = AnalyzerSettings.loadDefault(tempDir).toConfig(CliOverrides.none());

        assertEquals(List.of("verify"), List.copyOf(config.exclusions().excludeA()));
    }

    @Test
    void testMissingFile() {
        assertThrows(IllegalArgumentException.class, () -> AnalyzerSettings.load(tempDir.resolve("absent.yml")));
    }

    @Test
    void testInvalidYaml() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.yml"), "normalization: [unclosed");
        assertThrows(IllegalArgumentException.class, () -> AnalyzerSettings.load(file));
    }

    @Test
    void testNonMappingRoot() throws IOException {
        Path file = Files.writeString(tempDir.resolve("list.yml"), "- a\n- b\n");
        assertThrows(IllegalArgumentException.class, () -> AnalyzerSettings.load(file));
    }

    @Test
    void testInvalidDialect() {
        AnalyzerSettings settings = new AnalyzerSettings(Map.of("dialects", Map.of("pipeline_a", "gcc")));
        assertThrows(IllegalArgumentException.class, () -> settings.toConfig(CliOverrides.none()));
    }

    @Test
    void testNormalizationPresets() {
        NormalizationOptions defaults = NormalizationOptions.defaults();
        assertFalse(defaults.stripComments());
        assertTrue(defaults.renameLabels());
        NormalizationOptions none = NormalizationOptions.none();
        assertFalse(none.collapseWhitespace());
        assertTrue(none.withStripComments(true).stripComments());
    }
}
