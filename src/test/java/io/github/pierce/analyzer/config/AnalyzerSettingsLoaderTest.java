package io.github.pierce.analyzer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for loading analyzer settings from properties, YAML and the environment.
 */
class AnalyzerSettingsLoaderTest {

    @Nested
    @DisplayName("Properties")
    class PropertiesFiles {

        @Test
        @DisplayName("default properties match the built-in defaults")
        void defaultProperties() throws IOException {
            AnalyzerSettings settings = AnalyzerSettingsLoader.fromDefaultProperties();

            AnalysisLimits limits = settings.getLimits();
            assertThat(limits.getMaxBytes()).isEqualTo(AnalysisLimits.DEFAULT_MAX_BYTES);
            assertThat(limits.getMaxRows()).isEqualTo(AnalysisLimits.DEFAULT_MAX_ROWS);
            assertThat(limits.getMaxColumns()).isEqualTo(AnalysisLimits.DEFAULT_MAX_COLUMNS);
            assertThat(limits.getPreviewSize()).isEqualTo(AnalysisLimits.DEFAULT_PREVIEW_SIZE);
            assertThat(limits.getAllowedExtensions()).containsExactly(".csv");
            assertThat(settings.getInferenceConfig().getDelimiter()).isEqualTo(',');
        }

        @Test
        @DisplayName("every key is read from a properties file")
        void customProperties() throws IOException {
            AnalyzerSettings settings = AnalyzerSettingsLoader.fromProperties("analyzer-test.properties");

            AnalysisLimits limits = settings.getLimits();
            assertThat(limits.getMaxBytes()).isEqualTo(2048);
            assertThat(limits.getMaxRows()).isEqualTo(50);
            assertThat(limits.getMaxColumns()).isEqualTo(8);
            assertThat(limits.getPreviewSize()).isEqualTo(3);
            assertThat(limits.getAllowedExtensions()).containsExactlyInAnyOrder(".csv", ".tsv");

            InferenceConfig config = settings.getInferenceConfig();
            assertThat(config.getDelimiter()).isEqualTo('\t');
            assertThat(config.getQuoteChar()).isEqualTo('\'');
            assertThat(config.isTrimWhitespace()).isFalse();
            assertThat(config.getMalformedRowPolicy()).isEqualTo(InferenceConfig.MalformedRowPolicy.REJECT);
            assertThat(config.getBooleanTokens()).containsExactly(
                    new InferenceConfig.BooleanTokenPair("on", "off"),
                    new InferenceConfig.BooleanTokenPair("y", "n"));
            assertThat(config.getDatePatterns()).containsExactly("dd/MM/yyyy", "yyyy-MM-dd");
        }

        @Test
        @DisplayName("a missing resource is an IOException")
        void missingResource() {
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromProperties("does-not-exist.properties"))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("does-not-exist.properties");
        }
    }

    @Test
    @DisplayName("nested YAML keys and lists are read")
    void yaml() throws IOException {
        AnalyzerSettings settings = AnalyzerSettingsLoader.fromYaml("analyzer-test.yaml");

        AnalysisLimits limits = settings.getLimits();
        assertThat(limits.getMaxBytes()).isEqualTo(4096);
        assertThat(limits.getMaxRows()).isEqualTo(200);
        assertThat(limits.getMaxColumns()).isEqualTo(12);
        assertThat(limits.getPreviewSize()).isEqualTo(4);
        assertThat(limits.getSampleValueCount()).isEqualTo(2);
        assertThat(limits.getAllowedExtensions()).containsExactlyInAnyOrder(".csv", ".txt");

        InferenceConfig config = settings.getInferenceConfig();
        assertThat(config.getDelimiter()).isEqualTo(';');
        assertThat(config.getQuoteChar()).isEqualTo('"');
        assertThat(config.getMalformedRowPolicy()).isEqualTo(InferenceConfig.MalformedRowPolicy.EXCLUDE);
        assertThat(config.getBooleanTokens()).containsExactly(
                new InferenceConfig.BooleanTokenPair("true", "false"),
                new InferenceConfig.BooleanTokenPair("ja", "nein"));
        assertThat(config.getDatePatterns()).containsExactly("dd.MM.yyyy", "yyyy-MM-dd");
    }

    @Nested
    @DisplayName("Environment")
    class Environment {

        @Test
        @DisplayName("variable names follow the upper-case underscore convention")
        void names() {
            assertThat(AnalyzerSettingsLoader.environmentName("analyzer.limits.max-rows"))
                    .isEqualTo("ANALYZER_LIMITS_MAX_ROWS");
            assertThat(AnalyzerSettingsLoader.environmentName("analyzer.inference.boolean-tokens"))
                    .isEqualTo("ANALYZER_INFERENCE_BOOLEAN_TOKENS");
        }

        @Test
        @DisplayName("set variables override defaults and the rest keep them")
        void overrides() {
            Map<String, String> env = new HashMap<>();
            env.put("ANALYZER_LIMITS_MAX_ROWS", "1_000");
            env.put("ANALYZER_CSV_DELIMITER", "|");
            env.put("ANALYZER_INFERENCE_MALFORMED_ROWS", "Reject");
            env.put("UNRELATED", "ignored");

            AnalyzerSettings settings = AnalyzerSettingsLoader.fromEnvironment(env);

            assertThat(settings.getLimits().getMaxRows()).isEqualTo(1000);
            assertThat(settings.getLimits().getMaxColumns()).isEqualTo(AnalysisLimits.DEFAULT_MAX_COLUMNS);
            assertThat(settings.getInferenceConfig().getDelimiter()).isEqualTo('|');
            assertThat(settings.getInferenceConfig().getMalformedRowPolicy())
                    .isEqualTo(InferenceConfig.MalformedRowPolicy.REJECT);
        }
    }

    @Nested
    @DisplayName("Invalid values")
    class InvalidValues {

        @Test
        @DisplayName("non-numeric limits are rejected")
        void notANumber() {
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromMap(Map.of("analyzer.limits.max-rows", "many")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("analyzer.limits.max-rows");
        }

        @Test
        @DisplayName("count limits beyond the int range are rejected instead of wrapping")
        void outOfIntRange() {
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromMap(Map.of("analyzer.limits.max-rows", "4294967297")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("analyzer.limits.max-rows")
                    .hasMessageContaining("4294967297");
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromMap(Map.of("analyzer.limits.preview-size", 3_000_000_000L)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("analyzer.limits.preview-size");
        }

        @Test
        @DisplayName("byte limits accept values beyond the int range")
        void largeByteLimit() {
            AnalyzerSettings settings = AnalyzerSettingsLoader.fromMap(Map.of("analyzer.limits.max-bytes", "4294967297"));

            assertThat(settings.getLimits().getMaxBytes()).isEqualTo(4_294_967_297L);
        }

        @Test
        @DisplayName("negative limits are rejected by the builder")
        void negative() {
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromMap(Map.of("analyzer.limits.max-bytes", -1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("multi-character delimiters are rejected")
        void longDelimiter() {
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromMap(Map.of("analyzer.csv.delimiter", ";;")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("single character");
        }

        @Test
        @DisplayName("unknown malformed-row policies are rejected")
        void unknownPolicy() {
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromMap(
                    Map.of("analyzer.inference.malformed-rows", "ignore")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("EXCLUDE");
        }

        @Test
        @DisplayName("boolean tokens must come in pairs")
        void unpairedTokens() {
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromMap(
                    Map.of("analyzer.inference.boolean-tokens", "yes:no,maybe")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maybe");
        }

        @Test
        @DisplayName("unknown keys are ignored")
        void unknownKey() {
            AnalyzerSettings settings = AnalyzerSettingsLoader.fromMap(
                    Map.of("analyzer.limits.max-cells", "5", "analyzer.limits.preview-size", 7));

            assertThat(settings.getLimits().getPreviewSize()).isEqualTo(7);
        }

        @Test
        @DisplayName("delimiter and quote must differ")
        void sameDelimiterAndQuote() {
            assertThatThrownBy(() -> AnalyzerSettingsLoader.fromMap(
                    Map.of("analyzer.csv.delimiter", "'", "analyzer.csv.quote", "'")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("list values are accepted for list-valued keys")
    void listValues() {
        AnalyzerSettings settings = AnalyzerSettingsLoader.fromMap(Map.of(
                "analyzer.limits.allowed-extensions", List.of("CSV", ".Txt"),
                "analyzer.inference.date-patterns", List.of("yyyyMMdd")));

        assertThat(settings.getLimits().getAllowedExtensions()).containsExactlyInAnyOrder(".csv", ".txt");
        assertThat(settings.getInferenceConfig().getDatePatterns()).containsExactly("yyyyMMdd");
    }
}
