package com.qualitylens.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("quality-lens.yaml");
        Files.writeString(configFile, """
            limits:
              maxFileBytes: 500000
              analysisTimeoutMillis: 10000

            thresholds:
              complexity: 12
              nestingDepth: 5

            magicNumberAllowList:
              - retries

            principles:
              methodCount: { low: 10, medium: 20, high: 30 }
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.limits().maxFileBytes()).isEqualTo(500_000);
        assertThat(config.limits().analysisTimeoutMillis()).isEqualTo(10_000L);
        assertThat(config.thresholds().complexity()).isEqualTo(12);
        assertThat(config.thresholds().nestingDepth()).isEqualTo(5);
        assertThat(config.magicNumberAllowList()).containsExactly("retries");
        assertThat(config.principles().methodCount())
            .isEqualTo(AnalyzerConfig.ThresholdBand.of(10, 20, 30));
    }

    @Test
    void load_partialYaml_fillsMissingFieldsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("quality-lens.yaml");
        Files.writeString(configFile, """
            thresholds:
              parameterCount: 3
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.thresholds().parameterCount()).isEqualTo(3);
        assertThat(config.thresholds().complexity()).isEqualTo(10);
        assertThat(config.limits()).isEqualTo(AnalyzerConfig.Limits.defaults());
        assertThat(config.magicNumberAllowList()).isEqualTo(AnalyzerConfig.DEFAULT_MAGIC_NUMBER_ALLOW_LIST);
        assertThat(config.principles()).isEqualTo(AnalyzerConfig.PrincipleThresholds.defaults());
    }

    @Test
    void load_unknownProperties_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("quality-lens.yaml");
        Files.writeString(configFile, """
            reporting:
              format: html
            limits:
              maxLines: 2000
              somethingElse: true
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.limits().maxLines()).isEqualTo(2000);
    }

    @Test
    void load_missingFile_returnsDefaults() {
        AnalyzerConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("quality-lens.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("quality-lens.yaml");
        Files.writeString(configFile, "limits: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_descendingThresholdBand_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("quality-lens.yaml");
        Files.writeString(configFile, """
            principles:
              concerns: { low: 5, medium: 4, high: 3 }
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_fileCeilingAtIntegerMaximum_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("quality-lens.yaml");
        Files.writeString(configFile, """
            limits:
              maxFileBytes: 2147483647
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_nonPositiveLimit_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("quality-lens.yaml");
        Files.writeString(configFile, """
            limits:
              maxLines: 0
              maxUnits: -5
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void loadFromDirectory_findsDefaultFileName() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), """
            thresholds:
              unitLength: 80
            """);

        AnalyzerConfig config = ConfigLoader.loadFromDirectory(tempDir);

        assertThat(config.thresholds().unitLength()).isEqualTo(80);
    }

    @Test
    void defaults_matchDocumentedValues() {
        AnalyzerConfig config = AnalyzerConfig.defaults();

        assertThat(config.limits().maxFileBytes()).isEqualTo(1_000_000);
        assertThat(config.limits().maxUnits()).isEqualTo(100);
        assertThat(config.limits().maxFindingsPerFile()).isEqualTo(1_000);
        assertThat(config.limits().analysisTimeoutMillis()).isEqualTo(30_000L);
        assertThat(config.thresholds().complexityError()).isEqualTo(15);
        assertThat(config.principles().unitParameters()).isEqualTo(AnalyzerConfig.ThresholdBand.of(6, 8, 10));
    }
}
