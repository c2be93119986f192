package org.carball.motif.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultConfiguration() throws IOException {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        // When
        EngineSettings settings = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(settings.getStorageDirectory()).isEqualTo("solution_storage");
        assertThat(settings.getCacheTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(settings.getCacheMaximumSize()).isEqualTo(500);
        assertThat(settings.getRecentActivityDays()).isEqualTo(7);
        assertThat(settings.getDefaultLimit()).isEqualTo(10);
        assertThat(settings.isAutoEvaluate()).isTrue();
    }

    @Test
    void shouldParseCLIArguments() throws IOException {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());
        String[] args = {
                "stats",
                "--storage", "/tmp/motifs",
                "--cache-ttl", "5",
                "--cache-size", "20",
                "--recent-days", "3",
                "--trending-days", "14",
                "--limit", "4",
                "--similar-limit", "2",
                "--auto-evaluate", "false"
        };

        // When
        EngineSettings settings = loader.loadConfiguration(args);

        // Then
        assertThat(settings.getStoragePath()).isEqualTo(Path.of("/tmp/motifs"));
        assertThat(settings.getCacheTtlMinutes()).isEqualTo(5);
        assertThat(settings.getCacheMaximumSize()).isEqualTo(20);
        assertThat(settings.getRecentActivityDays()).isEqualTo(3);
        assertThat(settings.getTrendingWindowDays()).isEqualTo(14);
        assertThat(settings.getDefaultLimit()).isEqualTo(4);
        assertThat(settings.getSimilarLimit()).isEqualTo(2);
        assertThat(settings.isAutoEvaluate()).isFalse();
    }

    @Test
    void shouldApplyHierarchyCliOverEnvironmentOverFile() throws IOException {
        // Given
        Path file = tempDir.resolve("motif.yaml");
        Files.writeString(file, """
                storage_directory: from-file
                cache_ttl_minutes: 15
                default_limit: 3
                similar_limit: 9
                """);
        ConfigurationLoader loader = new ConfigurationLoader(Map.of(
                "MOTIF_CACHE_TTL_MINUTES", "30",
                "MOTIF_DEFAULT_LIMIT", "6"));
        String[] args = {"--config", file.toString(), "--limit", "8"};

        // When
        EngineSettings settings = loader.loadConfiguration(args);

        // Then - CLI > env vars > file > defaults
        assertThat(settings.getDefaultLimit()).isEqualTo(8);
        assertThat(settings.getCacheTtlMinutes()).isEqualTo(30);
        assertThat(settings.getStorageDirectory()).isEqualTo("from-file");
        assertThat(settings.getSimilarLimit()).isEqualTo(9);
        assertThat(settings.getTrendingWindowDays()).isEqualTo(7);
    }

    @Test
    void shouldIgnoreInvalidValues() throws IOException {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("MOTIF_CACHE_MAX_SIZE", "lots"));
        String[] args = {
                "--limit", "not-a-number",
                "--similar-limit", "3" // still applied
        };

        // When
        EngineSettings settings = loader.loadConfiguration(args);

        // Then
        assertThat(settings.getCacheMaximumSize()).isEqualTo(500);
        assertThat(settings.getDefaultLimit()).isEqualTo(10);
        assertThat(settings.getSimilarLimit()).isEqualTo(3);
    }

    @Test
    void shouldFailForMissingSettingsFile() {
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());
        Path missing = tempDir.resolve("nope.yaml");

        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--config", missing.toString()}))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    void shouldIgnoreUnknownKeysInSettingsFile() throws IOException {
        // Given
        Path file = tempDir.resolve("extra.yaml");
        Files.writeString(file, """
                auto_evaluate: false
                theme: dark
                """);

        // When
        EngineSettingsFile settingsFile = new ConfigurationLoader(Map.of()).loadSettingsFile(file);

        // Then
        assertThat(settingsFile.getAutoEvaluate()).isFalse();
        assertThat(settingsFile.getDefaultLimit()).isNull();
    }

    @Test
    void shouldDescribeEveryOptionInHelp() {
        assertThat(ConfigurationLoader.getConfigurationHelp())
                .contains("--storage", "--config", "--cache-ttl", "MOTIF_AUTO_EVALUATE");
    }
}
