package org.carball.cinebot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigurationLoader loader = new ConfigurationLoader(Map.of());

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        AgentSettings settings = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(settings.getMaxSteps()).isEqualTo(8);
        assertThat(settings.getHistoryWindow()).isEqualTo(12);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.33);
        assertThat(settings.getMatchingProfile()).isEqualTo("balanced");
        assertThat(settings.getOpenAiApiKey()).isNull();
    }

    @Test
    void shouldApplyProfileFromCli() {
        // When
        AgentSettings settings = loader.loadConfiguration(new String[]{"--profile", "strict"});

        // Then
        assertThat(settings.getMatchingProfile()).isEqualTo("strict");
        assertThat(settings.getEditWeight()).isEqualTo(0.7);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.6);
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--profile", "sloppy"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown matching profile: sloppy");
    }

    @Test
    void shouldReadEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "CINEBOT_MAX_STEPS", "5",
                "CINEBOT_FUZZY_THRESHOLD", "0.5",
                "OPENAI_API_KEY", "sk-test",
                "OMDB_API_KEY", "omdb-test",
                "OPENAI_MODEL", "gpt-4o",
                "CINEBOT_MATCHING_PROFILE", "lenient"));

        // When
        AgentSettings settings = envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(settings.getMaxSteps()).isEqualTo(5);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.5);
        assertThat(settings.getOpenAiApiKey()).isEqualTo("sk-test");
        assertThat(settings.getOmdbApiKey()).isEqualTo("omdb-test");
        assertThat(settings.getModel()).isEqualTo("gpt-4o");
        assertThat(settings.getMatchingProfile()).isEqualTo("lenient");
        assertThat(settings.getEditWeight()).isEqualTo(0.45);
    }

    @Test
    void shouldIgnoreInvalidEnvironmentNumbers() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("CINEBOT_MAX_STEPS", "many"));

        // When
        AgentSettings settings = envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(settings.getMaxSteps()).isEqualTo(8);
    }

    @Test
    void shouldLetCliArgumentsOverrideEnvironment() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("CINEBOT_MAX_STEPS", "5"));
        String[] args = {
                "--settings.max-steps", "3",
                "--settings.history-window", "4",
                "--settings.threshold", "0.4",
                "--settings.edit-weight", "0.5",
                "--settings.token-weight", "0.3",
                "--settings.metadata-weight", "0.2",
                "--settings.result-limit", "7",
                "--api-key", "sk-cli",
                "--catalog", "movies.csv",
                "--memory", "me.json"
        };

        // When
        AgentSettings settings = envLoader.loadConfiguration(args);

        // Then
        assertThat(settings.getMaxSteps()).isEqualTo(3);
        assertThat(settings.getHistoryWindow()).isEqualTo(4);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.4);
        assertThat(settings.getEditWeight()).isEqualTo(0.5);
        assertThat(settings.getTokenWeight()).isEqualTo(0.3);
        assertThat(settings.getMetadataWeight()).isEqualTo(0.2);
        assertThat(settings.getDefaultResultLimit()).isEqualTo(7);
        assertThat(settings.getOpenAiApiKey()).isEqualTo("sk-cli");
        assertThat(settings.getCatalogPath()).isEqualTo("movies.csv");
        assertThat(settings.getMemoryFile()).isEqualTo("me.json");
    }

    @Test
    void shouldIgnoreInvalidCliNumbers() {
        AgentSettings settings = loader.loadConfiguration(new String[]{"--settings.max-steps", "lots"});

        assertThat(settings.getMaxSteps()).isEqualTo(8);
    }

    @Test
    void shouldRejectNegativeHistoryWindow() {
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--settings.history-window", "-1"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("History window must not be negative, got -1");
    }

    @Test
    void shouldRejectStepBudgetBelowOne() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("CINEBOT_MAX_STEPS", "0"));

        // Then
        assertThatThrownBy(() -> envLoader.loadConfiguration(new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Step budget must be at least 1, got 0");
    }

    @Test
    void shouldLoadSettingsFileBelowEnvironment() throws IOException {
        // Given
        Path yaml = tempDir.resolve("cinebot.yml");
        Files.writeString(yaml, String.join("\n",
                "matching_profile: strict",
                "max_steps: 6",
                "history_window: 20",
                "acceptance_threshold: 0.55",
                "corrections:",
                "  interstelar: interstellar",
                ""));
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("CINEBOT_HISTORY_WINDOW", "10"));

        // When
        AgentSettings settings = envLoader.loadConfiguration(new String[]{"--config", yaml.toString()});

        // Then
        assertThat(settings.getMatchingProfile()).isEqualTo("strict");
        assertThat(settings.getEditWeight()).isEqualTo(0.7);
        assertThat(settings.getAcceptanceThreshold()).isEqualTo(0.55);
        assertThat(settings.getMaxSteps()).isEqualTo(6);
        assertThat(settings.getHistoryWindow()).isEqualTo(10);
        assertThat(settings.getCorrections()).containsEntry("interstelar", "interstellar");
    }

    @Test
    void shouldReturnNullForMissingOrBrokenSettingsFile() throws IOException {
        // Given
        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, "max_steps: [unclosed");

        // Then
        assertThat(loader.loadSettingsFile(tempDir.resolve("absent.yml").toString())).isNull();
        assertThat(loader.loadSettingsFile(broken.toString())).isNull();
        assertThat(loader.loadSettingsFile(null)).isNull();
    }

    @Test
    void shouldDescribeSettingsInHelp() {
        assertThat(ConfigurationLoader.getSettingsHelp())
                .contains("Settings Options:")
                .contains("CLI Arguments:")
                .contains("Environment Variables:")
                .contains("Priority Order")
                .contains("--settings.threshold");
    }
}
