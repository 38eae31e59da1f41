package org.carball.cinebot.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@Slf4j
public class AgentSettings {

    // Orchestration loop
    @Builder.Default
    private int maxSteps = 8;

    @Builder.Default
    private int historyWindow = 12;

    // Model collaborator
    @Builder.Default
    private String model = "gpt-4o-mini";

    @Builder.Default
    private double temperature = 0.2;

    @ToString.Exclude
    private String openAiApiKey;

    // Fuzzy matching
    @Builder.Default
    private double editWeight = 0.6;

    @Builder.Default
    private double tokenWeight = 0.25;

    @Builder.Default
    private double metadataWeight = 0.15;

    @Builder.Default
    private double acceptanceThreshold = 0.33;

    @Builder.Default
    private String matchingProfile = "balanced";

    // Tools
    @Builder.Default
    private int defaultResultLimit = 5;

    @Builder.Default
    private String omdbUrl = "http://www.omdbapi.com/";

    @ToString.Exclude
    private String omdbApiKey;

    @Builder.Default
    private int omdbTimeoutSeconds = 15;

    // Storage
    @Builder.Default
    private String catalogPath = "data/imdb_top_1000.db";

    @Builder.Default
    private String memoryFile = "memory_store.json";

    // Extra misspelling corrections on top of the built-in table
    @Builder.Default
    private Map<String, String> corrections = new LinkedHashMap<>();

    public static AgentSettings defaults() {
        return AgentSettings.builder().build();
    }

    /**
     * Rejects values the agent cannot run with and logs warnings for values that are legal but
     * unlikely to work well.
     *
     * @throws IllegalArgumentException when the step budget or the history window is out of range
     */
    public void validate() {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("Step budget must be at least 1, got " + maxSteps);
        }

        if (historyWindow < 0) {
            throw new IllegalArgumentException("History window must not be negative, got " + historyWindow);
        }

        if (editWeight < 0 || tokenWeight < 0 || metadataWeight < 0) {
            log.warn("Fuzzy weights should not be negative (edit={}, token={}, metadata={})",
                    editWeight, tokenWeight, metadataWeight);
        }

        double weightSum = editWeight + tokenWeight + metadataWeight;
        if (Math.abs(weightSum - 1.0) > 0.001) {
            log.warn("Fuzzy weights sum to {} instead of 1.0, hybrid scores will not be in [0,1]", weightSum);
        }

        if (acceptanceThreshold <= 0 || acceptanceThreshold > 1.0) {
            log.warn("Acceptance threshold ({}) should be in (0, 1]", acceptanceThreshold);
        }

        if (defaultResultLimit < 1) {
            log.warn("Default result limit ({}) should be positive", defaultResultLimit);
        }

        log.debug("Using settings - steps: {}, weights: {}/{}/{}, threshold: {}, profile: {}",
                maxSteps, editWeight, tokenWeight, metadataWeight, acceptanceThreshold, matchingProfile);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Weights: %.2f/%.2f/%.2f | Threshold: %.2f | Max steps: %d | Model: %s",
                matchingProfile, editWeight, tokenWeight, metadataWeight,
                acceptanceThreshold, maxSteps, model);
    }
}
