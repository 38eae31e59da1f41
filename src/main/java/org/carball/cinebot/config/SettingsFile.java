package org.carball.cinebot.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YAML settings file. Every field is optional; unset fields keep the lower-priority value.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettingsFile {

    @JsonProperty("matching_profile")
    private String matchingProfile;

    @JsonProperty("max_steps")
    private Integer maxSteps;

    @JsonProperty("history_window")
    private Integer historyWindow;

    @JsonProperty("model")
    private String model;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("edit_weight")
    private Double editWeight;

    @JsonProperty("token_weight")
    private Double tokenWeight;

    @JsonProperty("metadata_weight")
    private Double metadataWeight;

    @JsonProperty("acceptance_threshold")
    private Double acceptanceThreshold;

    @JsonProperty("default_result_limit")
    private Integer defaultResultLimit;

    @JsonProperty("omdb_url")
    private String omdbUrl;

    @JsonProperty("omdb_timeout_seconds")
    private Integer omdbTimeoutSeconds;

    @JsonProperty("catalog_path")
    private String catalogPath;

    @JsonProperty("memory_file")
    private String memoryFile;

    @JsonProperty("corrections")
    private Map<String, String> corrections = new LinkedHashMap<>();

    void applyTo(AgentSettings.AgentSettingsBuilder builder) {
        if (maxSteps != null) builder.maxSteps(maxSteps);
        if (historyWindow != null) builder.historyWindow(historyWindow);
        if (model != null) builder.model(model);
        if (temperature != null) builder.temperature(temperature);
        if (editWeight != null) builder.editWeight(editWeight);
        if (tokenWeight != null) builder.tokenWeight(tokenWeight);
        if (metadataWeight != null) builder.metadataWeight(metadataWeight);
        if (acceptanceThreshold != null) builder.acceptanceThreshold(acceptanceThreshold);
        if (defaultResultLimit != null) builder.defaultResultLimit(defaultResultLimit);
        if (omdbUrl != null) builder.omdbUrl(omdbUrl);
        if (omdbTimeoutSeconds != null) builder.omdbTimeoutSeconds(omdbTimeoutSeconds);
        if (catalogPath != null) builder.catalogPath(catalogPath);
        if (memoryFile != null) builder.memoryFile(memoryFile);
        if (corrections != null && !corrections.isEmpty()) builder.corrections(new LinkedHashMap<>(corrections));
    }
}
