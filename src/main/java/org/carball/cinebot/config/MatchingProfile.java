package org.carball.cinebot.config;

import lombok.Getter;

/**
 * Presets for the fuzzy tier: hybrid score weights plus the acceptance threshold.
 */
@Getter
public enum MatchingProfile {

    STRICT("strict", "Only accept close title spellings",
            0.7, 0.2, 0.1, 0.6),

    BALANCED("balanced", "Default weighting for typo-level mistakes",
            0.6, 0.25, 0.15, 0.33),

    LENIENT("lenient", "Let title words and plot/cast keywords carry more weight",
            0.45, 0.3, 0.25, 0.25);

    private final String profileName;
    private final String description;
    private final double editWeight;
    private final double tokenWeight;
    private final double metadataWeight;
    private final double acceptanceThreshold;

    MatchingProfile(String profileName, String description,
                    double editWeight, double tokenWeight, double metadataWeight,
                    double acceptanceThreshold) {
        this.profileName = profileName;
        this.description = description;
        this.editWeight = editWeight;
        this.tokenWeight = tokenWeight;
        this.metadataWeight = metadataWeight;
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public AgentSettings applyTo(AgentSettings base) {
        return base.toBuilder()
                .matchingProfile(profileName)
                .editWeight(editWeight)
                .tokenWeight(tokenWeight)
                .metadataWeight(metadataWeight)
                .acceptanceThreshold(acceptanceThreshold)
                .build();
    }

    public static MatchingProfile fromName(String name) {
        for (MatchingProfile profile : values()) {
            if (profile.profileName.equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown matching profile: " + name
                + ". Available profiles: strict, balanced, lenient");
    }
}
