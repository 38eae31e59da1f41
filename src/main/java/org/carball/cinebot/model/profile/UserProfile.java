package org.carball.cinebot.model.profile;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * User identity plus accumulated preferences. Values can only be added, never removed.
 */
@EqualsAndHashCode
@ToString
public class UserProfile {

    @Getter
    @Setter
    private String name;

    private final Map<PreferenceCategory, Set<String>> preferences = new EnumMap<>(PreferenceCategory.class);

    public UserProfile() {
        for (PreferenceCategory category : PreferenceCategory.values()) {
            preferences.put(category, new LinkedHashSet<>());
        }
    }

    public static UserProfile empty() {
        return new UserProfile();
    }

    /**
     * Adds a value unless the category already holds it (case-insensitive).
     *
     * @return true when the profile changed
     */
    public boolean addPreference(PreferenceCategory category, String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String trimmed = value.trim();
        Set<String> values = preferences.get(category);
        String lowered = trimmed.toLowerCase(Locale.ROOT);
        boolean known = values.stream().anyMatch(v -> v.toLowerCase(Locale.ROOT).equals(lowered));
        if (known) {
            return false;
        }
        return values.add(trimmed);
    }

    public Set<String> getPreferences(PreferenceCategory category) {
        return Collections.unmodifiableSet(preferences.get(category));
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean isEmpty() {
        return !hasName() && preferences.values().stream().allMatch(Set::isEmpty);
    }

    /**
     * Human readable summary of the preferences, or null when nothing is known yet.
     */
    public String describePreferences() {
        List<String> parts = preferences.entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .map(entry -> entry.getKey().getDisplayName() + ": " + String.join(", ", entry.getValue()))
                .collect(Collectors.toList());
        if (parts.isEmpty()) {
            return null;
        }
        return "The user's " + String.join("; ", parts) + ".";
    }

    /**
     * Snapshot handed to the model as part of its context.
     */
    public String toSnapshot() {
        StringBuilder snapshot = new StringBuilder("[User profile]\n");
        snapshot.append("Name: ").append(hasName() ? name : "unknown").append('\n');
        String described = describePreferences();
        snapshot.append(described != null ? described : "No preferences recorded yet.");
        return snapshot.toString();
    }
}
