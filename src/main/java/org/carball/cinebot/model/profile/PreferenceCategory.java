package org.carball.cinebot.model.profile;

import java.util.Arrays;
import java.util.Optional;

public enum PreferenceCategory {
    GENRE("genre", "favorite genres"),
    ACTOR("actor", "favorite actors"),
    DIRECTOR("director", "favorite directors"),
    MOVIE("movie", "favorite movies");

    private final String key;
    private final String displayName;

    PreferenceCategory(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<PreferenceCategory> fromKey(String key) {
        return Arrays.stream(values())
                .filter(category -> category.key.equalsIgnoreCase(key))
                .findFirst();
    }
}
