package org.carball.cinebot.model.catalog;

public enum MatchTier {
    EXACT("exact title"),
    SUBSTRING("partial title"),
    FUZZY("fuzzy title");

    private final String displayName;

    MatchTier(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
