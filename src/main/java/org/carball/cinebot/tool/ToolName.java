package org.carball.cinebot.tool;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of tools the model may call, each with the name it is advertised under.
 */
public enum ToolName {
    CATALOG_MOVIE_INFO("catalog_movie_info"),
    CATALOG_MOVIE_RATING("catalog_movie_rating"),
    CATALOG_MOVIES_WITH_ACTOR("catalog_movies_with_actor"),
    CATALOG_TOP_BY_GENRE("catalog_top_by_genre"),
    CATALOG_SEARCH_BY_KEYWORD("catalog_search_by_keyword"),
    OMDB_MOVIE_INFO("omdb_movie_info"),
    OMDB_MOVIE_RATING("omdb_movie_rating"),
    OMDB_SEARCH("omdb_search");

    private final String wireName;

    ToolName(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ToolName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(tool -> tool.wireName.equals(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
