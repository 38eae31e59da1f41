package org.carball.cinebot.model.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * One movie of the local catalog. Loaded once at startup and never mutated.
 */
@Value
@Builder
public class CatalogRecord {
    String title;
    int year;
    @Singular("genre")
    Set<String> genres;
    String director;
    @Singular("castMember")
    List<String> cast;
    double rating;
    String overview;

    public String getGenreText() {
        return String.join(", ", genres);
    }

    public String getCastText() {
        return cast.isEmpty() ? "-" : String.join(", ", cast);
    }
}
