package org.carball.cinebot.catalog;

import java.util.List;

/**
 * Column names of the IMDb Top 1000 dataset, shared by the CSV file and the SQLite table.
 */
final class ImdbColumns {

    static final String TABLE = "movies";

    static final String TITLE = "Series_Title";
    static final String YEAR = "Released_Year";
    static final String GENRE = "Genre";
    static final String RATING = "IMDB_Rating";
    static final String OVERVIEW = "Overview";
    static final String DIRECTOR = "Director";
    static final List<String> STARS = List.of("Star1", "Star2", "Star3", "Star4");

    static final List<String> ALL = List.of(TITLE, YEAR, GENRE, RATING, OVERVIEW, DIRECTOR,
            "Star1", "Star2", "Star3", "Star4");

    private ImdbColumns() {
    }
}
