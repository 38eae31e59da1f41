package org.carball.cinebot.tool;

import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.catalog.CatalogStore;
import org.carball.cinebot.model.catalog.CatalogRecord;
import org.carball.cinebot.model.catalog.MatchTier;
import org.carball.cinebot.model.catalog.ResolutionResult;
import org.carball.cinebot.resolver.MovieResolver;

import java.util.List;
import java.util.Locale;

import static org.carball.cinebot.tool.ParameterType.INTEGER;
import static org.carball.cinebot.tool.ParameterType.STRING;

/**
 * Tools over the local IMDb Top 1000 catalog. Title lookups go through the {@link MovieResolver}.
 */
@Slf4j
public class CatalogTools {

    static final int EXCERPT_LENGTH = 150;
    private static final String CATALOG_NAME = "the IMDb Top 1000 catalog";

    private final CatalogStore catalog;
    private final MovieResolver resolver;
    private final int defaultLimit;

    public CatalogTools(CatalogStore catalog, MovieResolver resolver, int defaultLimit) {
        this.catalog = catalog;
        this.resolver = resolver;
        this.defaultLimit = defaultLimit;
    }

    public void registerWith(ToolRegistry registry) {
        ToolParameter title = ToolParameter.required("title", STRING,
                "Movie title as the user wrote it, misspellings allowed");
        ToolParameter limit = ToolParameter.optional("limit", INTEGER,
                "Maximum number of movies to return (default " + defaultLimit + ")");

        registry.register(new ToolDefinition(ToolName.CATALOG_MOVIE_INFO,
                        "Details (year, genre, rating, director, cast, plot) of a movie from the local IMDb Top 1000 catalog",
                        List.of(title)),
                this::movieInfo);
        registry.register(new ToolDefinition(ToolName.CATALOG_MOVIE_RATING,
                        "IMDb rating of a movie from the local IMDb Top 1000 catalog",
                        List.of(title)),
                this::movieRating);
        registry.register(new ToolDefinition(ToolName.CATALOG_MOVIES_WITH_ACTOR,
                        "Best rated catalog movies starring the given actor",
                        List.of(ToolParameter.required("actor", STRING, "Actor name"), limit)),
                this::moviesWithActor);
        registry.register(new ToolDefinition(ToolName.CATALOG_TOP_BY_GENRE,
                        "Best rated catalog movies of a genre (English genre names such as Drama, Action, Sci-Fi)",
                        List.of(ToolParameter.required("genre", STRING, "Genre name"), limit)),
                this::topByGenre);
        registry.register(new ToolDefinition(ToolName.CATALOG_SEARCH_BY_KEYWORD,
                        "Catalog movies whose plot overview mentions a keyword",
                        List.of(ToolParameter.required("keyword", STRING, "Word or phrase to look for in plots"), limit)),
                this::searchByKeyword);
    }

    String movieInfo(ToolArguments arguments) {
        String title = arguments.getString("title");
        if (catalog.isEmpty()) {
            return unavailable();
        }
        ResolutionResult result = resolver.resolve(title);
        if (!result.isMatch()) {
            return String.format("Movie '%s' was not found in %s.", title, CATALOG_NAME);
        }
        CatalogRecord record = result.getRecord();
        return String.format(Locale.ROOT, "%s%s (%d)%nGenre: %s%nIMDb rating: %.1f%nDirector: %s%nCast: %s%n%nOverview: %s",
                matchNote(title, result), record.getTitle(), record.getYear(), record.getGenreText(),
                record.getRating(), record.getDirector(), record.getCastText(), record.getOverview());
    }

    String movieRating(ToolArguments arguments) {
        String title = arguments.getString("title");
        if (catalog.isEmpty()) {
            return unavailable();
        }
        ResolutionResult result = resolver.resolve(title);
        if (!result.isMatch()) {
            return String.format("Rating of '%s' was not found in %s.", title, CATALOG_NAME);
        }
        CatalogRecord record = result.getRecord();
        return String.format(Locale.ROOT, "%sIMDb rating of '%s' (%d) is %.1f",
                matchNote(title, result), record.getTitle(), record.getYear(), record.getRating());
    }

    String moviesWithActor(ToolArguments arguments) {
        String actor = arguments.getString("actor");
        int limit = arguments.getInt("limit", defaultLimit);
        if (catalog.isEmpty()) {
            return unavailable();
        }
        List<CatalogRecord> records = catalog.findByActor(actor, limit);
        if (records.isEmpty()) {
            return String.format("No movies with actor '%s' in %s.", actor, CATALOG_NAME);
        }
        StringBuilder text = new StringBuilder(String.format("Movies with actor '%s':", actor));
        for (CatalogRecord record : records) {
            text.append(String.format(Locale.ROOT, "%n%s (%d), rating %.1f", record.getTitle(), record.getYear(), record.getRating()));
        }
        return text.toString();
    }

    String topByGenre(ToolArguments arguments) {
        String genre = arguments.getString("genre");
        int limit = arguments.getInt("limit", defaultLimit);
        if (catalog.isEmpty()) {
            return unavailable();
        }
        List<CatalogRecord> records = catalog.findByGenre(genre, limit);
        if (records.isEmpty()) {
            return String.format("No movies of genre '%s' in %s.", genre, CATALOG_NAME);
        }
        StringBuilder text = new StringBuilder(String.format("Top %d movies of genre '%s':", limit, genre));
        for (CatalogRecord record : records) {
            text.append(String.format(Locale.ROOT, "%n%s (%d), rating %.1f", record.getTitle(), record.getYear(), record.getRating()));
        }
        return text.toString();
    }

    String searchByKeyword(ToolArguments arguments) {
        String keyword = arguments.getString("keyword");
        int limit = arguments.getInt("limit", defaultLimit);
        if (catalog.isEmpty()) {
            return unavailable();
        }
        List<CatalogRecord> records = catalog.findByOverviewKeyword(keyword, limit);
        if (records.isEmpty()) {
            return String.format("No movies mention '%s' in their overview.", keyword);
        }
        StringBuilder text = new StringBuilder(String.format("Movies matching keyword '%s':", keyword));
        for (CatalogRecord record : records) {
            text.append(String.format("%n%s: %s", record.getTitle(), excerpt(record.getOverview())));
        }
        return text.toString();
    }

    static String excerpt(String overview) {
        if (overview == null) {
            return "";
        }
        return overview.length() <= EXCERPT_LENGTH ? overview : overview.substring(0, EXCERPT_LENGTH) + "...";
    }

    private static String matchNote(String query, ResolutionResult result) {
        if (result.getTier() == MatchTier.EXACT) {
            return "";
        }
        return String.format("(closest %s match for '%s')%n",
                result.getTier().getDisplayName().toLowerCase(Locale.ROOT), query);
    }

    private String unavailable() {
        log.warn("Catalog tool called but the catalog is empty");
        return "The local movie catalog is not available. Import it with 'cinebot import <csv>'.";
    }
}
