package org.carball.cinebot.tool;

import java.util.List;

import static org.carball.cinebot.tool.ParameterType.INTEGER;
import static org.carball.cinebot.tool.ParameterType.STRING;

/**
 * Tools backed by the online OMDb service. Lookup failures propagate as
 * {@link ExternalLookupException} so the caller reports them in-band.
 */
public class OmdbTools {

    private final MovieInfoLookup lookup;
    private final int defaultLimit;

    public OmdbTools(MovieInfoLookup lookup, int defaultLimit) {
        this.lookup = lookup;
        this.defaultLimit = defaultLimit;
    }

    public void registerWith(ToolRegistry registry) {
        ToolParameter title = ToolParameter.required("title", STRING, "Movie title, any language");

        registry.register(new ToolDefinition(ToolName.OMDB_MOVIE_INFO,
                        "Details of any movie from the online OMDb service, for movies missing from the local catalog",
                        List.of(title)),
                this::movieInfo);
        registry.register(new ToolDefinition(ToolName.OMDB_MOVIE_RATING,
                        "IMDb rating of any movie from the online OMDb service",
                        List.of(title)),
                this::movieRating);
        registry.register(new ToolDefinition(ToolName.OMDB_SEARCH,
                        "Search the online OMDb service for movies by title keyword",
                        List.of(ToolParameter.required("keyword", STRING, "Title keyword"),
                                ToolParameter.optional("limit", INTEGER,
                                        "Maximum number of movies to return (default " + defaultLimit + ")"))),
                this::search);
    }

    String movieInfo(ToolArguments arguments) {
        OmdbMovie movie = lookup.lookup(arguments.getString("title"), true);
        return String.format("%s (%s)%nDirector: %s%nActors: %s%nGenre: %s%nIMDb rating: %s%n%nPlot: %s",
                movie.getTitle(), movie.getYear(), movie.getDirector(), movie.getActors(),
                movie.getGenre(), movie.getImdbRating(), movie.getPlot());
    }

    String movieRating(ToolArguments arguments) {
        OmdbMovie movie = lookup.lookup(arguments.getString("title"), false);
        return String.format("IMDb rating of '%s' is %s", movie.getTitle(), movie.getImdbRating());
    }

    String search(ToolArguments arguments) {
        String keyword = arguments.getString("keyword");
        int limit = arguments.getInt("limit", defaultLimit);
        List<OmdbSearchHit> hits = lookup.search(keyword);
        if (hits.isEmpty()) {
            return String.format("No OMDb movies found for '%s'.", keyword);
        }
        StringBuilder text = new StringBuilder(String.format("OMDb search results for '%s':", keyword));
        hits.stream()
                .limit(limit)
                .forEach(hit -> text.append(String.format("%n%s (%s)", hit.getTitle(), hit.getYear())));
        return text.toString();
    }
}
