package org.carball.cinebot.catalog;

import org.carball.cinebot.model.catalog.CatalogRecord;

import java.util.List;

/**
 * Read-only access to the movie catalog. All list results keep dataset order unless stated otherwise.
 */
public interface CatalogStore {

    List<CatalogRecord> findAll();

    /**
     * Records whose normalized title equals the normalized query.
     */
    List<CatalogRecord> findByExactTitle(String query);

    /**
     * Records whose normalized title contains the normalized query.
     */
    List<CatalogRecord> findByTitleSubstring(String query);

    /**
     * Records with a cast member containing the given name, best rated first.
     */
    List<CatalogRecord> findByActor(String actor, int limit);

    /**
     * Records with a genre containing the given text, best rated first.
     */
    List<CatalogRecord> findByGenre(String genre, int limit);

    List<CatalogRecord> findByOverviewKeyword(String keyword, int limit);

    default int size() {
        return findAll().size();
    }

    default boolean isEmpty() {
        return size() == 0;
    }
}
