package org.carball.cinebot.catalog;

import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.model.catalog.CatalogRecord;
import org.carball.cinebot.text.TextNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Catalog held fully in memory. The catalog is small and fixed, so every query is a linear scan.
 */
@Slf4j
public class InMemoryCatalogStore implements CatalogStore {

    private static final Comparator<CatalogRecord> BEST_RATED_FIRST =
            Comparator.comparingDouble(CatalogRecord::getRating).reversed();

    private final List<CatalogRecord> records;
    private final List<String> normalizedTitles;

    public InMemoryCatalogStore(List<CatalogRecord> records) {
        this.records = List.copyOf(records);
        this.normalizedTitles = this.records.stream()
                .map(record -> TextNormalizer.normalize(record.getTitle()))
                .collect(Collectors.toUnmodifiableList());
        log.debug("Catalog holds {} records", this.records.size());
    }

    public static InMemoryCatalogStore empty() {
        return new InMemoryCatalogStore(List.of());
    }

    @Override
    public List<CatalogRecord> findAll() {
        return records;
    }

    @Override
    public List<CatalogRecord> findByExactTitle(String query) {
        String normalized = TextNormalizer.normalize(query);
        return filterTitles(normalized::equals);
    }

    @Override
    public List<CatalogRecord> findByTitleSubstring(String query) {
        String normalized = TextNormalizer.normalize(query);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return filterTitles(title -> title.contains(normalized));
    }

    @Override
    public List<CatalogRecord> findByActor(String actor, int limit) {
        String needle = TextNormalizer.normalize(actor);
        if (needle.isEmpty()) {
            return List.of();
        }
        return bestRated(record -> record.getCast().stream()
                .anyMatch(member -> TextNormalizer.normalize(member).contains(needle)), limit);
    }

    @Override
    public List<CatalogRecord> findByGenre(String genre, int limit) {
        String needle = TextNormalizer.normalize(genre);
        if (needle.isEmpty()) {
            return List.of();
        }
        return bestRated(record -> TextNormalizer.normalize(record.getGenreText()).contains(needle), limit);
    }

    @Override
    public List<CatalogRecord> findByOverviewKeyword(String keyword, int limit) {
        String needle = TextNormalizer.normalize(keyword);
        if (needle.isEmpty()) {
            return List.of();
        }
        return records.stream()
                .filter(record -> TextNormalizer.normalize(record.getOverview()).contains(needle))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public int size() {
        return records.size();
    }

    private List<CatalogRecord> filterTitles(Predicate<String> titleMatches) {
        List<CatalogRecord> hits = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            if (titleMatches.test(normalizedTitles.get(i))) {
                hits.add(records.get(i));
            }
        }
        return hits;
    }

    private List<CatalogRecord> bestRated(Predicate<CatalogRecord> filter, int limit) {
        // sorted() is stable, equal ratings keep dataset order
        return records.stream()
                .filter(filter)
                .sorted(BEST_RATED_FIRST)
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }
}
