package org.carball.cinebot.resolver;

import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.catalog.CatalogStore;
import org.carball.cinebot.config.AgentSettings;
import org.carball.cinebot.model.catalog.CatalogRecord;
import org.carball.cinebot.model.catalog.MatchCandidate;
import org.carball.cinebot.model.catalog.MatchTier;
import org.carball.cinebot.model.catalog.ResolutionResult;
import org.carball.cinebot.text.TextNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves a noisy movie reference to at most one catalog record. Tiers run in order and a tier
 * is only attempted when the previous one found nothing: exact title, title substring, then a
 * hybrid fuzzy score over the whole catalog.
 */
@Slf4j
public class MovieResolver {

    // Substring tier: best rating, then the tightest title, then dataset order
    private static final Comparator<MatchCandidate> SUBSTRING_ORDER =
            Comparator.comparingDouble((MatchCandidate c) -> c.getRecord().getRating()).reversed()
                    .thenComparingInt(c -> c.getRecord().getTitle().length())
                    .thenComparingInt(MatchCandidate::getPosition);

    // Fuzzy tier: best score, then best rating, then dataset order
    private static final Comparator<MatchCandidate> FUZZY_ORDER =
            Comparator.comparingDouble(MatchCandidate::getScore).reversed()
                    .thenComparing(Comparator.comparingDouble((MatchCandidate c) -> c.getRecord().getRating()).reversed())
                    .thenComparingInt(MatchCandidate::getPosition);

    private final CatalogStore catalog;
    private final HybridScorer scorer;
    private final double acceptanceThreshold;
    private List<ScoringTarget> scoringTargets;

    public MovieResolver(CatalogStore catalog, HybridScorer scorer, double acceptanceThreshold) {
        this.catalog = catalog;
        this.scorer = scorer;
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public static MovieResolver fromSettings(CatalogStore catalog, AgentSettings settings) {
        return new MovieResolver(catalog, HybridScorer.fromSettings(settings), settings.getAcceptanceThreshold());
    }

    public ResolutionResult resolve(String query) {
        String normalized = TextNormalizer.normalize(query);
        if (normalized.isEmpty()) {
            log.debug("Empty query, nothing to resolve");
            return ResolutionResult.noMatch();
        }

        // Tier 1: exact title
        List<CatalogRecord> exact = catalog.findByExactTitle(normalized);
        if (!exact.isEmpty()) {
            CatalogRecord first = exact.get(0);
            log.debug("Resolved '{}' to '{}' by exact title", query, first.getTitle());
            return ResolutionResult.matched(new MatchCandidate(first, 1.0, MatchTier.EXACT, positionOf(first)));
        }

        // Tier 2: title substring
        List<CatalogRecord> partial = catalog.findByTitleSubstring(normalized);
        if (!partial.isEmpty()) {
            List<MatchCandidate> candidates = new ArrayList<>();
            for (int i = 0; i < partial.size(); i++) {
                CatalogRecord record = partial.get(i);
                double coverage = (double) normalized.length() / TextNormalizer.normalize(record.getTitle()).length();
                candidates.add(new MatchCandidate(record, coverage, MatchTier.SUBSTRING, i));
            }
            candidates.sort(SUBSTRING_ORDER);
            MatchCandidate winner = candidates.get(0);
            log.debug("Resolved '{}' to '{}' by substring among {} titles",
                    query, winner.getRecord().getTitle(), candidates.size());
            return ResolutionResult.matched(winner);
        }

        // Tier 3: hybrid fuzzy score over the full catalog
        return resolveFuzzy(query, normalized);
    }

    private ResolutionResult resolveFuzzy(String query, String normalized) {
        Set<String> queryTokens = TextNormalizer.tokens(normalized);
        MatchCandidate best = null;
        ScoreBreakdown bestBreakdown = null;

        for (ScoringTarget target : targets()) {
            ScoreBreakdown breakdown = scorer.score(normalized, queryTokens,
                    target.normalizedTitle, target.titleTokens, target.metadataTokens);
            if (breakdown.getTotal() < acceptanceThreshold) {
                continue;
            }
            MatchCandidate candidate = new MatchCandidate(target.record, breakdown.getTotal(),
                    MatchTier.FUZZY, target.position);
            if (best == null || FUZZY_ORDER.compare(candidate, best) < 0) {
                best = candidate;
                bestBreakdown = breakdown;
            }
        }

        if (best == null) {
            log.debug("No catalog title scored at least {} for '{}'", acceptanceThreshold, query);
            return ResolutionResult.noMatch();
        }

        log.debug("Resolved '{}' to '{}' by fuzzy score {}", query, best.getRecord().getTitle(), bestBreakdown);
        return ResolutionResult.matched(best);
    }

    private List<ScoringTarget> targets() {
        if (scoringTargets == null) {
            List<CatalogRecord> records = catalog.findAll();
            List<ScoringTarget> targets = new ArrayList<>(records.size());
            for (int i = 0; i < records.size(); i++) {
                targets.add(new ScoringTarget(records.get(i), i));
            }
            scoringTargets = targets;
        }
        return scoringTargets;
    }

    private int positionOf(CatalogRecord record) {
        return catalog.findAll().indexOf(record);
    }

    private static final class ScoringTarget {
        private final CatalogRecord record;
        private final int position;
        private final String normalizedTitle;
        private final Set<String> titleTokens;
        private final Set<String> metadataTokens;

        private ScoringTarget(CatalogRecord record, int position) {
            this.record = record;
            this.position = position;
            this.normalizedTitle = TextNormalizer.normalize(record.getTitle());
            this.titleTokens = TextNormalizer.tokens(record.getTitle());

            Set<String> metadata = new LinkedHashSet<>(TextNormalizer.tokens(record.getOverview()));
            record.getGenres().forEach(genre -> metadata.addAll(TextNormalizer.tokens(genre)));
            metadata.addAll(TextNormalizer.tokens(record.getDirector()));
            record.getCast().forEach(member -> metadata.addAll(TextNormalizer.tokens(member)));
            this.metadataTokens = metadata;
        }
    }
}
