package org.carball.cinebot.resolver;

import org.carball.cinebot.config.AgentSettings;
import org.carball.cinebot.text.TextNormalizer;

import java.util.HashSet;
import java.util.Set;

/**
 * Scores how well a free-text query matches one catalog title. Three components, each in [0,1]:
 * edit-distance similarity of the whole strings, Jaccard overlap of title words, and the share of
 * query words found in the movie's plot, genres, director and cast.
 */
public class HybridScorer {

    private final double editWeight;
    private final double tokenWeight;
    private final double metadataWeight;

    public HybridScorer(double editWeight, double tokenWeight, double metadataWeight) {
        this.editWeight = editWeight;
        this.tokenWeight = tokenWeight;
        this.metadataWeight = metadataWeight;
    }

    public static HybridScorer fromSettings(AgentSettings settings) {
        return new HybridScorer(settings.getEditWeight(), settings.getTokenWeight(), settings.getMetadataWeight());
    }

    public ScoreBreakdown score(String normalizedQuery, Set<String> queryTokens,
                                String normalizedTitle, Set<String> titleTokens,
                                Set<String> metadataTokens) {
        double edit = editComponent(normalizedQuery, normalizedTitle);
        double token = jaccard(queryTokens, titleTokens);
        double metadata = metadataComponent(queryTokens, metadataTokens);
        double total = editWeight * edit + tokenWeight * token + metadataWeight * metadata;
        return new ScoreBreakdown(edit, token, metadata, total);
    }

    static double editComponent(String query, String title) {
        int maxLength = Math.max(query.length(), title.length());
        if (maxLength == 0) {
            return 0.0;
        }
        double similarity = 1.0 - (double) TextNormalizer.levenshtein(query, title) / maxLength;
        return clamp(similarity);
    }

    static double jaccard(Set<String> queryTokens, Set<String> titleTokens) {
        if (queryTokens.isEmpty() && titleTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(queryTokens);
        union.addAll(titleTokens);
        return (double) intersectionSize(queryTokens, titleTokens) / union.size();
    }

    static double metadataComponent(Set<String> queryTokens, Set<String> metadataTokens) {
        double share = (double) intersectionSize(queryTokens, metadataTokens) / Math.max(1, queryTokens.size());
        return Math.min(1.0, share);
    }

    private static int intersectionSize(Set<String> left, Set<String> right) {
        int count = 0;
        for (String token : left) {
            if (right.contains(token)) {
                count++;
            }
        }
        return count;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
