package org.carball.cinebot.model.catalog;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Outcome of a resolution call: either exactly one record with the tier that found it, or no match.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ResolutionResult {

    private static final ResolutionResult NO_MATCH = new ResolutionResult(null, null, 0.0);

    private final CatalogRecord record;
    private final MatchTier tier;
    private final double score;

    public static ResolutionResult matched(MatchCandidate winner) {
        return new ResolutionResult(winner.getRecord(), winner.getTier(), winner.getScore());
    }

    public static ResolutionResult noMatch() {
        return NO_MATCH;
    }

    public boolean isMatch() {
        return record != null;
    }

    public Optional<CatalogRecord> asOptional() {
        return Optional.ofNullable(record);
    }

    @Override
    public String toString() {
        return isMatch()
                ? String.format("ResolutionResult[%s via %s, score=%.3f]", record.getTitle(), tier, score)
                : "ResolutionResult[no match]";
    }
}
