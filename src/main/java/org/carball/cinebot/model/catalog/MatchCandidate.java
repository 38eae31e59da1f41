package org.carball.cinebot.model.catalog;

import lombok.Value;

@Value
public class MatchCandidate {
    CatalogRecord record;
    double score;
    MatchTier tier;
    int position;
}
