package org.carball.cinebot.resolver;

import lombok.Value;

@Value
public class ScoreBreakdown {
    double editComponent;
    double tokenComponent;
    double metadataComponent;
    double total;

    @Override
    public String toString() {
        return String.format("%.3f (edit=%.3f, token=%.3f, metadata=%.3f)",
                total, editComponent, tokenComponent, metadataComponent);
    }
}
