package org.rostilos.reviewpilot.analysisengine.parser;

import java.util.List;

/**
 * @param statisticsLineFound whether the counts came from an explicit statistics line
 */
public record ParsedReview(SeverityCounts counts, List<CriticalItem> criticalItems, boolean statisticsLineFound) {

    public static ParsedReview empty() {
        return new ParsedReview(SeverityCounts.ZERO, List.of(), false);
    }
}
