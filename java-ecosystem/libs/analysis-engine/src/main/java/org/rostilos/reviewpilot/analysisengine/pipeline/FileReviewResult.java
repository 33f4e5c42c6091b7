package org.rostilos.reviewpilot.analysisengine.pipeline;

import org.rostilos.reviewpilot.analysisengine.parser.CriticalItem;
import org.rostilos.reviewpilot.analysisengine.parser.SeverityCounts;

import java.util.List;

/**
 * Outcome of one model review call.
 *
 * @param filePath reviewed file, or {@link ReviewState#BATCH_REVIEW_KEY} for a batch call
 * @param prompt   recorded system and user prompt
 */
public record FileReviewResult(
        String filePath,
        String response,
        String prompt,
        SeverityCounts counts,
        List<CriticalItem> criticalItems
) {

    public boolean hasFindings() {
        return !counts.isZero();
    }
}
