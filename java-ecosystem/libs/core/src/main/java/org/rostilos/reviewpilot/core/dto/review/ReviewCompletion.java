package org.rostilos.reviewpilot.core.dto.review;

import org.rostilos.reviewpilot.core.model.review.ReviewFinding;

import java.util.List;

/**
 * Aggregated outcome written to a run when it completes.
 *
 * @param findings unsaved findings to persist; already capped by the caller
 * @param responsesJson raw model responses as a JSON object
 * @param promptsJson prompts sent as a JSON object
 */
public record ReviewCompletion(
        int criticalIssues,
        int normalIssues,
        int suggestions,
        List<ReviewFinding> findings,
        String modelProvider,
        String modelId,
        String responsesJson,
        String promptsJson
) {
}
