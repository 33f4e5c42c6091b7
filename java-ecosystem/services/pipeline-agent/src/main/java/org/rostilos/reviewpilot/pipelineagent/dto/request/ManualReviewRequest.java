package org.rostilos.reviewpilot.pipelineagent.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ManualReviewRequest(
        @NotNull(message = "repositoryId is required")
        Long repositoryId,

        @NotNull(message = "mergeRequestIid is required")
        @Positive(message = "mergeRequestIid must be positive")
        Long mergeRequestIid
) {
}
