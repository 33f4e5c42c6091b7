package org.rostilos.reviewpilot.pipelineagent.dto.response;

import org.rostilos.reviewpilot.core.dto.review.ReviewRunDTO;

import java.util.List;

/**
 * One page of review runs. {@code page} is 1-based.
 */
public record ReviewListResponse(
        List<ReviewRunDTO> items,
        long total,
        int page,
        int limit
) {
}
