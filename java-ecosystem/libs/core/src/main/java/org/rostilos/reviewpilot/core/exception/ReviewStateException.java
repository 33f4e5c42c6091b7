package org.rostilos.reviewpilot.core.exception;

import org.rostilos.reviewpilot.core.model.review.ReviewStatus;

/**
 * Thrown when an operation is not allowed in the run's current status.
 */
public class ReviewStateException extends RuntimeException {

    private final Long reviewRunId;
    private final ReviewStatus status;

    public ReviewStateException(Long reviewRunId, ReviewStatus status, String message) {
        super(message);
        this.reviewRunId = reviewRunId;
        this.status = status;
    }

    public Long getReviewRunId() {
        return reviewRunId;
    }

    public ReviewStatus getStatus() {
        return status;
    }
}
