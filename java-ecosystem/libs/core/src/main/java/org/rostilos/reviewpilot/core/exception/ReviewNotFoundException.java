package org.rostilos.reviewpilot.core.exception;

public class ReviewNotFoundException extends RuntimeException {

    private final Long reviewRunId;

    public ReviewNotFoundException(Long reviewRunId) {
        super("Review run not found: " + reviewRunId);
        this.reviewRunId = reviewRunId;
    }

    public Long getReviewRunId() {
        return reviewRunId;
    }
}
