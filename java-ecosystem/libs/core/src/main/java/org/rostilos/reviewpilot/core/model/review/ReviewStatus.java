package org.rostilos.reviewpilot.core.model.review;

public enum ReviewStatus {
    PENDING,
    COMPLETED,
    FAILED
}
