package org.rostilos.reviewpilot.core.model.review;

public enum FindingSeverity {
    CRITICAL,
    NORMAL,
    SUGGESTION;

    public String label() {
        return name().toLowerCase();
    }
}
