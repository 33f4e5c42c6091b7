package org.rostilos.reviewpilot.analysisengine.pipeline;

public enum ReviewStage {
    FETCH_DIFF,
    GENERATE_SUMMARY,
    REVIEW_FILE,
    REVIEW_BATCH,
    AGGREGATE,
    PUBLISH,
    END
}
