package org.rostilos.reviewpilot.pipelineagent.service;

import org.rostilos.reviewpilot.analysisengine.pipeline.ReviewPipeline;
import org.rostilos.reviewpilot.analysisengine.publish.ReviewPlaceholderService;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.service.ReviewRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs a review in the background. Callers get control back as soon as the task is queued.
 */
@Service
public class ReviewRunExecutor {

    private static final Logger log = LoggerFactory.getLogger(ReviewRunExecutor.class);

    private final ReviewRunService reviewRunService;
    private final ReviewPlaceholderService placeholderService;
    private final ReviewPipeline reviewPipeline;

    public ReviewRunExecutor(
            ReviewRunService reviewRunService,
            ReviewPlaceholderService placeholderService,
            ReviewPipeline reviewPipeline
    ) {
        this.reviewRunService = reviewRunService;
        this.placeholderService = placeholderService;
        this.reviewPipeline = reviewPipeline;
    }

    @Async("reviewExecutor")
    public void execute(Long runId) {
        log.info("Review run {} started on {}", runId, Thread.currentThread().getName());
        try {
            ReviewRun run = reviewRunService.getRun(runId);
            placeholderService.createPlaceholder(run);
            reviewPipeline.run(runId);
        } catch (Exception e) {
            log.error("Review run {} aborted: {}", runId, e.getMessage(), e);
        }
    }
}
