package org.rostilos.reviewpilot.pipelineagent.controller;

import jakarta.validation.Valid;
import org.rostilos.reviewpilot.core.dto.review.ReviewRunDTO;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.model.review.ReviewStatus;
import org.rostilos.reviewpilot.core.service.ReviewRunService;
import org.rostilos.reviewpilot.pipelineagent.dto.request.ManualReviewRequest;
import org.rostilos.reviewpilot.pipelineagent.dto.response.ReviewListResponse;
import org.rostilos.reviewpilot.pipelineagent.service.ReviewTriggerService;
import org.rostilos.reviewpilot.pipelineagent.service.TriggerResult;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Locale;

/**
 * Manual trigger, retry and read access for review runs.
 */
@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    private final ReviewTriggerService triggerService;
    private final ReviewRunService reviewRunService;

    public ReviewController(ReviewTriggerService triggerService, ReviewRunService reviewRunService) {
        this.triggerService = triggerService;
        this.reviewRunService = reviewRunService;
    }

    @PostMapping
    public ResponseEntity<TriggerResult> triggerReview(@Valid @RequestBody ManualReviewRequest request)
            throws IOException {
        TriggerResult result = triggerService.triggerManual(request.repositoryId(), request.mergeRequestIid());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<TriggerResult> retryReview(@PathVariable Long id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(triggerService.retry(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReviewRunDTO> getReview(@PathVariable Long id) {
        ReviewRun run = reviewRunService.getRun(id);
        return ResponseEntity.ok(ReviewRunDTO.from(run, reviewRunService.getFindings(id)));
    }

    @GetMapping
    public ResponseEntity<ReviewListResponse> listReviews(
            @RequestParam(required = false) Long repositoryId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit
    ) {
        if (page < 1 || limit < 1 || limit > 100) {
            throw new IllegalArgumentException("page must be >= 1 and limit between 1 and 100");
        }
        ReviewStatus statusFilter = status == null || status.isBlank()
                ? null
                : ReviewStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        Page<ReviewRun> runs = reviewRunService.listRuns(repositoryId, statusFilter, page, limit);
        return ResponseEntity.ok(new ReviewListResponse(
                runs.getContent().stream().map(ReviewRunDTO::from).toList(),
                runs.getTotalElements(),
                page,
                limit));
    }
}
