package org.rostilos.reviewpilot.core.service;

import org.rostilos.reviewpilot.core.dto.review.ReviewCompletion;
import org.rostilos.reviewpilot.core.exception.ReviewNotFoundException;
import org.rostilos.reviewpilot.core.exception.ReviewStateException;
import org.rostilos.reviewpilot.core.model.review.ReviewFinding;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.model.review.ReviewStatus;
import org.rostilos.reviewpilot.core.persistence.repository.review.ReviewFindingRepository;
import org.rostilos.reviewpilot.core.persistence.repository.review.ReviewRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Persistence operations on review runs and their findings.
 * Each pipeline stage writes through here so progress is committed as soon as it happens.
 */
@Service
public class ReviewRunService {

    private static final Logger log = LoggerFactory.getLogger(ReviewRunService.class);

    private final ReviewRunRepository reviewRunRepository;
    private final ReviewFindingRepository reviewFindingRepository;

    public ReviewRunService(
            ReviewRunRepository reviewRunRepository,
            ReviewFindingRepository reviewFindingRepository
    ) {
        this.reviewRunRepository = reviewRunRepository;
        this.reviewFindingRepository = reviewFindingRepository;
    }

    // ==================== Creation & lookup ====================

    @Transactional
    public ReviewRun createRun(ReviewRun run) {
        run.markPending();
        ReviewRun saved = reviewRunRepository.save(run);
        log.info("Created review run {} (repository={}, mr={}, commit={})",
                saved.getId(),
                saved.getRepository() != null ? saved.getRepository().getId() : null,
                saved.getMergeRequestIid(),
                saved.getCommitShortId());
        return saved;
    }

    @Transactional(readOnly = true)
    public ReviewRun getRun(Long runId) {
        return reviewRunRepository.findByIdWithRepository(runId)
                .orElseThrow(() -> new ReviewNotFoundException(runId));
    }

    @Transactional(readOnly = true)
    public List<ReviewFinding> getFindings(Long runId) {
        return reviewFindingRepository.findByReviewRunIdOrderByIdAsc(runId);
    }

    /**
     * Paged listing, newest first. {@code page} is 1-based.
     */
    @Transactional(readOnly = true)
    public Page<ReviewRun> listRuns(Long repositoryId, ReviewStatus status, int page, int limit) {
        PageRequest pageRequest = PageRequest.of(
                Math.max(page, 1) - 1,
                Math.max(limit, 1),
                Sort.by(Sort.Direction.DESC, "startedAt"));
        return reviewRunRepository.findFiltered(repositoryId, status, pageRequest);
    }

    // ==================== Dedup queries ====================

    @Transactional(readOnly = true)
    public boolean hasRecentPendingRun(Long repositoryId, long mergeRequestIid, Duration window) {
        OffsetDateTime since = OffsetDateTime.now().minus(window);
        return reviewRunRepository.existsRecentRun(repositoryId, mergeRequestIid, ReviewStatus.PENDING, since);
    }

    @Transactional(readOnly = true)
    public boolean hasRunForCommit(Long repositoryId, String commitSha) {
        if (commitSha == null || commitSha.isBlank()) {
            return false;
        }
        return reviewRunRepository.existsByRepositoryIdAndCommitSha(repositoryId, commitSha);
    }

    // ==================== Pipeline progress ====================

    @Transactional
    public void markPending(Long runId) {
        ReviewRun run = getRun(runId);
        run.markPending();
        reviewRunRepository.save(run);
    }

    @Transactional
    public void recordTotalFiles(Long runId, int totalFiles) {
        ReviewRun run = getRun(runId);
        run.setTotalFiles(totalFiles);
        reviewRunRepository.save(run);
    }

    @Transactional
    public void saveSummary(Long runId, String summary) {
        ReviewRun run = getRun(runId);
        run.setAiSummary(summary);
        reviewRunRepository.save(run);
    }

    /**
     * @return reviewed file count after the increment
     */
    @Transactional
    public int incrementReviewedFiles(Long runId) {
        ReviewRun run = getRun(runId);
        run.incrementReviewedFiles();
        reviewRunRepository.save(run);
        return run.getReviewedFiles();
    }

    @Transactional
    public void markAllReviewed(Long runId) {
        ReviewRun run = getRun(runId);
        run.markAllReviewed();
        reviewRunRepository.save(run);
    }

    @Transactional
    public ReviewRun completeRun(Long runId, ReviewCompletion completion) {
        ReviewRun run = getRun(runId);
        for (ReviewFinding finding : completion.findings()) {
            finding.setReviewRun(run);
        }
        reviewFindingRepository.saveAll(completion.findings());

        run.setAiModelProvider(completion.modelProvider());
        run.setAiModelId(completion.modelId());
        run.setAiResponse(completion.responsesJson());
        run.setReviewPrompts(completion.promptsJson());
        run.complete(completion.criticalIssues(), completion.normalIssues(), completion.suggestions());
        ReviewRun saved = reviewRunRepository.save(run);
        log.info("Review run {} completed: critical={}, normal={}, suggestion={}, findings stored={}",
                runId, completion.criticalIssues(), completion.normalIssues(), completion.suggestions(),
                completion.findings().size());
        return saved;
    }

    /**
     * Marks a pending run failed. A run that already reached a final status is left untouched.
     *
     * @return true if the run was marked failed
     */
    @Transactional
    public boolean failRun(Long runId, String errorMessage) {
        ReviewRun run = getRun(runId);
        if (run.getStatus() != ReviewStatus.PENDING) {
            log.warn("Review run {} is already {}, not marking it failed: {}", runId, run.getStatus(), errorMessage);
            return false;
        }
        run.fail(errorMessage);
        reviewRunRepository.save(run);
        log.warn("Review run {} failed: {}", runId, errorMessage);
        return true;
    }

    @Transactional
    public void recordPublishFailure(Long runId, String errorMessage) {
        ReviewRun run = getRun(runId);
        run.recordPublishError(errorMessage);
        reviewRunRepository.save(run);
        log.warn("Review run {} stays {} but its comment was not published: {}", runId, run.getStatus(), errorMessage);
    }

    // ==================== Placeholder & publish ====================

    @Transactional
    public boolean assignPlaceholder(Long runId, String discussionId, Long noteId) {
        ReviewRun run = getRun(runId);
        boolean assigned = run.assignPlaceholder(discussionId, noteId);
        if (assigned) {
            reviewRunRepository.save(run);
        }
        return assigned;
    }

    @Transactional
    public void resolvePlaceholderNote(Long runId, Long noteId) {
        ReviewRun run = getRun(runId);
        run.resolvePlaceholderNote(noteId);
        reviewRunRepository.save(run);
    }

    /**
     * Marks every unposted finding of the run as posted under the given comment id.
     *
     * @return number of findings updated
     */
    @Transactional
    public int markFindingsPosted(Long runId, String externalCommentId) {
        List<ReviewFinding> unposted = reviewFindingRepository.findByReviewRunIdAndPostedFalseOrderByIdAsc(runId);
        for (ReviewFinding finding : unposted) {
            finding.markPosted(externalCommentId);
        }
        reviewFindingRepository.saveAll(unposted);
        return unposted.size();
    }

    // ==================== Retry ====================

    /**
     * Resets a terminal run to pending and deletes its findings.
     *
     * @throws ReviewStateException if the run is still pending
     */
    @Transactional
    public ReviewRun resetForRetry(Long runId) {
        ReviewRun run = getRun(runId);
        if (run.getStatus() == ReviewStatus.PENDING) {
            throw new ReviewStateException(runId, run.getStatus(), "Review is already in progress");
        }
        run.resetForRetry();
        int deleted = reviewFindingRepository.deleteByReviewRunId(runId);
        ReviewRun saved = reviewRunRepository.save(run);
        log.info("Review run {} reset for retry, {} findings deleted", runId, deleted);
        return saved;
    }
}
