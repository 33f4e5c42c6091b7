package org.rostilos.reviewpilot.analysisengine.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.reviewpilot.analysisengine.config.ModelConfigResolver;
import org.rostilos.reviewpilot.analysisengine.exception.ReviewPipelineException;
import org.rostilos.reviewpilot.analysisengine.format.ReviewCommentFormatter;
import org.rostilos.reviewpilot.analysisengine.format.ReviewReport;
import org.rostilos.reviewpilot.analysisengine.llm.LlmClient;
import org.rostilos.reviewpilot.analysisengine.parser.CriticalItem;
import org.rostilos.reviewpilot.analysisengine.parser.FindingParser;
import org.rostilos.reviewpilot.analysisengine.parser.ParsedReview;
import org.rostilos.reviewpilot.analysisengine.parser.SeverityCounts;
import org.rostilos.reviewpilot.analysisengine.prompt.ReviewPrompts;
import org.rostilos.reviewpilot.analysisengine.prompt.SystemPromptResolver;
import org.rostilos.reviewpilot.analysisengine.publish.ReviewPublisher;
import org.rostilos.reviewpilot.core.dto.review.ReviewCompletion;
import org.rostilos.reviewpilot.core.model.config.RepositoryConfig;
import org.rostilos.reviewpilot.core.model.review.FindingSeverity;
import org.rostilos.reviewpilot.core.model.review.ReviewFinding;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.service.ReviewRunService;
import org.rostilos.reviewpilot.vcsclient.VcsClient;
import org.rostilos.reviewpilot.vcsclient.VcsClientProvider;
import org.rostilos.reviewpilot.vcsclient.model.ChangeDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drives one review run through its stages:
 * <pre>
 * FETCH_DIFF -> GENERATE_SUMMARY -> REVIEW_FILE (per file) | REVIEW_BATCH -> AGGREGATE -> PUBLISH -> END
 * </pre>
 * Stages run sequentially. Any failure marks the run failed and is rethrown as
 * {@link ReviewPipelineException}; a retry starts again from {@link ReviewStage#FETCH_DIFF}.
 */
@Service
public class ReviewPipeline {
    private static final Logger log = LoggerFactory.getLogger(ReviewPipeline.class);

    private final ReviewRunService reviewRunService;
    private final VcsClientProvider vcsClientProvider;
    private final LlmClient llmClient;
    private final ModelConfigResolver modelConfigResolver;
    private final SystemPromptResolver systemPromptResolver;
    private final ReviewCommentFormatter commentFormatter;
    private final ReviewPublisher reviewPublisher;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Value("${reviewpilot.review.batch-threshold:20}")
    private int batchThreshold = 20;

    @Value("${reviewpilot.review.max-critical-findings:5}")
    private int maxCriticalFindings = 5;

    public ReviewPipeline(
            ReviewRunService reviewRunService,
            VcsClientProvider vcsClientProvider,
            LlmClient llmClient,
            ModelConfigResolver modelConfigResolver,
            SystemPromptResolver systemPromptResolver,
            ReviewCommentFormatter commentFormatter,
            ReviewPublisher reviewPublisher
    ) {
        this.reviewRunService = reviewRunService;
        this.vcsClientProvider = vcsClientProvider;
        this.llmClient = llmClient;
        this.modelConfigResolver = modelConfigResolver;
        this.systemPromptResolver = systemPromptResolver;
        this.commentFormatter = commentFormatter;
        this.reviewPublisher = reviewPublisher;
    }

    /**
     * Whether the per-file loop has another file at {@code nextIndex}.
     */
    public static boolean shouldContinue(int nextIndex, int totalFiles) {
        return nextIndex < totalFiles;
    }

    /**
     * Run the whole pipeline for a persisted review run.
     *
     * @return the final state
     * @throws ReviewPipelineException if any stage fails; the run is already marked failed
     */
    public ReviewState run(Long runId) {
        ReviewState state = new ReviewState(runId);
        ReviewStage stage = ReviewStage.FETCH_DIFF;
        int fileIndex = 0;
        try {
            while (stage != ReviewStage.END) {
                log.debug("Review run {}: entering stage {}", runId, stage);
                ReviewStage next = step(stage, state, fileIndex);
                if (stage == ReviewStage.REVIEW_FILE) {
                    fileIndex++;
                    next = shouldContinue(fileIndex, state.fileCount()) ? ReviewStage.REVIEW_FILE : ReviewStage.AGGREGATE;
                }
                stage = next;
            }
            log.info("Review run {} finished", runId);
            return state;
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Review run {} failed in stage {}: {}", runId, stage, message, e);
            reviewRunService.failRun(runId, message);
            if (e instanceof ReviewPipelineException pipelineException) {
                throw pipelineException;
            }
            throw new ReviewPipelineException(message, e);
        }
    }

    ReviewStage step(ReviewStage stage, ReviewState state, int fileIndex) throws IOException {
        return switch (stage) {
            case FETCH_DIFF -> {
                fetchDiff(state);
                yield ReviewStage.GENERATE_SUMMARY;
            }
            case GENERATE_SUMMARY -> {
                generateSummary(state);
                yield afterSummary(state);
            }
            case REVIEW_FILE -> {
                reviewFile(state, fileIndex);
                yield ReviewStage.REVIEW_FILE;
            }
            case REVIEW_BATCH -> {
                reviewBatch(state);
                yield ReviewStage.AGGREGATE;
            }
            case AGGREGATE -> {
                aggregate(state);
                yield ReviewStage.PUBLISH;
            }
            case PUBLISH -> {
                publishCompletedRun(state);
                yield ReviewStage.END;
            }
            case END -> ReviewStage.END;
        };
    }

    private ReviewStage afterSummary(ReviewState state) {
        if (state.fileCount() == 0) {
            return ReviewStage.AGGREGATE;
        }
        if (state.fileCount() > batchThreshold) {
            state.setBatchMode(true);
            return ReviewStage.REVIEW_BATCH;
        }
        return ReviewStage.REVIEW_FILE;
    }

    // ==================== Stages ====================

    private void fetchDiff(ReviewState state) throws IOException {
        Long runId = state.getRunId();
        reviewRunService.markPending(runId);
        ReviewRun run = reviewRunService.getRun(runId);
        state.setRun(run);

        RepositoryConfig repository = run.getRepository();
        state.setModelConfig(modelConfigResolver.resolve(repository));
        state.setSystemPrompt(systemPromptResolver.resolve(repository));

        VcsClient vcsClient = vcsClientProvider.getClient(repository.getGitLabAccount());
        long projectId = repository.getGitLabProjectId();

        List<ChangeDiff> diffs;
        if (run.isPushEvent()) {
            if (run.getCommitSha() == null || run.getCommitSha().isBlank()) {
                throw new ReviewPipelineException("Push review has no commit SHA");
            }
            diffs = vcsClient.getCommitDiff(projectId, run.getCommitSha());
        } else {
            state.setMetadata(vcsClient.getChangeMetadata(projectId, run.getMergeRequestIid()));
            diffs = vcsClient.getFullDiff(projectId, run.getMergeRequestIid());
        }

        List<ChangeDiff> relevant = diffs.stream().filter(diff -> !diff.deletedFile()).toList();
        if (relevant.isEmpty()) {
            throw new ReviewPipelineException("No changed files to review");
        }
        state.setDiffs(relevant);
        reviewRunService.recordTotalFiles(runId, relevant.size());
        log.info("Review run {}: {} file(s) to review with {}/{}", runId, relevant.size(),
                state.getModelConfig().providerId(), state.getModelConfig().modelId());
    }

    private void generateSummary(ReviewState state) throws IOException {
        String allDiffs = state.getDiffs().stream()
                .map(ChangeDiff::diff)
                .collect(Collectors.joining("\n"));
        String prompt = ReviewPrompts.buildSummaryPrompt(state.title(), state.description(), allDiffs);
        String summary = llmClient.invoke(ReviewPrompts.SUMMARY_SYSTEM_PROMPT, prompt, state.getModelConfig());
        state.setSummary(summary.trim());
        reviewRunService.saveSummary(state.getRunId(), state.getSummary());
    }

    private void reviewFile(ReviewState state, int fileIndex) throws IOException {
        ChangeDiff diff = state.getDiffs().get(fileIndex);
        String filePath = diff.path();
        log.debug("Review run {}: reviewing file {}/{} {}", state.getRunId(), fileIndex + 1, state.fileCount(), filePath);

        String userPrompt = ReviewPrompts.buildReviewPrompt(state.title(), state.getSummary(), state.description(),
                filePath, ReviewPrompts.formatPatch(diff));
        String response = llmClient.invoke(state.getSystemPrompt(), userPrompt, state.getModelConfig());
        ParsedReview parsed = FindingParser.parse(response, filePath, maxCriticalFindings);

        state.addResult(new FileReviewResult(filePath, response,
                ReviewPrompts.recordedPrompt(state.getSystemPrompt(), userPrompt),
                parsed.counts(), parsed.criticalItems()));
        reviewRunService.incrementReviewedFiles(state.getRunId());
    }

    private void reviewBatch(ReviewState state) throws IOException {
        List<ReviewPrompts.PatchFile> files = state.getDiffs().stream()
                .map(diff -> new ReviewPrompts.PatchFile(diff.path(), ReviewPrompts.formatPatch(diff)))
                .toList();
        log.info("Review run {}: {} files exceed the batch threshold of {}, reviewing in one call",
                state.getRunId(), files.size(), batchThreshold);

        String userPrompt = ReviewPrompts.buildBatchReviewPrompt(state.title(), state.description(), files);
        String response = llmClient.invoke(state.getSystemPrompt(), userPrompt, state.getModelConfig());
        ParsedReview parsed = FindingParser.parse(response, null, maxCriticalFindings);

        state.setBatchResponse(response);
        state.addResult(new FileReviewResult(ReviewState.BATCH_REVIEW_KEY, response,
                ReviewPrompts.recordedPrompt(state.getSystemPrompt(), userPrompt),
                parsed.counts(), parsed.criticalItems()));
        reviewRunService.markAllReviewed(state.getRunId());
    }

    private void aggregate(ReviewState state) throws JsonProcessingException {
        SeverityCounts totals = state.totalCounts();
        List<ReviewFinding> findings = new ArrayList<>();
        for (CriticalItem item : state.getCriticalItems()) {
            if (findings.size() >= maxCriticalFindings) {
                break;
            }
            findings.add(toFinding(item));
        }
        int discarded = state.getCriticalItems().size() - findings.size();
        if (discarded > 0) {
            log.debug("Review run {}: keeping {} critical findings, {} beyond the cap are counted only",
                    state.getRunId(), findings.size(), discarded);
        }

        reviewRunService.completeRun(state.getRunId(), new ReviewCompletion(
                totals.critical(),
                totals.normal(),
                totals.suggestion(),
                findings,
                state.getModelConfig().providerId(),
                state.getModelConfig().modelId(),
                toJson(state.getResponsesByFile()),
                toJson(state.getPromptsByFile())));
    }

    /**
     * The run is already completed when this runs, so a failure is recorded on it instead of failing it.
     * A retry publishes again.
     */
    private void publishCompletedRun(ReviewState state) {
        try {
            publish(state.getRunId(), state);
        } catch (IOException | RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Review run {} completed but its comment could not be published: {}", state.getRunId(), message, e);
            reviewRunService.recordPublishFailure(state.getRunId(), "Publish failed: " + message);
        }
    }

    /**
     * Render and post the review comment for a completed run. Safe to call again for the same run:
     * the comment recorded on the run is edited instead of a new one being created.
     */
    public void publish(Long runId, ReviewState state) throws IOException {
        ReviewRun run = reviewRunService.getRun(runId);
        List<ReviewFinding> findings = reviewRunService.getFindings(runId);
        String body = commentFormatter.format(ReviewReport.of(run, state, findings));
        reviewPublisher.publish(run, body);
    }

    private static ReviewFinding toFinding(CriticalItem item) {
        ReviewFinding finding = new ReviewFinding();
        finding.setFilePath(item.filePath() != null ? item.filePath() : ReviewState.BATCH_REVIEW_KEY);
        finding.setLineNumber(item.lineNumber());
        finding.setLineRangeEnd(item.lineRangeEnd());
        finding.setSeverity(FindingSeverity.CRITICAL);
        finding.setContent(item.content());
        return finding;
    }

    private String toJson(Map<String, String> values) throws JsonProcessingException {
        return objectMapper.writeValueAsString(values);
    }
}
