package org.rostilos.reviewpilot.pipelineagent.service;

import org.rostilos.reviewpilot.analysisengine.config.ModelConfigResolver;
import org.rostilos.reviewpilot.analysisengine.exception.ModelConfigurationException;
import org.rostilos.reviewpilot.core.model.config.RepositoryConfig;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.persistence.repository.config.RepositoryConfigRepository;
import org.rostilos.reviewpilot.core.service.ReviewRunService;
import org.rostilos.reviewpilot.core.util.BranchPatternMatcher;
import org.rostilos.reviewpilot.pipelineagent.exception.RepositoryNotFoundException;
import org.rostilos.reviewpilot.pipelineagent.webhook.WebhookEvent;
import org.rostilos.reviewpilot.vcsclient.VcsClient;
import org.rostilos.reviewpilot.vcsclient.VcsClientProvider;
import org.rostilos.reviewpilot.vcsclient.model.ChangeMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an event starts a review run and dispatches the run.
 * <p>
 * Webhook events that do not qualify are acknowledged as ignored. The duplicate checks are
 * advisory: two identical events arriving at the same moment can both start a run.
 */
@Service
public class ReviewTriggerService {

    private static final Logger log = LoggerFactory.getLogger(ReviewTriggerService.class);

    static final Set<String> REVIEWABLE_ACTIONS = Set.of("open", "reopen", "update");

    private final RepositoryConfigRepository repositoryConfigRepository;
    private final ReviewRunService reviewRunService;
    private final ModelConfigResolver modelConfigResolver;
    private final VcsClientProvider vcsClientProvider;
    private final ReviewRunExecutor reviewRunExecutor;

    @Value("${reviewpilot.review.dedup-window-minutes:5}")
    private long dedupWindowMinutes = 5;

    public ReviewTriggerService(
            RepositoryConfigRepository repositoryConfigRepository,
            ReviewRunService reviewRunService,
            ModelConfigResolver modelConfigResolver,
            VcsClientProvider vcsClientProvider,
            ReviewRunExecutor reviewRunExecutor
    ) {
        this.repositoryConfigRepository = repositoryConfigRepository;
        this.reviewRunService = reviewRunService;
        this.modelConfigResolver = modelConfigResolver;
        this.vcsClientProvider = vcsClientProvider;
        this.reviewRunExecutor = reviewRunExecutor;
    }

    public TriggerResult handle(WebhookEvent event) {
        if (event.projectId() == null) {
            return ignored(event, "Payload carries no project id");
        }
        Optional<RepositoryConfig> found = repositoryConfigRepository.findFirstByGitLabProjectIdAndActiveTrue(event.projectId());
        if (found.isEmpty()) {
            return ignored(event, "Repository not configured");
        }
        RepositoryConfig repository = found.get();
        if (!repository.isAutoReview()) {
            return ignored(event, "Auto review disabled");
        }
        if (repository.getGitLabAccount() == null) {
            return ignored(event, "No GitLab account configured");
        }
        if (event.isMergeRequest() && !REVIEWABLE_ACTIONS.contains(event.action())) {
            return ignored(event, "Merge request action '" + event.action() + "' is not reviewed");
        }
        if (!BranchPatternMatcher.matches(event.watchedBranch(), repository.getWatchBranches())) {
            return ignored(event, "Branch '" + event.watchedBranch() + "' does not match watch patterns");
        }
        if (isDuplicate(repository, event)) {
            return ignored(event, "Duplicate of an existing review run");
        }
        try {
            modelConfigResolver.resolve(repository);
        } catch (ModelConfigurationException e) {
            return ignored(event, e.getMessage());
        }

        ReviewRun run = event.isMergeRequest() ? mergeRequestRun(event) : pushRun(event);
        run.setRepository(repository);
        return dispatch(reviewRunService.createRun(run));
    }

    /**
     * Start a review of a merge request on request, reading its metadata from GitLab.
     *
     * @throws RepositoryNotFoundException if the repository does not exist
     * @throws ModelConfigurationException if no usable model is configured
     * @throws IOException                 if GitLab cannot return the merge request
     */
    public TriggerResult triggerManual(Long repositoryId, long mergeRequestIid) throws IOException {
        RepositoryConfig repository = repositoryConfigRepository.findByIdWithAccount(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));
        modelConfigResolver.resolve(repository);

        VcsClient vcsClient = vcsClientProvider.getClient(repository.getGitLabAccount());
        ChangeMetadata metadata = vcsClient.getChangeMetadata(repository.getGitLabProjectId(), mergeRequestIid);

        ReviewRun run = new ReviewRun();
        run.setRepository(repository);
        run.setMergeRequestId(metadata.id());
        run.setMergeRequestIid(metadata.iid());
        run.setSourceBranch(metadata.sourceBranch());
        run.setTargetBranch(metadata.targetBranch());
        run.setAuthor(metadata.authorName() != null ? metadata.authorName() : metadata.authorUsername());
        run.setAuthorUsername(metadata.authorUsername());
        run.setTitle(metadata.title());
        run.setDescription(metadata.description());
        run.setCommitSha(metadata.headSha());
        log.info("Manual review requested for repository {} merge request !{}", repositoryId, mergeRequestIid);
        return dispatch(reviewRunService.createRun(run));
    }

    /**
     * Reset a finished run and review it again from the start.
     */
    public TriggerResult retry(Long runId) {
        ReviewRun run = reviewRunService.resetForRetry(runId);
        log.info("Retrying review run {}", run.getId());
        return dispatch(run);
    }

    private boolean isDuplicate(RepositoryConfig repository, WebhookEvent event) {
        if (event.isMergeRequest()) {
            return reviewRunService.hasRecentPendingRun(repository.getId(), event.mergeRequestIid(),
                    Duration.ofMinutes(dedupWindowMinutes));
        }
        return reviewRunService.hasRunForCommit(repository.getId(), event.commitSha());
    }

    private TriggerResult dispatch(ReviewRun run) {
        reviewRunExecutor.execute(run.getId());
        return TriggerResult.started(run.getId());
    }

    private static ReviewRun mergeRequestRun(WebhookEvent event) {
        ReviewRun run = new ReviewRun();
        run.setMergeRequestId(event.mergeRequestId());
        run.setMergeRequestIid(event.mergeRequestIid());
        run.setSourceBranch(event.sourceBranch());
        run.setTargetBranch(event.targetBranch());
        run.setAuthor(event.authorName());
        run.setAuthorUsername(event.authorUsername());
        run.setTitle(event.title());
        run.setDescription(event.description());
        run.setCommitSha(event.commitSha());
        return run;
    }

    private static ReviewRun pushRun(WebhookEvent event) {
        ReviewRun run = new ReviewRun();
        run.setMergeRequestIid(ReviewRun.PUSH_EVENT_IID);
        run.setSourceBranch(event.branch());
        run.setTargetBranch(event.branch());
        run.setAuthor(event.authorName());
        run.setAuthorUsername(event.authorUsername());
        run.setTitle(event.title());
        run.setDescription(event.description());
        run.setCommitSha(event.commitSha());
        return run;
    }

    private static TriggerResult ignored(WebhookEvent event, String reason) {
        log.debug("Ignoring {} event for project {}: {}", event.kind(), event.projectId(), reason);
        return TriggerResult.ignored(reason);
    }
}
