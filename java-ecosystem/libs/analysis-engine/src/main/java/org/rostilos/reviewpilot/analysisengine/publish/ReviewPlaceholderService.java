package org.rostilos.reviewpilot.analysisengine.publish;

import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.service.ReviewRunService;
import org.rostilos.reviewpilot.vcsclient.VcsClient;
import org.rostilos.reviewpilot.vcsclient.VcsClientProvider;
import org.rostilos.reviewpilot.vcsclient.model.CommitNote;
import org.rostilos.reviewpilot.vcsclient.model.ThreadNote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Posts an "in progress" comment when a run starts. The final review replaces its text.
 */
@Service
public class ReviewPlaceholderService {
    private static final Logger log = LoggerFactory.getLogger(ReviewPlaceholderService.class);

    static final String PLACEHOLDER_MESSAGE = "⏳ ReviewPilot is reviewing this change…";

    private final ReviewRunService reviewRunService;
    private final VcsClientProvider vcsClientProvider;

    @Value("${reviewpilot.review.placeholder.enabled:true}")
    private boolean enabled = true;

    public ReviewPlaceholderService(ReviewRunService reviewRunService, VcsClientProvider vcsClientProvider) {
        this.reviewRunService = reviewRunService;
        this.vcsClientProvider = vcsClientProvider;
    }

    /**
     * Creates the placeholder unless disabled or already present. Failures are logged; the review proceeds.
     */
    public void createPlaceholder(ReviewRun run) {
        if (!enabled || run.hasPlaceholder()) {
            return;
        }
        try {
            VcsClient vcsClient = vcsClientProvider.getClient(run.getRepository().getGitLabAccount());
            long projectId = run.getRepository().getGitLabProjectId();
            if (run.isPushEvent()) {
                String marker = ReviewPublisher.placeholderMarker(run.getId());
                CommitNote note = vcsClient.createCommitComment(projectId, run.getCommitSha(),
                        PLACEHOLDER_MESSAGE + ReviewPublisher.hiddenMarker(marker));
                reviewRunService.assignPlaceholder(run.getId(), marker, note.noteId());
            } else {
                ThreadNote note = vcsClient.createThreadComment(projectId, run.getMergeRequestIid(),
                        PLACEHOLDER_MESSAGE, null);
                reviewRunService.assignPlaceholder(run.getId(), note.discussionId(), note.noteId());
            }
            log.debug("Created placeholder comment for review run {}", run.getId());
        } catch (Exception e) {
            log.warn("Failed to create placeholder comment for review run {}: {}", run.getId(), e.getMessage());
        }
    }
}
