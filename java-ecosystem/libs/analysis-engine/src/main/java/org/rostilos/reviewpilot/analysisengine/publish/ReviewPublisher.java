package org.rostilos.reviewpilot.analysisengine.publish;

import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.service.ReviewRunService;
import org.rostilos.reviewpilot.vcsclient.VcsClient;
import org.rostilos.reviewpilot.vcsclient.VcsClientProvider;
import org.rostilos.reviewpilot.vcsclient.model.CommitNote;
import org.rostilos.reviewpilot.vcsclient.model.ThreadNote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Posts the review comment for a run, editing the run's placeholder comment when one exists
 * so that a run never leaves more than one summary comment behind.
 */
@Service
public class ReviewPublisher {
    private static final Logger log = LoggerFactory.getLogger(ReviewPublisher.class);

    static final String PLACEHOLDER_MARKER_PREFIX = "REVIEW_PLACEHOLDER:";

    private final ReviewRunService reviewRunService;
    private final VcsClientProvider vcsClientProvider;

    public ReviewPublisher(ReviewRunService reviewRunService, VcsClientProvider vcsClientProvider) {
        this.reviewRunService = reviewRunService;
        this.vcsClientProvider = vcsClientProvider;
    }

    public static String placeholderMarker(Long runId) {
        return PLACEHOLDER_MARKER_PREFIX + runId;
    }

    /**
     * Hidden marker appended to commit comments so they can be found again by text.
     */
    public static String hiddenMarker(String marker) {
        return "\n\n<!-- " + marker + " -->";
    }

    /**
     * Publish {@code body} for the run and mark its unposted findings as posted.
     *
     * @return id of the comment that now holds the body, or null if GitLab did not report one
     * @throws IOException if GitLab rejects the create or update call
     */
    public String publish(ReviewRun run, String body) throws IOException {
        VcsClient vcsClient = vcsClientProvider.getClient(run.getRepository().getGitLabAccount());
        String externalId = run.isPushEvent()
                ? publishOnCommit(vcsClient, run, body)
                : publishOnMergeRequest(vcsClient, run, body);
        int posted = reviewRunService.markFindingsPosted(run.getId(), externalId);
        log.info("Published review run {} as comment {} ({} findings marked posted)", run.getId(), externalId, posted);
        return externalId;
    }

    private String publishOnCommit(VcsClient vcsClient, ReviewRun run, String body) throws IOException {
        long projectId = run.getRepository().getGitLabProjectId();
        String commitSha = run.getCommitSha();
        String marker = run.getGitlabDiscussionId() != null
                ? run.getGitlabDiscussionId()
                : placeholderMarker(run.getId());
        String markedBody = body + hiddenMarker(marker);

        Long noteId = run.getGitlabNoteId();
        if (noteId == null) {
            try {
                Optional<Long> found = vcsClient.findCommitCommentByMarker(projectId, commitSha, marker);
                if (found.isPresent()) {
                    noteId = found.get();
                    reviewRunService.resolvePlaceholderNote(run.getId(), noteId);
                    log.debug("Resolved placeholder commit comment {} by marker {}", noteId, marker);
                }
            } catch (IOException e) {
                log.warn("Failed to look up placeholder comment for run {}, posting a new comment: {}",
                        run.getId(), e.getMessage());
            }
        }

        CommitNote note;
        if (noteId != null) {
            note = vcsClient.updateCommitComment(projectId, commitSha, noteId, markedBody);
        } else {
            note = vcsClient.createCommitComment(projectId, commitSha, markedBody);
            reviewRunService.assignPlaceholder(run.getId(), marker, note.noteId());
        }
        return note.noteId() != null ? String.valueOf(note.noteId()) : null;
    }

    private String publishOnMergeRequest(VcsClient vcsClient, ReviewRun run, String body) throws IOException {
        long projectId = run.getRepository().getGitLabProjectId();
        long iid = run.getMergeRequestIid();
        String discussionId = run.getGitlabDiscussionId();
        Long noteId = run.getGitlabNoteId();

        if (discussionId != null && noteId == null) {
            try {
                Optional<Long> first = vcsClient.getThreadFirstNoteId(projectId, iid, discussionId);
                if (first.isPresent()) {
                    noteId = first.get();
                    reviewRunService.resolvePlaceholderNote(run.getId(), noteId);
                }
            } catch (IOException e) {
                log.warn("Failed to resolve note of placeholder discussion {} for run {}, posting a new comment: {}",
                        discussionId, run.getId(), e.getMessage());
            }
        }

        ThreadNote note;
        if (discussionId != null && noteId != null) {
            note = vcsClient.updateThreadComment(projectId, iid, discussionId, noteId, body);
        } else {
            note = vcsClient.createThreadComment(projectId, iid, body, null);
            reviewRunService.assignPlaceholder(run.getId(), note.discussionId(), note.noteId());
        }
        return note.noteId() != null ? String.valueOf(note.noteId()) : null;
    }
}
