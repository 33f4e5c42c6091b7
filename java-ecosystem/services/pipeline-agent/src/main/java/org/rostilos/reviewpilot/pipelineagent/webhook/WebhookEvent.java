package org.rostilos.reviewpilot.pipelineagent.webhook;

/**
 * GitLab event reduced to what the trigger needs.
 *
 * @param action merge request action ({@code open}, {@code update}, {@code close}...); null for pushes
 * @param branch pushed branch without {@code refs/heads/}; null for merge requests
 */
public record WebhookEvent(
        Kind kind,
        Long projectId,
        String action,
        Long mergeRequestId,
        long mergeRequestIid,
        String sourceBranch,
        String targetBranch,
        String title,
        String description,
        String authorName,
        String authorUsername,
        String commitSha,
        String branch
) {

    public enum Kind {
        MERGE_REQUEST,
        PUSH
    }

    public boolean isMergeRequest() {
        return kind == Kind.MERGE_REQUEST;
    }

    /**
     * Branch the watch patterns apply to: the target branch of a merge request, the pushed branch of a push.
     */
    public String watchedBranch() {
        return isMergeRequest() ? targetBranch : branch;
    }
}
