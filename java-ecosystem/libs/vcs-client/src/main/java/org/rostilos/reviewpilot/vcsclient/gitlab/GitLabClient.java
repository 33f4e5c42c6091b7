package org.rostilos.reviewpilot.vcsclient.gitlab;

import okhttp3.OkHttpClient;
import org.rostilos.reviewpilot.vcsclient.VcsClient;
import org.rostilos.reviewpilot.vcsclient.gitlab.actions.CommentOnCommitAction;
import org.rostilos.reviewpilot.vcsclient.gitlab.actions.CommentOnMergeRequestAction;
import org.rostilos.reviewpilot.vcsclient.gitlab.actions.GetCommitDiffAction;
import org.rostilos.reviewpilot.vcsclient.gitlab.actions.GetMergeRequestAction;
import org.rostilos.reviewpilot.vcsclient.gitlab.actions.GetMergeRequestDiffAction;
import org.rostilos.reviewpilot.vcsclient.model.ChangeDiff;
import org.rostilos.reviewpilot.vcsclient.model.ChangeMetadata;
import org.rostilos.reviewpilot.vcsclient.model.CommitNote;
import org.rostilos.reviewpilot.vcsclient.model.DiffPosition;
import org.rostilos.reviewpilot.vcsclient.model.ThreadNote;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * VcsClient implementation for GitLab, delegating each operation to an action class.
 */
public class GitLabClient implements VcsClient {

    private final GetMergeRequestAction getMergeRequestAction;
    private final GetMergeRequestDiffAction getMergeRequestDiffAction;
    private final GetCommitDiffAction getCommitDiffAction;
    private final CommentOnMergeRequestAction commentOnMergeRequestAction;
    private final CommentOnCommitAction commentOnCommitAction;
    private final String apiBase;

    public GitLabClient(OkHttpClient httpClient) {
        this(httpClient, GitLabConfig.API_BASE);
    }

    public GitLabClient(OkHttpClient httpClient, String apiBase) {
        this.apiBase = apiBase != null ? apiBase : GitLabConfig.API_BASE;
        this.getMergeRequestAction = new GetMergeRequestAction(httpClient, this.apiBase);
        this.getMergeRequestDiffAction = new GetMergeRequestDiffAction(httpClient, this.apiBase);
        this.getCommitDiffAction = new GetCommitDiffAction(httpClient, this.apiBase);
        this.commentOnMergeRequestAction = new CommentOnMergeRequestAction(httpClient, this.apiBase);
        this.commentOnCommitAction = new CommentOnCommitAction(httpClient, this.apiBase);
    }

    public String getApiBase() {
        return apiBase;
    }

    @Override
    public ChangeMetadata getChangeMetadata(long projectId, long mergeRequestIid) throws IOException {
        return getMergeRequestAction.getMergeRequest(projectId, mergeRequestIid);
    }

    @Override
    public List<ChangeDiff> getFullDiff(long projectId, long mergeRequestIid) throws IOException {
        return getMergeRequestDiffAction.getMergeRequestDiffs(projectId, mergeRequestIid);
    }

    @Override
    public List<ChangeDiff> getCommitDiff(long projectId, String commitSha) throws IOException {
        return getCommitDiffAction.getCommitDiff(projectId, commitSha);
    }

    @Override
    public ThreadNote createThreadComment(long projectId, long mergeRequestIid, String body, DiffPosition position)
            throws IOException {
        return commentOnMergeRequestAction.createDiscussion(projectId, mergeRequestIid, body, position);
    }

    @Override
    public ThreadNote updateThreadComment(long projectId, long mergeRequestIid, String discussionId, long noteId,
                                          String body) throws IOException {
        return commentOnMergeRequestAction.updateDiscussionNote(projectId, mergeRequestIid, discussionId, noteId, body);
    }

    @Override
    public Optional<Long> getThreadFirstNoteId(long projectId, long mergeRequestIid, String discussionId)
            throws IOException {
        return commentOnMergeRequestAction.getDiscussionFirstNoteId(projectId, mergeRequestIid, discussionId);
    }

    @Override
    public CommitNote createCommitComment(long projectId, String commitSha, String body) throws IOException {
        return commentOnCommitAction.createComment(projectId, commitSha, body);
    }

    @Override
    public CommitNote updateCommitComment(long projectId, String commitSha, long noteId, String body)
            throws IOException {
        return commentOnCommitAction.updateComment(projectId, commitSha, noteId, body);
    }

    @Override
    public Optional<Long> findCommitCommentByMarker(long projectId, String commitSha, String marker)
            throws IOException {
        return commentOnCommitAction.findCommentByMarker(projectId, commitSha, marker);
    }
}
