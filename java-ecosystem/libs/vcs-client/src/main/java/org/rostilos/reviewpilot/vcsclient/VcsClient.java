package org.rostilos.reviewpilot.vcsclient;

import org.rostilos.reviewpilot.vcsclient.model.ChangeDiff;
import org.rostilos.reviewpilot.vcsclient.model.ChangeMetadata;
import org.rostilos.reviewpilot.vcsclient.model.CommitNote;
import org.rostilos.reviewpilot.vcsclient.model.DiffPosition;
import org.rostilos.reviewpilot.vcsclient.model.ThreadNote;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read diffs from and write review comments to a version-control host.
 * Every call goes to the remote API; nothing is cached. Failures propagate as {@link IOException}.
 */
public interface VcsClient {

    // ========== Change metadata & diffs ==========

    /**
     * Title, description, branches, author and diff refs of a merge request.
     */
    ChangeMetadata getChangeMetadata(long projectId, long mergeRequestIid) throws IOException;

    /**
     * Every file changed by the merge request across all of its commits.
     */
    List<ChangeDiff> getFullDiff(long projectId, long mergeRequestIid) throws IOException;

    /**
     * Files changed by a single commit.
     */
    List<ChangeDiff> getCommitDiff(long projectId, String commitSha) throws IOException;

    // ========== Merge request comments ==========

    /**
     * Start a merge request discussion.
     *
     * @param position optional line anchor; null posts a change-level comment
     */
    ThreadNote createThreadComment(long projectId, long mergeRequestIid, String body, DiffPosition position)
            throws IOException;

    ThreadNote updateThreadComment(long projectId, long mergeRequestIid, String discussionId, long noteId, String body)
            throws IOException;

    Optional<Long> getThreadFirstNoteId(long projectId, long mergeRequestIid, String discussionId) throws IOException;

    // ========== Commit comments ==========

    CommitNote createCommitComment(long projectId, String commitSha, String body) throws IOException;

    /**
     * Edit a commit comment, posting a new one where the host cannot edit.
     */
    CommitNote updateCommitComment(long projectId, String commitSha, long noteId, String body) throws IOException;

    Optional<Long> findCommitCommentByMarker(long projectId, String commitSha, String marker) throws IOException;
}
