package org.rostilos.reviewpilot.vcsclient.gitlab.actions;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import org.rostilos.reviewpilot.vcsclient.gitlab.GitLabException;
import org.rostilos.reviewpilot.vcsclient.model.DiffPosition;
import org.rostilos.reviewpilot.vcsclient.model.ThreadNote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Action to create and edit discussion comments on GitLab Merge Requests.
 */
public class CommentOnMergeRequestAction {

    private static final Logger log = LoggerFactory.getLogger(CommentOnMergeRequestAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;

    public CommentOnMergeRequestAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    /**
     * Start a new discussion. With a position the comment is anchored to a line of the diff.
     */
    public ThreadNote createDiscussion(long projectId, long mergeRequestIid, String body, DiffPosition position)
            throws IOException {
        String apiUrl = String.format("%s/projects/%d/merge_requests/%d/discussions",
                apiBase, projectId, mergeRequestIid);

        Map<String, Object> payload = new HashMap<>();
        payload.put("body", body);
        if (position != null) {
            payload.put("position", toPositionPayload(position));
        }

        JsonNode discussion = GitLabRequests.executeForJson(
                authorizedOkHttpClient, GitLabRequests.post(apiUrl, payload), "{}");
        String discussionId = discussion.path("id").asText(null);
        if (discussionId == null || discussionId.isBlank()) {
            throw new GitLabException("create discussion", 200, discussion.toString());
        }
        Long noteId = firstNoteId(discussion).orElse(null);
        log.debug("Created discussion {} (note {}) on MR {}", discussionId, noteId, mergeRequestIid);
        return new ThreadNote(discussionId, noteId);
    }

    /**
     * Replace the body of a note inside a discussion.
     */
    public ThreadNote updateDiscussionNote(long projectId, long mergeRequestIid, String discussionId,
                                           long noteId, String body) throws IOException {
        String apiUrl = String.format("%s/projects/%d/merge_requests/%d/discussions/%s/notes/%d",
                apiBase, projectId, mergeRequestIid, discussionId, noteId);

        Map<String, String> payload = new HashMap<>();
        payload.put("body", body);

        JsonNode note = GitLabRequests.executeForJson(
                authorizedOkHttpClient, GitLabRequests.put(apiUrl, payload), "{}");
        Long returnedId = note.hasNonNull("id") ? note.get("id").asLong() : noteId;
        return new ThreadNote(discussionId, returnedId);
    }

    /**
     * Id of the first note of a discussion, if the discussion has any notes.
     */
    public Optional<Long> getDiscussionFirstNoteId(long projectId, long mergeRequestIid, String discussionId)
            throws IOException {
        String apiUrl = String.format("%s/projects/%d/merge_requests/%d/discussions/%s",
                apiBase, projectId, mergeRequestIid, discussionId);
        JsonNode discussion = GitLabRequests.executeForJson(
                authorizedOkHttpClient, GitLabRequests.get(apiUrl), "{}");
        return firstNoteId(discussion);
    }

    private static Optional<Long> firstNoteId(JsonNode discussion) {
        JsonNode notes = discussion.path("notes");
        if (notes.isArray() && !notes.isEmpty() && notes.get(0).path("id").canConvertToLong()) {
            return Optional.of(notes.get(0).get("id").asLong());
        }
        return Optional.empty();
    }

    private static Map<String, Object> toPositionPayload(DiffPosition position) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("base_sha", position.diffRefs().baseSha());
        payload.put("head_sha", position.diffRefs().headSha());
        payload.put("start_sha", position.diffRefs().startSha());
        payload.put("position_type", "text");
        payload.put("old_path", position.oldPath() != null ? position.oldPath() : position.newPath());
        payload.put("new_path", position.newPath());
        payload.put("new_line", position.newLine());
        return payload;
    }
}
