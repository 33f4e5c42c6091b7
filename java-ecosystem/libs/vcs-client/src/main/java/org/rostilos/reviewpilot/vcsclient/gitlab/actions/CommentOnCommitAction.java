package org.rostilos.reviewpilot.vcsclient.gitlab.actions;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import org.rostilos.reviewpilot.vcsclient.gitlab.GitLabConfig;
import org.rostilos.reviewpilot.vcsclient.model.CommitNote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Action to comment on a single GitLab commit (push events).
 */
public class CommentOnCommitAction {

    private static final Logger log = LoggerFactory.getLogger(CommentOnCommitAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;

    public CommentOnCommitAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    public CommitNote createComment(long projectId, String commitSha, String body) throws IOException {
        String apiUrl = commentsUrl(projectId, commitSha);

        Map<String, String> payload = new HashMap<>();
        payload.put("note", body);

        JsonNode comment = GitLabRequests.executeForJson(
                authorizedOkHttpClient, GitLabRequests.post(apiUrl, payload), "{}");
        return toCommitNote(comment, body);
    }

    /**
     * Edit a commit comment. Not every GitLab version supports editing commit comments,
     * so any non-success answer falls back to posting a new comment.
     */
    public CommitNote updateComment(long projectId, String commitSha, long noteId, String body) throws IOException {
        String apiUrl = String.format("%s/%d", commentsUrl(projectId, commitSha), noteId);

        Map<String, String> payload = new HashMap<>();
        payload.put("note", body);

        try {
            JsonNode comment = GitLabRequests.executeForJson(
                    authorizedOkHttpClient, GitLabRequests.put(apiUrl, payload), "{}");
            CommitNote updated = toCommitNote(comment, body);
            return updated.noteId() != null ? updated : new CommitNote(noteId, body);
        } catch (IOException e) {
            log.warn("Failed to update commit comment {} on {}, posting a new comment instead: {}",
                    noteId, commitSha, e.getMessage());
            return createComment(projectId, commitSha, body);
        }
    }

    public List<JsonNode> listComments(long projectId, String commitSha) throws IOException {
        return GitLabRequests.fetchAllPages(authorizedOkHttpClient, commentsUrl(projectId, commitSha),
                GitLabConfig.DEFAULT_PAGE_SIZE);
    }

    /**
     * Find the most recent commit comment whose text contains the marker.
     */
    public Optional<Long> findCommentByMarker(long projectId, String commitSha, String marker) throws IOException {
        List<JsonNode> comments = listComments(projectId, commitSha);
        for (int i = comments.size() - 1; i >= 0; i--) {
            JsonNode comment = comments.get(i);
            if (comment.path("note").asText("").contains(marker)) {
                Long id = noteId(comment);
                if (id != null) {
                    return Optional.of(id);
                }
            }
        }
        return Optional.empty();
    }

    private String commentsUrl(long projectId, String commitSha) {
        return String.format("%s/projects/%d/repository/commits/%s/comments", apiBase, projectId, commitSha);
    }

    private static CommitNote toCommitNote(JsonNode comment, String fallbackNote) {
        return new CommitNote(noteId(comment), comment.path("note").asText(fallbackNote));
    }

    private static Long noteId(JsonNode comment) {
        if (comment.path("id").canConvertToLong()) {
            return comment.get("id").asLong();
        }
        if (comment.path("note_id").canConvertToLong()) {
            return comment.get("note_id").asLong();
        }
        return null;
    }
}
