package org.rostilos.reviewpilot.vcsclient.gitlab.actions;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import org.rostilos.reviewpilot.vcsclient.model.ChangeMetadata;
import org.rostilos.reviewpilot.vcsclient.model.DiffRefs;

import java.io.IOException;

/**
 * Action to get GitLab Merge Request metadata.
 */
public class GetMergeRequestAction {

    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;

    public GetMergeRequestAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    /**
     * Get merge request metadata.
     *
     * @param projectId numeric GitLab project id
     * @param mergeRequestIid the merge request IID (internal ID)
     * @return title, description, branches, author and diff refs of the merge request
     */
    public ChangeMetadata getMergeRequest(long projectId, long mergeRequestIid) throws IOException {
        String apiUrl = String.format("%s/projects/%d/merge_requests/%d", apiBase, projectId, mergeRequestIid);
        JsonNode mr = GitLabRequests.executeForJson(authorizedOkHttpClient, GitLabRequests.get(apiUrl), "{}");
        return toMetadata(mr);
    }

    static ChangeMetadata toMetadata(JsonNode mr) {
        JsonNode author = mr.path("author");
        JsonNode refs = mr.path("diff_refs");
        DiffRefs diffRefs = refs.isObject()
                ? new DiffRefs(textOrNull(refs, "base_sha"), textOrNull(refs, "head_sha"), textOrNull(refs, "start_sha"))
                : null;
        String authorName = textOrNull(author, "name");
        return new ChangeMetadata(
                mr.hasNonNull("id") ? mr.get("id").asLong() : null,
                mr.path("iid").asLong(),
                mr.path("title").asText(""),
                textOrNull(mr, "description"),
                textOrNull(mr, "source_branch"),
                textOrNull(mr, "target_branch"),
                authorName != null ? authorName : textOrNull(author, "username"),
                textOrNull(author, "username"),
                textOrNull(mr, "web_url"),
                diffRefs
        );
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
