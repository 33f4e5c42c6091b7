package org.rostilos.reviewpilot.vcsclient.gitlab.actions;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import org.rostilos.reviewpilot.vcsclient.gitlab.GitLabConfig;
import org.rostilos.reviewpilot.vcsclient.model.ChangeDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Action to get the diff for a specific commit in GitLab.
 */
public class GetCommitDiffAction {

    private static final Logger log = LoggerFactory.getLogger(GetCommitDiffAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;

    public GetCommitDiffAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    public List<ChangeDiff> getCommitDiff(long projectId, String commitSha) throws IOException {
        if (commitSha == null || commitSha.isBlank()) {
            throw new IllegalArgumentException("Commit SHA must not be empty");
        }
        String baseUrl = String.format("%s/projects/%d/repository/commits/%s/diff", apiBase, projectId, commitSha);
        List<JsonNode> nodes = GitLabRequests.fetchAllPages(authorizedOkHttpClient, baseUrl, GitLabConfig.DEFAULT_PAGE_SIZE);
        log.debug("Fetched {} diffs for commit {} of project {}", nodes.size(), commitSha, projectId);
        return GitLabDiffMapper.toChangeDiffs(nodes);
    }
}
