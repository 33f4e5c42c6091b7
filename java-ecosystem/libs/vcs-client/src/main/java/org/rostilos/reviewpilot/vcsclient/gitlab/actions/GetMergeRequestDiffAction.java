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
 * Action to get every changed file of a GitLab Merge Request.
 * The {@code /diffs} endpoint compares the merge base with the MR head, so changes from
 * all commits of the merge request are included, not only the latest one.
 */
public class GetMergeRequestDiffAction {

    private static final Logger log = LoggerFactory.getLogger(GetMergeRequestDiffAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;

    public GetMergeRequestDiffAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    public List<ChangeDiff> getMergeRequestDiffs(long projectId, long mergeRequestIid) throws IOException {
        String baseUrl = String.format("%s/projects/%d/merge_requests/%d/diffs", apiBase, projectId, mergeRequestIid);
        List<JsonNode> nodes = GitLabRequests.fetchAllPages(authorizedOkHttpClient, baseUrl, GitLabConfig.DEFAULT_PAGE_SIZE);
        log.debug("Fetched {} diffs for MR {} of project {}", nodes.size(), mergeRequestIid, projectId);
        return GitLabDiffMapper.toChangeDiffs(nodes);
    }
}
