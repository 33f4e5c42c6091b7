package org.rostilos.reviewpilot.pipelineagent.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Parser for GitLab webhook payloads.
 * Handles merge request and push events; every other event type yields an empty result.
 */
@Component
public class GitLabWebhookParser {

    public static final String MERGE_REQUEST_HOOK = "Merge Request Hook";
    public static final String PUSH_HOOK = "Push Hook";

    private static final String BRANCH_REF_PREFIX = "refs/heads/";
    private static final String NULL_SHA = "0000000000000000000000000000000000000000";

    /**
     * @param eventType the X-Gitlab-Event header value
     * @param payload   the raw JSON payload
     * @return the event, or empty if the type is not reviewed or the push deleted a branch
     */
    public Optional<WebhookEvent> parse(String eventType, JsonNode payload) {
        if (MERGE_REQUEST_HOOK.equals(eventType)) {
            return Optional.of(parseMergeRequest(payload));
        }
        if (PUSH_HOOK.equals(eventType)) {
            return parsePush(payload);
        }
        return Optional.empty();
    }

    private WebhookEvent parseMergeRequest(JsonNode payload) {
        JsonNode attributes = payload.path("object_attributes");
        JsonNode user = payload.path("user");

        String commitSha = attributes.path("last_commit").path("id").asText(null);
        if (commitSha == null) {
            commitSha = attributes.path("diff_refs").path("head_sha").asText(null);
        }

        return new WebhookEvent(
                WebhookEvent.Kind.MERGE_REQUEST,
                projectId(payload),
                attributes.path("action").asText(null),
                attributes.hasNonNull("id") ? attributes.get("id").asLong() : null,
                attributes.path("iid").asLong(),
                attributes.path("source_branch").asText(null),
                attributes.path("target_branch").asText(null),
                attributes.path("title").asText(null),
                attributes.path("description").asText(null),
                user.path("name").asText(null),
                user.path("username").asText(null),
                commitSha,
                null);
    }

    private Optional<WebhookEvent> parsePush(JsonNode payload) {
        String after = payload.path("after").asText(null);
        if (after == null || NULL_SHA.equals(after)) {
            return Optional.empty();
        }
        String commitSha = payload.hasNonNull("checkout_sha") ? payload.get("checkout_sha").asText() : after;

        String ref = payload.path("ref").asText("");
        String branch = ref.startsWith(BRANCH_REF_PREFIX) ? ref.substring(BRANCH_REF_PREFIX.length()) : ref;

        JsonNode headCommit = headCommit(payload.path("commits"), commitSha);
        String message = headCommit != null ? headCommit.path("message").asText(null) : null;

        return Optional.of(new WebhookEvent(
                WebhookEvent.Kind.PUSH,
                projectId(payload),
                null,
                null,
                0L,
                branch,
                branch,
                firstLine(message),
                message,
                payload.path("user_name").asText(null),
                payload.path("user_username").asText(null),
                commitSha,
                branch));
    }

    private static Long projectId(JsonNode payload) {
        JsonNode project = payload.path("project");
        if (project.hasNonNull("id")) {
            return project.get("id").asLong();
        }
        return payload.hasNonNull("project_id") ? payload.get("project_id").asLong() : null;
    }

    private static JsonNode headCommit(JsonNode commits, String commitSha) {
        if (!commits.isArray() || commits.isEmpty()) {
            return null;
        }
        for (JsonNode commit : commits) {
            if (commitSha.equals(commit.path("id").asText())) {
                return commit;
            }
        }
        return commits.get(commits.size() - 1);
    }

    private static String firstLine(String text) {
        if (text == null) {
            return null;
        }
        int newline = text.indexOf('\n');
        return (newline >= 0 ? text.substring(0, newline) : text).trim();
    }
}
