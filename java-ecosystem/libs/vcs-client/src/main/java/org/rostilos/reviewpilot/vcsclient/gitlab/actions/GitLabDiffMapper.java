package org.rostilos.reviewpilot.vcsclient.gitlab.actions;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.reviewpilot.vcsclient.model.ChangeDiff;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps GitLab diff objects ({@code old_path}, {@code new_path}, {@code diff}, flags) to {@link ChangeDiff}.
 */
final class GitLabDiffMapper {

    private GitLabDiffMapper() {
    }

    static ChangeDiff toChangeDiff(JsonNode node) {
        return new ChangeDiff(
                node.path("old_path").asText(""),
                node.path("new_path").asText(""),
                node.path("diff").asText(""),
                node.path("new_file").asBoolean(false),
                node.path("renamed_file").asBoolean(false),
                node.path("deleted_file").asBoolean(false)
        );
    }

    static List<ChangeDiff> toChangeDiffs(Iterable<JsonNode> nodes) {
        List<ChangeDiff> diffs = new ArrayList<>();
        for (JsonNode node : nodes) {
            diffs.add(toChangeDiff(node));
        }
        return diffs;
    }
}
