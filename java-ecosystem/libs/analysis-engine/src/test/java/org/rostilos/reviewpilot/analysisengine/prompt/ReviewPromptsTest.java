package org.rostilos.reviewpilot.analysisengine.prompt;

import org.junit.jupiter.api.Test;
import org.rostilos.reviewpilot.vcsclient.model.ChangeDiff;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewPromptsTest {

    @Test
    void testBuildReviewPrompt_SkipsBlankSections() {
        String prompt = ReviewPrompts.buildReviewPrompt("Add cache", null, "  ", "src/Cache.java", "@@ -1 +1 @@\n-a\n+b");

        assertThat(prompt).isEqualTo("Change title: Add cache\n"
                + "File: src/Cache.java\n"
                + "```diff\n@@ -1 +1 @@\n-a\n+b\n```");
    }

    @Test
    void testBuildReviewPrompt_IncludesSummaryAndDescription() {
        String prompt = ReviewPrompts.buildReviewPrompt("T", "Adds a cache layer", "Closes #4", "a.py", "+x");

        assertThat(prompt)
                .contains("Change summary: Adds a cache layer\n")
                .contains("Description: Closes #4\n")
                .endsWith("```diff\n+x\n```");
    }

    @Test
    void testBuildBatchReviewPrompt_ListsEveryFile() {
        String prompt = ReviewPrompts.buildBatchReviewPrompt("Refactor", null, List.of(
                new ReviewPrompts.PatchFile("a/One.java", "+1"),
                new ReviewPrompts.PatchFile("b/Two.java", "-2")));

        assertThat(prompt)
                .startsWith("Review the code changes in the following 2 files.")
                .contains("Changed files:\n- a/One.java\n- b/Two.java")
                .contains("### a/One.java\n```diff\n+1\n```\n\n### b/Two.java\n```diff\n-2\n```");
    }

    @Test
    void testBuildSummaryPrompt_ToleratesNulls() {
        String prompt = ReviewPrompts.buildSummaryPrompt("Title", null, null);

        assertThat(prompt).startsWith("Summarize the following code change in at most 100 words:")
                .contains("## Title\n")
                .doesNotContain("null");
    }

    @Test
    void testFormatPatch_AddsUnifiedHeader() {
        ChangeDiff diff = new ChangeDiff("old/A.java", "new/A.java", "@@ -1 +1 @@", false, false, true);

        assertThat(ReviewPrompts.formatPatch(diff)).isEqualTo("--- a/old/A.java\n+++ b/new/A.java\n@@ -1 +1 @@");
    }

    @Test
    void testRecordedPrompt_KeepsBothParts() {
        assertThat(ReviewPrompts.recordedPrompt("sys", "usr"))
                .isEqualTo("=== System Prompt ===\nsys\n\n=== User Prompt ===\nusr");
    }
}
