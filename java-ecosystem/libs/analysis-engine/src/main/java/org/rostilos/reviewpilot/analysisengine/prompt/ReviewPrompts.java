package org.rostilos.reviewpilot.analysisengine.prompt;

import org.rostilos.reviewpilot.vcsclient.model.ChangeDiff;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt texts and builders for summary, per-file and batch review calls.
 */
public final class ReviewPrompts {

    /** Output contract the finding parser relies on. */
    public static final String OUTPUT_FORMAT = """

            Output format:
            1. Start with exactly one statistics line:
               statistics: critical=<n> normal=<n> suggestion=<n>
            2. Then list each critical problem on its own line:
               <file-path>:<line>[-<end-line>] <description>
            3. Then list every problem on its own line:
               <line>[-<end-line>]: [critical/normal/suggestion] <description>
            4. If there are no problems, reply with the statistics line followed by: LGTM!""";

    public static final String SYSTEM_PROMPT = """
            You are a professional code review assistant. Review only the changed code and point out \
            concrete, actionable problems line by line.

            Review context:
            1. This is an internal project that values fast delivery and short iterations.
            2. The code is not public, so open-source concerns such as contribution guides or README files \
            do not apply.

            Rules:
            1. Report only problems that really exist in the change; no generic advice.
            2. Keep every entry short and direct.
            """ + OUTPUT_FORMAT + """


            Example:
            statistics: critical=1 normal=1 suggestion=0
            src/main/java/UserDao.java:25 SQL injection risk, use a parameterized query
            12: [normal] Variable name does not follow camelCase
            25: [critical] SQL injection risk, use a parameterized query
            """;

    public static final String SUMMARY_SYSTEM_PROMPT = """
            You are a senior engineer. Describe what a code change does in plain language, \
            without reviewing it.""";

    public static final String CUSTOM_PROMPT_SEPARATOR = "\n\nRepository-specific requirements:\n";

    static final int SUMMARY_MAX_WORDS = 100;

    private ReviewPrompts() {
    }

    public static String buildSummaryPrompt(String title, String description, String diffs) {
        return "Summarize the following code change in at most " + SUMMARY_MAX_WORDS + " words:\n\n"
                + "## " + nullToEmpty(title) + "\n"
                + nullToEmpty(description) + "\n\n"
                + "```diff\n"
                + nullToEmpty(diffs) + "\n"
                + "```";
    }

    public static String buildReviewPrompt(String title, String summary, String description,
                                           String filename, String patch) {
        StringBuilder prompt = new StringBuilder();
        appendSection(prompt, "Change title", title);
        appendSection(prompt, "Change summary", summary);
        appendSection(prompt, "Description", description);
        appendSection(prompt, "File", filename);
        prompt.append("```diff\n").append(nullToEmpty(patch)).append("\n```");
        return prompt.toString();
    }

    public static String buildBatchReviewPrompt(String title, String description, List<PatchFile> files) {
        String fileList = files.stream()
                .map(file -> "- " + file.path())
                .collect(Collectors.joining("\n"));
        String diffs = files.stream()
                .map(file -> "### " + file.path() + "\n```diff\n" + file.patch() + "\n```")
                .collect(Collectors.joining("\n\n"));

        StringBuilder prompt = new StringBuilder();
        prompt.append("Review the code changes in the following ").append(files.size()).append(" files.\n\n");
        appendSection(prompt, "Change title", title);
        appendSection(prompt, "Description", description);
        prompt.append("\nChanged files:\n").append(fileList).append("\n\n");
        prompt.append("""
                Focus on code quality, likely bugs, security and performance.
                Give the statistics line for all files together and list critical problems as \
                <file-path>:<line> <description>.
                Then group the remaining entries by file:
                ## <file-path>
                <line>: [critical/normal/suggestion] <description>

                """);
        prompt.append("Code changes:\n\n").append(diffs);
        return prompt.toString();
    }

    /**
     * Unified patch header followed by the hunk text.
     */
    public static String formatPatch(ChangeDiff diff) {
        return "--- a/" + diff.oldPath() + "\n+++ b/" + diff.newPath() + "\n" + nullToEmpty(diff.diff());
    }

    /**
     * Text stored on the run for audit and replay.
     */
    public static String recordedPrompt(String systemPrompt, String userPrompt) {
        return "=== System Prompt ===\n" + systemPrompt + "\n\n=== User Prompt ===\n" + userPrompt;
    }

    private static void appendSection(StringBuilder prompt, String label, String value) {
        if (value != null && !value.isBlank()) {
            prompt.append(label).append(": ").append(value).append('\n');
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    public record PatchFile(String path, String patch) {
    }
}
