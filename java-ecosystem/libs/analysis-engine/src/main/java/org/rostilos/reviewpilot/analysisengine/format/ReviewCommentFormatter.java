package org.rostilos.reviewpilot.analysisengine.format;

import org.rostilos.reviewpilot.analysisengine.parser.SeverityCounts;
import org.rostilos.reviewpilot.analysisengine.pipeline.FileReviewResult;
import org.rostilos.reviewpilot.core.model.review.ReviewFinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the single review comment posted on a merge request or commit.
 * Output depends only on the report, so re-publishing an unchanged run yields identical text.
 */
@Component
public class ReviewCommentFormatter {

    static final String HEADER = "## 🤖 ReviewPilot";
    static final int TOP_RISK_FILES = 5;

    public String format(ReviewReport report) {
        SeverityCounts counts = report.counts();
        List<String> lines = new ArrayList<>();

        lines.add(HEADER);
        lines.add("");
        lines.add("> **Verdict: " + conclusion(counts) + "**");
        lines.add("");

        lines.add("### Overview");
        String filesLine = "- Files reviewed: " + report.reviewedFiles() + "/" + report.totalFiles();
        if (!report.batchMode()) {
            long withIssues = report.fileResults().stream().filter(FileReviewResult::hasFindings).count();
            filesLine += " (" + withIssues + " with findings)";
        }
        lines.add(filesLine);
        lines.add("- Findings: 🔴 critical " + counts.critical()
                + " / ⚠️ normal " + counts.normal()
                + " / 💡 suggestion " + counts.suggestion());

        if (report.summary() != null && !report.summary().isBlank()) {
            lines.add("");
            lines.add("### Change summary");
            lines.add(report.summary().trim());
        }

        lines.add("");
        if (report.batchMode()) {
            lines.add("### Batch review");
            String batch = report.batchResponse();
            lines.add(batch != null && !batch.isBlank() ? batch.trim() : "_No findings reported._");
        } else {
            appendFindingsByFile(lines, report);
            lines.add("");
            appendRiskRanking(lines, report.fileResults());
        }

        lines.add("");
        appendHandlingOrder(lines, counts);
        return String.join("\n", lines);
    }

    static String conclusion(SeverityCounts counts) {
        if (counts.critical() > 0) {
            return "High risk, " + counts.critical() + " critical issue(s) found; fix before merging";
        }
        if (counts.normal() > 0) {
            return "Medium risk, no critical issues but " + counts.normal() + " normal issue(s) need attention";
        }
        if (counts.suggestion() > 0) {
            return "Low risk, only " + counts.suggestion() + " suggestion(s)";
        }
        return "Passed, no notable issues found";
    }

    private void appendFindingsByFile(List<String> lines, ReviewReport report) {
        lines.add("### Findings by file");
        if (report.findings().isEmpty()) {
            lines.add("- No critical findings recorded.");
            return;
        }
        Map<String, List<ReviewFinding>> byFile = new LinkedHashMap<>();
        for (ReviewFinding finding : report.findings()) {
            byFile.computeIfAbsent(finding.getFilePath(), key -> new ArrayList<>()).add(finding);
        }
        for (Map.Entry<String, List<ReviewFinding>> entry : byFile.entrySet()) {
            lines.add("");
            lines.add("#### `" + entry.getKey() + "`");
            for (ReviewFinding finding : entry.getValue()) {
                String location = finding.getFilePath() + ":" + finding.getLineNumber()
                        + (finding.getLineRangeEnd() != null ? "-" + finding.getLineRangeEnd() : "");
                String link = DiffAnchor.link(report.webBaseUrl(), report.projectPath(), report.mergeRequestIid(),
                        report.commitSha(), finding.getFilePath(), finding.getLineNumber(), finding.getLineRangeEnd());
                lines.add("- [" + finding.getSeverity().label() + "] [`" + location + "`](" + link + ") "
                        + singleLine(finding.getContent()));
            }
        }
    }

    private void appendRiskRanking(List<String> lines, List<FileReviewResult> fileResults) {
        lines.add("### File risk ranking");
        List<FileReviewResult> ranked = fileResults.stream()
                .filter(FileReviewResult::hasFindings)
                .sorted(Comparator.comparingInt((FileReviewResult result) -> riskScore(result.counts())).reversed())
                .limit(TOP_RISK_FILES)
                .toList();
        if (ranked.isEmpty()) {
            lines.add("- No files with findings.");
            return;
        }
        for (FileReviewResult result : ranked) {
            SeverityCounts c = result.counts();
            lines.add("- `" + result.filePath() + "`: 🔴 " + c.critical() + " / ⚠️ " + c.normal() + " / 💡 " + c.suggestion());
        }
    }

    private void appendHandlingOrder(List<String> lines, SeverityCounts counts) {
        lines.add("### Suggested handling order");
        if (counts.critical() > 0) {
            lines.add("1. Fix all critical issues first and re-test.");
            lines.add("2. Address normal issues before they grow in later iterations.");
            lines.add("3. Schedule suggestions by expected benefit.");
        } else if (counts.normal() > 0) {
            lines.add("1. The change can proceed, but address the normal issues first.");
            lines.add("2. Suggestions can be handled after merging.");
        } else {
            lines.add("1. Low risk, the change can proceed.");
            lines.add("2. Consider the maintainability suggestions when convenient.");
        }
    }

    static int riskScore(SeverityCounts counts) {
        return counts.critical() * 5 + counts.normal() * 2 + counts.suggestion();
    }

    private static String singleLine(String content) {
        return content == null ? "" : content.trim().replaceAll("\\s*\\R\\s*", " ");
    }
}
