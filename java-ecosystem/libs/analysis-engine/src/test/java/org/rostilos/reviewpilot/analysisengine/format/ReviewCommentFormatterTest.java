package org.rostilos.reviewpilot.analysisengine.format;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.rostilos.reviewpilot.analysisengine.parser.SeverityCounts;
import org.rostilos.reviewpilot.analysisengine.pipeline.FileReviewResult;
import org.rostilos.reviewpilot.core.model.review.FindingSeverity;
import org.rostilos.reviewpilot.core.model.review.ReviewFinding;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewCommentFormatterTest {

    private ReviewCommentFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new ReviewCommentFormatter();
    }

    @Test
    @DisplayName("should render header, verdict and overview")
    void shouldRenderOverview() {
        String body = formatter.format(report(12, List.of(
                result("a.py", 0, 1, 0),
                result("b.py", 0, 0, 0)), List.of(), false, null));

        assertThat(body).startsWith("## 🤖 ReviewPilot\n\n> **Verdict: Medium risk");
        assertThat(body).contains("- Files reviewed: 2/2 (1 with findings)");
        assertThat(body).contains("- Findings: 🔴 critical 0 / ⚠️ normal 1 / 💡 suggestion 0");
        assertThat(body).contains("### Change summary\nAdds a cache.");
        assertThat(body).contains("### Findings by file\n- No critical findings recorded.");
    }

    @Test
    @DisplayName("critical findings link to the merge request diff view")
    void shouldLinkFindingsToMergeRequest() {
        String body = formatter.format(report(12, List.of(result("src/app/UserDao.java", 1, 0, 0)),
                List.of(finding("src/app/UserDao.java", 25, 30, "SQL injection\nthrough concatenation")), false, null));

        assertThat(body).contains("#### `src/app/UserDao.java`\n"
                + "- [critical] [`src/app/UserDao.java:25-30`]"
                + "(https://gitlab.example.com/team/app/-/merge_requests/12/diffs"
                + "#44474ce179478961f9c3283d9e4019f248bceee1_25_30) SQL injection through concatenation");
    }

    @Test
    @DisplayName("push runs link to the commit view")
    void shouldLinkFindingsToCommit() {
        String body = formatter.format(report(0, List.of(result("a.py", 1, 0, 0)),
                List.of(finding("a.py", 3, null, "crash")), false, null));

        assertThat(body).contains("[`a.py:3`](https://gitlab.example.com/team/app/-/commit/deadbeef"
                + "#bb88d7506cfdcbc88cc950c4af72a3e28c024a77_3_3) crash");
    }

    @Test
    @DisplayName("risk ranking orders files by weighted score and keeps ties in review order")
    void shouldRankFilesByRisk() {
        String body = formatter.format(report(12, List.of(
                result("low.py", 0, 1, 0),
                result("high.py", 1, 0, 0),
                result("clean.py", 0, 0, 0),
                result("tied.py", 0, 0, 2)), List.of(), false, null));

        String ranking = body.substring(body.indexOf("### File risk ranking"), body.indexOf("### Suggested handling order"));
        assertThat(ranking).isEqualTo("### File risk ranking\n"
                + "- `high.py`: 🔴 1 / ⚠️ 0 / 💡 0\n"
                + "- `low.py`: 🔴 0 / ⚠️ 1 / 💡 0\n"
                + "- `tied.py`: 🔴 0 / ⚠️ 0 / 💡 2\n\n");
    }

    @Test
    @DisplayName("ranking lists at most five files")
    void shouldLimitRanking() {
        List<FileReviewResult> results = List.of(
                result("1.py", 0, 0, 1), result("2.py", 0, 0, 1), result("3.py", 0, 0, 1),
                result("4.py", 0, 0, 1), result("5.py", 0, 0, 1), result("6.py", 0, 0, 1));

        String body = formatter.format(report(12, results, List.of(), false, null));

        assertThat(body).contains("- `5.py`").doesNotContain("- `6.py`");
    }

    @Test
    @DisplayName("batch mode shows the raw batch response instead of per-file sections")
    void shouldRenderBatchMode() {
        String body = formatter.format(report(12, List.of(result("batch_review", 0, 2, 0)), List.of(), true,
                "statistics: critical=0 normal=2 suggestion=0\n\n## a.py\n3: [normal] naming"));

        assertThat(body).contains("- Files reviewed: 1/1\n");
        assertThat(body).contains("### Batch review\nstatistics: critical=0 normal=2 suggestion=0");
        assertThat(body).doesNotContain("### Findings by file").doesNotContain("### File risk ranking");
    }

    @Test
    @DisplayName("same report renders the same text")
    void shouldBeDeterministic() {
        ReviewReport report = report(12, List.of(result("a.py", 1, 2, 3)),
                List.of(finding("a.py", 1, null, "bug")), false, null);

        assertThat(formatter.format(report)).isEqualTo(formatter.format(report));
    }

    @ParameterizedTest
    @CsvSource({
            "1,0,0,High risk",
            "0,2,5,Medium risk",
            "0,0,1,Low risk",
            "0,0,0,Passed"
    })
    void testConclusion_FollowsHighestSeverity(int critical, int normal, int suggestion, String prefix) {
        assertThat(ReviewCommentFormatter.conclusion(new SeverityCounts(critical, normal, suggestion))).startsWith(prefix);
    }

    @Test
    void testRiskScore_WeightsSeverities() {
        assertThat(ReviewCommentFormatter.riskScore(new SeverityCounts(1, 2, 3))).isEqualTo(12);
    }

    private static ReviewReport report(long iid, List<FileReviewResult> results, List<ReviewFinding> findings,
                                       boolean batchMode, String batchResponse) {
        SeverityCounts total = results.stream().map(FileReviewResult::counts).reduce(SeverityCounts.ZERO, SeverityCounts::plus);
        int files = batchMode ? 1 : results.size();
        return new ReviewReport("https://gitlab.example.com", "team/app", iid, "deadbeef", files, files,
                total, "Adds a cache.", results, findings, batchMode, batchResponse);
    }

    private static FileReviewResult result(String path, int critical, int normal, int suggestion) {
        return new FileReviewResult(path, "response", "prompt", new SeverityCounts(critical, normal, suggestion), List.of());
    }

    private static ReviewFinding finding(String path, int line, Integer end, String content) {
        ReviewFinding finding = new ReviewFinding();
        finding.setFilePath(path);
        finding.setLineNumber(line);
        finding.setLineRangeEnd(end);
        finding.setSeverity(FindingSeverity.CRITICAL);
        finding.setContent(content);
        return finding;
    }
}
