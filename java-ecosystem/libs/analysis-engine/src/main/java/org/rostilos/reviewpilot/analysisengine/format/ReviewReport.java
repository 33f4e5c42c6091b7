package org.rostilos.reviewpilot.analysisengine.format;

import org.rostilos.reviewpilot.analysisengine.parser.SeverityCounts;
import org.rostilos.reviewpilot.analysisengine.pipeline.FileReviewResult;
import org.rostilos.reviewpilot.analysisengine.pipeline.ReviewState;
import org.rostilos.reviewpilot.core.model.config.RepositoryConfig;
import org.rostilos.reviewpilot.core.model.review.ReviewFinding;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.vcsclient.gitlab.GitLabConfig;

import java.util.List;

/**
 * Everything the comment body is rendered from.
 *
 * @param webBaseUrl  GitLab origin, e.g. {@code https://gitlab.com}
 * @param projectPath namespace path of the project, e.g. {@code group/app}
 */
public record ReviewReport(
        String webBaseUrl,
        String projectPath,
        long mergeRequestIid,
        String commitSha,
        int totalFiles,
        int reviewedFiles,
        SeverityCounts counts,
        String summary,
        List<FileReviewResult> fileResults,
        List<ReviewFinding> findings,
        boolean batchMode,
        String batchResponse
) {

    public static ReviewReport of(ReviewRun run, ReviewState state, List<ReviewFinding> findings) {
        RepositoryConfig repository = run.getRepository();
        String accountUrl = repository.getGitLabAccount() != null ? repository.getGitLabAccount().getUrl() : null;
        return new ReviewReport(
                GitLabConfig.webOrigin(accountUrl),
                repository.getPath(),
                run.getMergeRequestIid(),
                run.getCommitSha(),
                run.getTotalFiles(),
                run.getReviewedFiles(),
                new SeverityCounts(run.getCriticalIssues(), run.getNormalIssues(), run.getSuggestions()),
                state.getSummary(),
                state.getFileResults(),
                findings,
                state.isBatchMode(),
                state.getBatchResponse());
    }
}
