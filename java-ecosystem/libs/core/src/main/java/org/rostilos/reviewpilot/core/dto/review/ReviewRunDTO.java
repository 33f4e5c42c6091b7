package org.rostilos.reviewpilot.core.dto.review;

import org.rostilos.reviewpilot.core.model.review.ReviewFinding;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.model.review.ReviewStatus;

import java.time.OffsetDateTime;
import java.util.List;

public record ReviewRunDTO(
        Long id,
        Long repositoryId,
        String repositoryName,
        Long mergeRequestId,
        long mergeRequestIid,
        String sourceBranch,
        String targetBranch,
        String author,
        String authorUsername,
        String title,
        String description,
        String commitSha,
        String commitShortId,
        ReviewStatus status,
        String error,
        int totalFiles,
        int reviewedFiles,
        int criticalIssues,
        int normalIssues,
        int suggestions,
        String aiSummary,
        String aiResponse,
        String reviewPrompts,
        String aiModelProvider,
        String aiModelId,
        String gitlabDiscussionId,
        Long gitlabNoteId,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt,
        List<ReviewFindingDTO> findings
) {
    /**
     * Create DTO without findings (listing view).
     */
    public static ReviewRunDTO from(ReviewRun run) {
        return from(run, List.of());
    }

    public static ReviewRunDTO from(ReviewRun run, List<ReviewFinding> findings) {
        return new ReviewRunDTO(
                run.getId(),
                run.getRepository() != null ? run.getRepository().getId() : null,
                run.getRepository() != null ? run.getRepository().getName() : null,
                run.getMergeRequestId(),
                run.getMergeRequestIid(),
                run.getSourceBranch(),
                run.getTargetBranch(),
                run.getAuthor(),
                run.getAuthorUsername(),
                run.getTitle(),
                run.getDescription(),
                run.getCommitSha(),
                run.getCommitShortId(),
                run.getStatus(),
                run.getError(),
                run.getTotalFiles(),
                run.getReviewedFiles(),
                run.getCriticalIssues(),
                run.getNormalIssues(),
                run.getSuggestions(),
                run.getAiSummary(),
                run.getAiResponse(),
                run.getReviewPrompts(),
                run.getAiModelProvider(),
                run.getAiModelId(),
                run.getGitlabDiscussionId(),
                run.getGitlabNoteId(),
                run.getStartedAt(),
                run.getCompletedAt(),
                findings.stream().map(ReviewFindingDTO::from).toList()
        );
    }
}
