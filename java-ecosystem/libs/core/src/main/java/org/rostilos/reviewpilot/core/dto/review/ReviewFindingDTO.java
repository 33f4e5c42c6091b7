package org.rostilos.reviewpilot.core.dto.review;

import org.rostilos.reviewpilot.core.model.review.FindingSeverity;
import org.rostilos.reviewpilot.core.model.review.ReviewFinding;

import java.time.OffsetDateTime;

public record ReviewFindingDTO(
        Long id,
        String filePath,
        int lineNumber,
        Integer lineRangeEnd,
        FindingSeverity severity,
        String content,
        String diffHunk,
        boolean posted,
        String externalCommentId,
        OffsetDateTime createdAt
) {
    public static ReviewFindingDTO from(ReviewFinding finding) {
        return new ReviewFindingDTO(
                finding.getId(),
                finding.getFilePath(),
                finding.getLineNumber(),
                finding.getLineRangeEnd(),
                finding.getSeverity(),
                finding.getContent(),
                finding.getDiffHunk(),
                finding.isPosted(),
                finding.getExternalCommentId(),
                finding.getCreatedAt()
        );
    }
}
