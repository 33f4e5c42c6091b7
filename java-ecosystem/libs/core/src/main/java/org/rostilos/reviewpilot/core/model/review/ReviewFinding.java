package org.rostilos.reviewpilot.core.model.review;

import jakarta.persistence.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "review_finding", indexes = {
        @Index(name = "idx_review_finding_run", columnList = "review_run_id")
})
public class ReviewFinding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "review_run_id", nullable = false)
    private ReviewRun reviewRun;

    @Column(name = "file_path", nullable = false, length = 1024)
    private String filePath;

    @Column(name = "line_number", nullable = false)
    private int lineNumber;

    @Column(name = "line_range_end")
    private Integer lineRangeEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private FindingSeverity severity;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "diff_hunk", columnDefinition = "TEXT")
    private String diffHunk;

    @Column(name = "is_posted", nullable = false)
    private boolean posted = false;

    @Column(name = "external_comment_id", length = 128)
    private String externalCommentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public void markPosted(String externalCommentId) {
        this.posted = true;
        this.externalCommentId = externalCommentId;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public ReviewRun getReviewRun() {
        return reviewRun;
    }

    public void setReviewRun(ReviewRun reviewRun) {
        this.reviewRun = reviewRun;
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public void setLineNumber(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    public Integer getLineRangeEnd() {
        return lineRangeEnd;
    }

    public void setLineRangeEnd(Integer lineRangeEnd) {
        this.lineRangeEnd = lineRangeEnd;
    }

    public FindingSeverity getSeverity() {
        return severity;
    }

    public void setSeverity(FindingSeverity severity) {
        this.severity = severity;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getDiffHunk() {
        return diffHunk;
    }

    public void setDiffHunk(String diffHunk) {
        this.diffHunk = diffHunk;
    }

    public boolean isPosted() {
        return posted;
    }

    public String getExternalCommentId() {
        return externalCommentId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
