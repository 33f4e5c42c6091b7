package org.rostilos.reviewpilot.core.model.review;

import jakarta.persistence.*;
import org.rostilos.reviewpilot.core.model.config.RepositoryConfig;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One execution of the review pipeline for a merge request or a pushed commit.
 * A merge request iid of {@code 0} marks a push event.
 */
@Entity
@Table(name = "review_run", indexes = {
        @Index(name = "idx_review_run_repository", columnList = "repository_id"),
        @Index(name = "idx_review_run_status", columnList = "status"),
        @Index(name = "idx_review_run_mr", columnList = "repository_id, merge_request_iid"),
        @Index(name = "idx_review_run_commit", columnList = "repository_id, commit_sha")
})
public class ReviewRun {

    public static final long PUSH_EVENT_IID = 0L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "repository_id", nullable = false)
    private RepositoryConfig repository;

    @Column(name = "merge_request_id")
    private Long mergeRequestId;

    @Column(name = "merge_request_iid", nullable = false)
    private long mergeRequestIid = PUSH_EVENT_IID;

    @Column(name = "source_branch", length = 512)
    private String sourceBranch;

    @Column(name = "target_branch", length = 512)
    private String targetBranch;

    @Column(name = "author", length = 256)
    private String author;

    @Column(name = "author_username", length = 256)
    private String authorUsername;

    @Column(name = "title", length = 1024)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "commit_sha", length = 64)
    private String commitSha;

    @Column(name = "commit_short_id", length = 16)
    private String commitShortId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReviewStatus status = ReviewStatus.PENDING;

    @Column(name = "total_files", nullable = false)
    private int totalFiles = 0;

    @Column(name = "reviewed_files", nullable = false)
    private int reviewedFiles = 0;

    @Column(name = "critical_issues", nullable = false)
    private int criticalIssues = 0;

    @Column(name = "normal_issues", nullable = false)
    private int normalIssues = 0;

    @Column(name = "suggestions", nullable = false)
    private int suggestions = 0;

    @Column(name = "ai_summary", columnDefinition = "TEXT")
    private String aiSummary;

    /**
     * JSON object of raw model responses keyed by file path ({@code batch_review} in batch mode).
     */
    @Column(name = "ai_response", columnDefinition = "TEXT")
    private String aiResponse;

    /**
     * JSON object of the prompts sent, same keys as {@link #aiResponse}.
     */
    @Column(name = "review_prompts", columnDefinition = "TEXT")
    private String reviewPrompts;

    @Column(name = "ai_model_provider", length = 32)
    private String aiModelProvider;

    @Column(name = "ai_model_id", length = 256)
    private String aiModelId;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "gitlab_discussion_id", length = 128)
    private String gitlabDiscussionId;

    @Column(name = "gitlab_note_id")
    private Long gitlabNoteId;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @OneToMany(mappedBy = "reviewRun", fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<ReviewFinding> findings = new ArrayList<>();

    public boolean isPushEvent() {
        return mergeRequestIid == PUSH_EVENT_IID;
    }

    public boolean hasPlaceholder() {
        return gitlabDiscussionId != null || gitlabNoteId != null;
    }

    /**
     * Records the placeholder comment. Ignored once a placeholder is set.
     *
     * @return true if the reference was stored
     */
    public boolean assignPlaceholder(String discussionId, Long noteId) {
        if (hasPlaceholder()) {
            return false;
        }
        this.gitlabDiscussionId = discussionId;
        this.gitlabNoteId = noteId;
        return true;
    }

    /**
     * Fills in a missing note id of an existing placeholder discussion.
     */
    public void resolvePlaceholderNote(Long noteId) {
        if (this.gitlabNoteId == null) {
            this.gitlabNoteId = noteId;
        }
    }

    public void markPending() {
        this.status = ReviewStatus.PENDING;
        if (this.startedAt == null) {
            this.startedAt = OffsetDateTime.now();
        }
    }

    public void incrementReviewedFiles() {
        if (reviewedFiles < totalFiles) {
            reviewedFiles++;
        }
    }

    public void markAllReviewed() {
        this.reviewedFiles = totalFiles;
    }

    public void complete(int critical, int normal, int suggestion) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review run " + id + " is not pending: " + status);
        }
        this.criticalIssues = critical;
        this.normalIssues = normal;
        this.suggestions = suggestion;
        this.status = ReviewStatus.COMPLETED;
        this.completedAt = OffsetDateTime.now();
    }

    public void fail(String errorMessage) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review run " + id + " is not pending: " + status);
        }
        this.status = ReviewStatus.FAILED;
        this.error = errorMessage;
        this.completedAt = OffsetDateTime.now();
    }

    /**
     * Keeps a completed run completed and notes why its comment is missing or stale.
     */
    public void recordPublishError(String errorMessage) {
        this.error = errorMessage;
    }

    /**
     * Returns the run to a fresh pending state. The placeholder reference is kept so the
     * re-run updates the comment it already owns.
     */
    public void resetForRetry() {
        this.status = ReviewStatus.PENDING;
        this.error = null;
        this.totalFiles = 0;
        this.reviewedFiles = 0;
        this.criticalIssues = 0;
        this.normalIssues = 0;
        this.suggestions = 0;
        this.aiSummary = null;
        this.aiResponse = null;
        this.reviewPrompts = null;
        this.aiModelProvider = null;
        this.aiModelId = null;
        this.completedAt = null;
        this.startedAt = OffsetDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public RepositoryConfig getRepository() {
        return repository;
    }

    public void setRepository(RepositoryConfig repository) {
        this.repository = repository;
    }

    public Long getMergeRequestId() {
        return mergeRequestId;
    }

    public void setMergeRequestId(Long mergeRequestId) {
        this.mergeRequestId = mergeRequestId;
    }

    public long getMergeRequestIid() {
        return mergeRequestIid;
    }

    public void setMergeRequestIid(long mergeRequestIid) {
        this.mergeRequestIid = mergeRequestIid;
    }

    public String getSourceBranch() {
        return sourceBranch;
    }

    public void setSourceBranch(String sourceBranch) {
        this.sourceBranch = sourceBranch;
    }

    public String getTargetBranch() {
        return targetBranch;
    }

    public void setTargetBranch(String targetBranch) {
        this.targetBranch = targetBranch;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getAuthorUsername() {
        return authorUsername;
    }

    public void setAuthorUsername(String authorUsername) {
        this.authorUsername = authorUsername;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCommitSha() {
        return commitSha;
    }

    public void setCommitSha(String commitSha) {
        this.commitSha = commitSha;
        this.commitShortId = commitSha != null && commitSha.length() > 8 ? commitSha.substring(0, 8) : commitSha;
    }

    public String getCommitShortId() {
        return commitShortId;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public void setStatus(ReviewStatus status) {
        this.status = status;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public void setTotalFiles(int totalFiles) {
        this.totalFiles = totalFiles;
    }

    public int getReviewedFiles() {
        return reviewedFiles;
    }

    public int getCriticalIssues() {
        return criticalIssues;
    }

    public int getNormalIssues() {
        return normalIssues;
    }

    public int getSuggestions() {
        return suggestions;
    }

    public String getAiSummary() {
        return aiSummary;
    }

    public void setAiSummary(String aiSummary) {
        this.aiSummary = aiSummary;
    }

    public String getAiResponse() {
        return aiResponse;
    }

    public void setAiResponse(String aiResponse) {
        this.aiResponse = aiResponse;
    }

    public String getReviewPrompts() {
        return reviewPrompts;
    }

    public void setReviewPrompts(String reviewPrompts) {
        this.reviewPrompts = reviewPrompts;
    }

    public String getAiModelProvider() {
        return aiModelProvider;
    }

    public void setAiModelProvider(String aiModelProvider) {
        this.aiModelProvider = aiModelProvider;
    }

    public String getAiModelId() {
        return aiModelId;
    }

    public void setAiModelId(String aiModelId) {
        this.aiModelId = aiModelId;
    }

    public String getError() {
        return error;
    }

    public String getGitlabDiscussionId() {
        return gitlabDiscussionId;
    }

    public Long getGitlabNoteId() {
        return gitlabNoteId;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public List<ReviewFinding> getFindings() {
        return findings;
    }
}
