package org.rostilos.reviewpilot.core.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.reviewpilot.core.dto.review.ReviewCompletion;
import org.rostilos.reviewpilot.core.exception.ReviewNotFoundException;
import org.rostilos.reviewpilot.core.exception.ReviewStateException;
import org.rostilos.reviewpilot.core.model.review.FindingSeverity;
import org.rostilos.reviewpilot.core.model.review.ReviewFinding;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.model.review.ReviewStatus;
import org.rostilos.reviewpilot.core.persistence.repository.review.ReviewFindingRepository;
import org.rostilos.reviewpilot.core.persistence.repository.review.ReviewRunRepository;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReviewRunService")
class ReviewRunServiceTest {

    @Mock
    private ReviewRunRepository reviewRunRepository;

    @Mock
    private ReviewFindingRepository reviewFindingRepository;

    private ReviewRunService service;

    @BeforeEach
    void setUp() {
        service = new ReviewRunService(reviewRunRepository, reviewFindingRepository);
    }

    private ReviewRun pendingRun(Long id) {
        ReviewRun run = new ReviewRun();
        run.setId(id);
        run.markPending();
        return run;
    }

    @Test
    @DisplayName("getRun should throw when the run does not exist")
    void getRunShouldThrowWhenMissing() {
        when(reviewRunRepository.findByIdWithRepository(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getRun(99L))
                .isInstanceOf(ReviewNotFoundException.class)
                .hasMessageContaining("99");
    }

    @Nested
    @DisplayName("resetForRetry()")
    class ResetForRetryTests {

        @Test
        @DisplayName("should reject a pending run")
        void shouldRejectPendingRun() {
            when(reviewRunRepository.findByIdWithRepository(1L)).thenReturn(Optional.of(pendingRun(1L)));

            assertThatThrownBy(() -> service.resetForRetry(1L))
                    .isInstanceOf(ReviewStateException.class)
                    .hasMessageContaining("in progress");

            verify(reviewFindingRepository, never()).deleteByReviewRunId(any());
        }

        @Test
        @DisplayName("should reset a failed run and delete its findings")
        void shouldResetFailedRun() {
            ReviewRun run = pendingRun(1L);
            run.fail("timeout");
            when(reviewRunRepository.findByIdWithRepository(1L)).thenReturn(Optional.of(run));
            when(reviewRunRepository.save(any(ReviewRun.class))).thenAnswer(inv -> inv.getArgument(0));
            when(reviewFindingRepository.deleteByReviewRunId(1L)).thenReturn(4);

            ReviewRun reset = service.resetForRetry(1L);

            assertThat(reset.getStatus()).isEqualTo(ReviewStatus.PENDING);
            assertThat(reset.getError()).isNull();
            verify(reviewFindingRepository).deleteByReviewRunId(1L);
        }
    }

    @Nested
    @DisplayName("completeRun()")
    class CompleteRunTests {

        @Test
        @DisplayName("should attach findings to the run and store the outcome")
        void shouldStoreOutcome() {
            ReviewRun run = pendingRun(5L);
            when(reviewRunRepository.findByIdWithRepository(5L)).thenReturn(Optional.of(run));
            when(reviewRunRepository.save(any(ReviewRun.class))).thenAnswer(inv -> inv.getArgument(0));

            ReviewFinding finding = new ReviewFinding();
            finding.setFilePath("src/App.java");
            finding.setLineNumber(12);
            finding.setSeverity(FindingSeverity.CRITICAL);
            finding.setContent("null dereference");

            ReviewRun completed = service.completeRun(5L, new ReviewCompletion(
                    1, 2, 0, List.of(finding), "openai", "gpt-4o", "{\"a\":\"b\"}", "{}"));

            assertThat(finding.getReviewRun()).isSameAs(run);
            verify(reviewFindingRepository).saveAll(List.of(finding));
            assertThat(completed.getStatus()).isEqualTo(ReviewStatus.COMPLETED);
            assertThat(completed.getCriticalIssues()).isEqualTo(1);
            assertThat(completed.getNormalIssues()).isEqualTo(2);
            assertThat(completed.getAiModelProvider()).isEqualTo("openai");
            assertThat(completed.getAiModelId()).isEqualTo("gpt-4o");
            assertThat(completed.getAiResponse()).isEqualTo("{\"a\":\"b\"}");
        }
    }

    @Nested
    @DisplayName("progress")
    class ProgressTests {

        @Test
        @DisplayName("incrementReviewedFiles should be bounded by totalFiles")
        void incrementShouldBeBounded() {
            ReviewRun run = pendingRun(3L);
            run.setTotalFiles(1);
            when(reviewRunRepository.findByIdWithRepository(3L)).thenReturn(Optional.of(run));

            assertThat(service.incrementReviewedFiles(3L)).isEqualTo(1);
            assertThat(service.incrementReviewedFiles(3L)).isEqualTo(1);
        }

        @Test
        @DisplayName("failRun should store the error message")
        void failRunShouldStoreError() {
            ReviewRun run = pendingRun(3L);
            when(reviewRunRepository.findByIdWithRepository(3L)).thenReturn(Optional.of(run));

            boolean failed = service.failRun(3L, "No changed files to review");

            assertThat(failed).isTrue();
            assertThat(run.getStatus()).isEqualTo(ReviewStatus.FAILED);
            assertThat(run.getError()).isEqualTo("No changed files to review");
            verify(reviewRunRepository).save(run);
        }

        @Test
        @DisplayName("failRun should leave a completed run completed")
        void failRunShouldNotTouchCompletedRun() {
            ReviewRun run = pendingRun(3L);
            run.complete(0, 3, 0);
            when(reviewRunRepository.findByIdWithRepository(3L)).thenReturn(Optional.of(run));

            boolean failed = service.failRun(3L, "GitLab 500 while publishing");

            assertThat(failed).isFalse();
            assertThat(run.getStatus()).isEqualTo(ReviewStatus.COMPLETED);
            assertThat(run.getError()).isNull();
            verify(reviewRunRepository, never()).save(any());
        }

        @Test
        @DisplayName("recordPublishFailure should keep the run completed and store the error")
        void recordPublishFailureShouldKeepStatus() {
            ReviewRun run = pendingRun(3L);
            run.complete(0, 3, 0);
            when(reviewRunRepository.findByIdWithRepository(3L)).thenReturn(Optional.of(run));

            service.recordPublishFailure(3L, "Publish failed: GitLab 500");

            assertThat(run.getStatus()).isEqualTo(ReviewStatus.COMPLETED);
            assertThat(run.getNormalIssues()).isEqualTo(3);
            assertThat(run.getError()).isEqualTo("Publish failed: GitLab 500");
            verify(reviewRunRepository).save(run);
        }
    }

    @Nested
    @DisplayName("placeholder & publish")
    class PublishTests {

        @Test
        @DisplayName("assignPlaceholder should not overwrite an existing reference")
        void assignPlaceholderShouldNotOverwrite() {
            ReviewRun run = pendingRun(2L);
            run.assignPlaceholder("disc-1", 11L);
            when(reviewRunRepository.findByIdWithRepository(2L)).thenReturn(Optional.of(run));

            boolean assigned = service.assignPlaceholder(2L, "disc-2", 22L);

            assertThat(assigned).isFalse();
            assertThat(run.getGitlabDiscussionId()).isEqualTo("disc-1");
            verify(reviewRunRepository, never()).save(any());
        }

        @Test
        @DisplayName("markFindingsPosted should flag every unposted finding")
        void markFindingsPostedShouldFlagAll() {
            ReviewFinding first = new ReviewFinding();
            ReviewFinding second = new ReviewFinding();
            when(reviewFindingRepository.findByReviewRunIdAndPostedFalseOrderByIdAsc(2L))
                    .thenReturn(List.of(first, second));

            int updated = service.markFindingsPosted(2L, "555");

            assertThat(updated).isEqualTo(2);
            assertThat(first.isPosted()).isTrue();
            assertThat(second.getExternalCommentId()).isEqualTo("555");
        }
    }

    @Nested
    @DisplayName("dedup queries")
    class DedupTests {

        @Test
        @DisplayName("hasRecentPendingRun should query pending runs inside the window")
        void hasRecentPendingRunShouldUseWindow() {
            when(reviewRunRepository.existsRecentRun(eq(1L), eq(7L), eq(ReviewStatus.PENDING), any(OffsetDateTime.class)))
                    .thenReturn(true);

            OffsetDateTime before = OffsetDateTime.now().minusMinutes(5);
            assertThat(service.hasRecentPendingRun(1L, 7L, Duration.ofMinutes(5))).isTrue();

            ArgumentCaptor<OffsetDateTime> since = ArgumentCaptor.forClass(OffsetDateTime.class);
            verify(reviewRunRepository).existsRecentRun(eq(1L), eq(7L), eq(ReviewStatus.PENDING), since.capture());
            assertThat(since.getValue()).isAfterOrEqualTo(before);
        }

        @Test
        @DisplayName("hasRunForCommit should be false for a blank sha without querying")
        void hasRunForCommitShouldSkipBlankSha() {
            assertThat(service.hasRunForCommit(1L, " ")).isFalse();
            verify(reviewRunRepository, never()).existsByRepositoryIdAndCommitSha(any(), anyString());
        }
    }

    @Test
    @DisplayName("listRuns should convert 1-based page to a sorted page request")
    void listRunsShouldUseOneBasedPages() {
        service.listRuns(null, ReviewStatus.COMPLETED, 2, 20);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(reviewRunRepository).findFiltered(eq(null), eq(ReviewStatus.COMPLETED), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
        assertThat(pageable.getValue().getPageSize()).isEqualTo(20);
        assertThat(pageable.getValue().getSort().getOrderFor("startedAt")).isNotNull();
    }
}
