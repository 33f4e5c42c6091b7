package org.rostilos.reviewpilot.analysisengine.publish;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.reviewpilot.core.model.config.RepositoryConfig;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.model.vcs.GitLabAccount;
import org.rostilos.reviewpilot.core.service.ReviewRunService;
import org.rostilos.reviewpilot.vcsclient.VcsClient;
import org.rostilos.reviewpilot.vcsclient.VcsClientProvider;
import org.rostilos.reviewpilot.vcsclient.model.CommitNote;
import org.rostilos.reviewpilot.vcsclient.model.ThreadNote;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewPublisherTest {

    private static final long PROJECT_ID = 5L;
    private static final String SHA = "0123456789abcdef";

    @Mock
    private ReviewRunService reviewRunService;
    @Mock
    private VcsClientProvider vcsClientProvider;
    @Mock
    private VcsClient vcsClient;

    private ReviewPublisher publisher;
    private ReviewRun run;

    @BeforeEach
    void setUp() {
        publisher = new ReviewPublisher(reviewRunService, vcsClientProvider);

        GitLabAccount account = new GitLabAccount();
        account.setUrl("https://gitlab.example.com");
        RepositoryConfig repository = new RepositoryConfig();
        repository.setGitLabProjectId(PROJECT_ID);
        repository.setGitLabAccount(account);

        run = new ReviewRun();
        run.setId(42L);
        run.setRepository(repository);
        run.setCommitSha(SHA);

        lenient().when(vcsClientProvider.getClient(account)).thenReturn(vcsClient);
    }

    @Test
    void testPlaceholderMarker_ContainsRunId() {
        assertThat(ReviewPublisher.placeholderMarker(42L)).isEqualTo("REVIEW_PLACEHOLDER:42");
        assertThat(ReviewPublisher.hiddenMarker("REVIEW_PLACEHOLDER:42")).isEqualTo("\n\n<!-- REVIEW_PLACEHOLDER:42 -->");
    }

    @Nested
    @DisplayName("merge request runs")
    class MergeRequestTests {

        @BeforeEach
        void mergeRequest() {
            run.setMergeRequestIid(12L);
        }

        @Test
        @DisplayName("publishing twice edits the placeholder and never adds a comment")
        void shouldUpdatePlaceholderOnEveryPublish() throws Exception {
            run.assignPlaceholder("d-1", 77L);
            when(vcsClient.updateThreadComment(PROJECT_ID, 12L, "d-1", 77L, "body"))
                    .thenReturn(new ThreadNote("d-1", 77L));

            assertThat(publisher.publish(run, "body")).isEqualTo("77");
            assertThat(publisher.publish(run, "body")).isEqualTo("77");

            verify(vcsClient, times(2)).updateThreadComment(PROJECT_ID, 12L, "d-1", 77L, "body");
            verify(vcsClient, never()).createThreadComment(anyLong(), anyLong(), anyString(), any());
            verify(reviewRunService, times(2)).markFindingsPosted(42L, "77");
        }

        @Test
        @DisplayName("without placeholder a comment is created and remembered")
        void shouldCreateAndRememberComment() throws Exception {
            when(vcsClient.createThreadComment(PROJECT_ID, 12L, "body", null)).thenReturn(new ThreadNote("d-9", 91L));

            assertThat(publisher.publish(run, "body")).isEqualTo("91");

            verify(reviewRunService).assignPlaceholder(42L, "d-9", 91L);
            verify(reviewRunService).markFindingsPosted(42L, "91");
        }

        @Test
        @DisplayName("a placeholder discussion without note id is resolved first")
        void shouldResolveMissingNoteId() throws Exception {
            run.assignPlaceholder("d-1", null);
            when(vcsClient.getThreadFirstNoteId(PROJECT_ID, 12L, "d-1")).thenReturn(Optional.of(5L));
            when(vcsClient.updateThreadComment(PROJECT_ID, 12L, "d-1", 5L, "body")).thenReturn(new ThreadNote("d-1", 5L));

            publisher.publish(run, "body");

            verify(reviewRunService).resolvePlaceholderNote(42L, 5L);
            verify(vcsClient, never()).createThreadComment(anyLong(), anyLong(), anyString(), any());
        }

        @Test
        @DisplayName("a failed note lookup falls back to a new comment")
        void shouldCreateWhenLookupFails() throws Exception {
            run.assignPlaceholder("d-1", null);
            when(vcsClient.getThreadFirstNoteId(PROJECT_ID, 12L, "d-1")).thenThrow(new IOException("timeout"));
            when(vcsClient.createThreadComment(PROJECT_ID, 12L, "body", null)).thenReturn(new ThreadNote("d-2", 8L));

            assertThat(publisher.publish(run, "body")).isEqualTo("8");
        }

        @Test
        @DisplayName("a rejected update propagates")
        void shouldPropagateUpdateFailure() throws Exception {
            run.assignPlaceholder("d-1", 77L);
            when(vcsClient.updateThreadComment(PROJECT_ID, 12L, "d-1", 77L, "body"))
                    .thenThrow(new IOException("GitLab API returned 403"));

            assertThatThrownBy(() -> publisher.publish(run, "body")).isInstanceOf(IOException.class);

            verify(reviewRunService, never()).markFindingsPosted(anyLong(), any());
        }
    }

    @Nested
    @DisplayName("push runs")
    class PushTests {

        private final String marker = "REVIEW_PLACEHOLDER:42";
        private final String markedBody = "body\n\n<!-- REVIEW_PLACEHOLDER:42 -->";

        @Test
        @DisplayName("the placeholder commit comment is found by marker and edited")
        void shouldUpdateCommentFoundByMarker() throws Exception {
            run.assignPlaceholder(marker, null);
            when(vcsClient.findCommitCommentByMarker(PROJECT_ID, SHA, marker)).thenReturn(Optional.of(300L));
            when(vcsClient.updateCommitComment(PROJECT_ID, SHA, 300L, markedBody)).thenReturn(new CommitNote(300L, markedBody));

            assertThat(publisher.publish(run, "body")).isEqualTo("300");

            verify(reviewRunService).resolvePlaceholderNote(42L, 300L);
            verify(vcsClient, never()).createCommitComment(anyLong(), anyString(), anyString());
        }

        @Test
        @DisplayName("a known note id is edited without searching")
        void shouldUpdateKnownNote() throws Exception {
            run.assignPlaceholder(marker, 300L);
            when(vcsClient.updateCommitComment(PROJECT_ID, SHA, 300L, markedBody)).thenReturn(new CommitNote(300L, markedBody));

            publisher.publish(run, "body");

            verify(vcsClient, never()).findCommitCommentByMarker(anyLong(), anyString(), anyString());
        }

        @Test
        @DisplayName("without placeholder a marked comment is created")
        void shouldCreateMarkedComment() throws Exception {
            when(vcsClient.findCommitCommentByMarker(PROJECT_ID, SHA, marker)).thenReturn(Optional.empty());
            when(vcsClient.createCommitComment(PROJECT_ID, SHA, markedBody)).thenReturn(new CommitNote(null, markedBody));

            assertThat(publisher.publish(run, "body")).isNull();

            verify(reviewRunService).assignPlaceholder(42L, marker, null);
            verify(reviewRunService).markFindingsPosted(42L, null);
        }
    }
}
