package org.rostilos.reviewpilot.analysisengine.publish;

import org.junit.jupiter.api.BeforeEach;
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
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewPlaceholderServiceTest {

    @Mock
    private ReviewRunService reviewRunService;
    @Mock
    private VcsClientProvider vcsClientProvider;
    @Mock
    private VcsClient vcsClient;

    private ReviewPlaceholderService service;
    private ReviewRun run;
    private GitLabAccount account;

    @BeforeEach
    void setUp() {
        service = new ReviewPlaceholderService(reviewRunService, vcsClientProvider);
        account = new GitLabAccount();
        RepositoryConfig repository = new RepositoryConfig();
        repository.setGitLabProjectId(5L);
        repository.setGitLabAccount(account);
        run = new ReviewRun();
        run.setId(42L);
        run.setRepository(repository);
        run.setCommitSha("cafebabe00");
    }

    @Test
    void testCreatePlaceholder_MergeRequestThread() throws Exception {
        run.setMergeRequestIid(12L);
        when(vcsClientProvider.getClient(account)).thenReturn(vcsClient);
        when(vcsClient.createThreadComment(5L, 12L, ReviewPlaceholderService.PLACEHOLDER_MESSAGE, null))
                .thenReturn(new ThreadNote("d-1", 77L));

        service.createPlaceholder(run);

        verify(reviewRunService).assignPlaceholder(42L, "d-1", 77L);
    }

    @Test
    void testCreatePlaceholder_PushCommentCarriesMarker() throws Exception {
        when(vcsClientProvider.getClient(account)).thenReturn(vcsClient);
        String body = ReviewPlaceholderService.PLACEHOLDER_MESSAGE + "\n\n<!-- REVIEW_PLACEHOLDER:42 -->";
        when(vcsClient.createCommitComment(5L, "cafebabe00", body)).thenReturn(new CommitNote(null, body));

        service.createPlaceholder(run);

        verify(reviewRunService).assignPlaceholder(42L, "REVIEW_PLACEHOLDER:42", null);
    }

    @Test
    void testCreatePlaceholder_FailureDoesNotPropagate() throws Exception {
        run.setMergeRequestIid(12L);
        when(vcsClientProvider.getClient(account)).thenReturn(vcsClient);
        when(vcsClient.createThreadComment(anyLong(), anyLong(), anyString(), any()))
                .thenThrow(new IOException("GitLab API returned 500"));

        assertThatCode(() -> service.createPlaceholder(run)).doesNotThrowAnyException();

        verify(reviewRunService, never()).assignPlaceholder(any(), any(), any());
    }

    @Test
    void testCreatePlaceholder_SkippedWhenAlreadyPresent() {
        run.assignPlaceholder("d-1", 77L);

        service.createPlaceholder(run);

        verifyNoInteractions(vcsClientProvider, reviewRunService);
    }

    @Test
    void testCreatePlaceholder_SkippedWhenDisabled() {
        ReflectionTestUtils.setField(service, "enabled", false);

        service.createPlaceholder(run);

        verifyNoInteractions(vcsClientProvider, reviewRunService);
    }
}
