package org.rostilos.reviewpilot.vcsclient;

import org.rostilos.reviewpilot.core.model.vcs.GitLabAccount;
import org.rostilos.reviewpilot.vcsclient.gitlab.GitLabClient;
import org.rostilos.reviewpilot.vcsclient.gitlab.GitLabConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Provides a VCS client bound to an account's host and credentials.
 *
 * Usage:
 *   VcsClient client = vcsClientProvider.getClient(repository.getGitLabAccount());
 */
@Service
public class VcsClientProvider {

    private static final Logger log = LoggerFactory.getLogger(VcsClientProvider.class);

    private final HttpAuthorizedClientFactory httpClientFactory;

    public VcsClientProvider(HttpAuthorizedClientFactory httpClientFactory) {
        this.httpClientFactory = httpClientFactory;
    }

    public VcsClient getClient(GitLabAccount account) {
        if (account == null) {
            throw new VcsClientException("No GitLab account configured");
        }
        try {
            String apiBase = GitLabConfig.normalizeApiBase(account.getUrl());
            log.debug("Creating GitLab client for {}", apiBase);
            return new GitLabClient(httpClientFactory.createGitLabClient(account.getAccessToken()), apiBase);
        } catch (IllegalArgumentException e) {
            throw new VcsClientException("Invalid GitLab account " + account.getId() + ": " + e.getMessage(), e);
        }
    }
}
