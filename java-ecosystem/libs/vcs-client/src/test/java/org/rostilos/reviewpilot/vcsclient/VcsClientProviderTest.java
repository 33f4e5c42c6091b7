package org.rostilos.reviewpilot.vcsclient;

import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.rostilos.reviewpilot.core.model.vcs.GitLabAccount;
import org.rostilos.reviewpilot.vcsclient.gitlab.GitLabClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VcsClientProviderTest {

    private final VcsClientProvider provider =
            new VcsClientProvider(new HttpAuthorizedClientFactory(new OkHttpClient()));

    private GitLabAccount account(String url, String token) {
        GitLabAccount account = new GitLabAccount();
        account.setId(1L);
        account.setUrl(url);
        account.setAccessToken(token);
        return account;
    }

    @Test
    void testGetClient_NormalizesAccountUrl() {
        VcsClient client = provider.getClient(account("https://git.example.org/some/group", "token"));

        assertThat(client).isInstanceOf(GitLabClient.class);
        assertThat(((GitLabClient) client).getApiBase()).isEqualTo("https://git.example.org/api/v4");
    }

    @Test
    void testGetClient_NullAccount_Throws() {
        assertThatThrownBy(() -> provider.getClient(null))
                .isInstanceOf(VcsClientException.class);
    }

    @Test
    void testGetClient_MissingToken_Throws() {
        assertThatThrownBy(() -> provider.getClient(account("https://gitlab.com", "")))
                .isInstanceOf(VcsClientException.class)
                .hasMessageContaining("Access token");
    }
}
