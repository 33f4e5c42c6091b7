package org.rostilos.reviewpilot.vcsclient.gitlab;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitLabConfigTest {

    @ParameterizedTest
    @CsvSource({
            "https://gitlab.com, https://gitlab.com/api/v4",
            "https://gitlab.com/, https://gitlab.com/api/v4",
            "https://git.example.org/group/sub, https://git.example.org/api/v4",
            "http://localhost:8929/, http://localhost:8929/api/v4",
            "' https://git.example.org ', https://git.example.org/api/v4"
    })
    void testNormalizeApiBase_StripsPathAndAppendsApi(String input, String expected) {
        assertThat(GitLabConfig.normalizeApiBase(input)).isEqualTo(expected);
    }

    @Test
    void testNormalizeApiBase_BlankUrl_UsesDefaultHost() {
        assertThat(GitLabConfig.normalizeApiBase("")).isEqualTo(GitLabConfig.API_BASE);
        assertThat(GitLabConfig.webOrigin(null)).isEqualTo(GitLabConfig.DEFAULT_HOST);
    }

    @Test
    void testNormalizeApiBase_NoScheme_Throws() {
        assertThatThrownBy(() -> GitLabConfig.normalizeApiBase("gitlab.example.org"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
