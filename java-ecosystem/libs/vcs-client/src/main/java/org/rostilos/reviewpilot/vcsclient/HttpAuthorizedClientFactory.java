package org.rostilos.reviewpilot.vcsclient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.stereotype.Component;

/**
 * Builds OkHttp clients that authenticate every request with a GitLab access token.
 */
@Component
public class HttpAuthorizedClientFactory {

    static final String PRIVATE_TOKEN_HEADER = "PRIVATE-TOKEN";

    private final OkHttpClient baseOkHttpClient;

    public HttpAuthorizedClientFactory(OkHttpClient baseOkHttpClient) {
        this.baseOkHttpClient = baseOkHttpClient;
    }

    /**
     * Create an OkHttpClient that sends the token in the {@code PRIVATE-TOKEN} header.
     *
     * @param accessToken personal, project or group access token
     * @return configured OkHttpClient sharing the base client's pool and timeouts
     */
    public OkHttpClient createGitLabClient(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }

        return baseOkHttpClient.newBuilder()
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header(PRIVATE_TOKEN_HEADER, accessToken)
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
