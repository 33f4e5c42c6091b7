package org.rostilos.reviewpilot.vcsclient.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Base OkHttp client. Per-account clients derive from it and share its connection pool.
 */
@Configuration
public class OkHttpConfig {

    @Value("${reviewpilot.gitlab.connect-timeout-seconds:30}")
    private long connectTimeoutSeconds;

    @Value("${reviewpilot.gitlab.read-timeout-seconds:60}")
    private long readTimeoutSeconds;

    @Value("${reviewpilot.gitlab.write-timeout-seconds:60}")
    private long writeTimeoutSeconds;

    @Bean
    public OkHttpClient baseOkHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(writeTimeoutSeconds, TimeUnit.SECONDS)
                .build();
    }
}
