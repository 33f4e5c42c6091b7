package org.rostilos.reviewpilot.analysisengine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestTemplateConfiguration {

    @Value("${reviewpilot.ai.connect-timeout-seconds:20}")
    private int connectTimeoutSeconds;

    @Value("${reviewpilot.ai.read-timeout-minutes:5}")
    private int readTimeoutMinutes;

    @Bean("aiRestTemplate")
    public RestTemplate aiRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .setReadTimeout(Duration.ofMinutes(readTimeoutMinutes))
                .build();
    }
}
