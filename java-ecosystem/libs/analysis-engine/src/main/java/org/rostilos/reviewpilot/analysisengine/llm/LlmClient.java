package org.rostilos.reviewpilot.analysisengine.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.reviewpilot.core.model.ai.AiProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Sends a system and user prompt to a chat model and returns the generated text.
 * Supports OpenAI chat completions and Anthropic messages, see {@link LlmDialect}.
 */
@Service
public class LlmClient {
    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Value("${reviewpilot.ai.retry.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${reviewpilot.ai.retry.backoff-ms:2000}")
    private long backoffMs = 2000;

    @Value("${reviewpilot.ai.openai.base-url:https://api.openai.com}")
    private String openAiBaseUrl = "https://api.openai.com";

    @Value("${reviewpilot.ai.anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl = "https://api.anthropic.com";

    public LlmClient(@Qualifier("aiRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Invoke the model. Transient failures are retried with a linearly growing backoff.
     *
     * @return non-blank generated text
     * @throws LlmClientException when retries are exhausted, on a client error, or on an empty/malformed answer
     */
    public String invoke(String systemPrompt, String userPrompt, ModelConfig config) throws LlmClientException {
        if (config.provider() == AiProvider.CUSTOM && config.apiEndpoint() == null) {
            throw new LlmClientException("Custom model " + config.modelId() + " has no API endpoint", false);
        }
        LlmDialect dialect = LlmDialect.select(config);
        String url = dialect.resolveUrl(baseUrl(dialect, config));
        int attempts = Math.max(1, maxAttempts);

        for (int attempt = 1; ; attempt++) {
            try {
                log.debug("Calling {} model {} at {} (attempt {}/{})",
                        dialect, config.modelId(), url, attempt, attempts);
                return call(dialect, url, systemPrompt, userPrompt, config);
            } catch (LlmClientException e) {
                if (!e.isTransient() || attempt >= attempts) {
                    log.error("Model call to {} failed after {} attempt(s): {}", url, attempt, e.getMessage());
                    throw e;
                }
                long delay = attempt * backoffMs;
                log.warn("Model call attempt {}/{} failed: {}. Retrying in {} ms",
                        attempt, attempts, e.getMessage(), delay);
                sleep(delay);
            }
        }
    }

    private String call(LlmDialect dialect, String url, String systemPrompt, String userPrompt,
                        ModelConfig config) throws LlmClientException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        dialect.applyHeaders(headers, config.apiKey());

        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(
                    dialect.buildBody(objectMapper, systemPrompt, userPrompt, config));
        } catch (JsonProcessingException e) {
            throw new LlmClientException("Failed to serialize model request", false, e);
        }

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(requestBody, headers), String.class);
        } catch (HttpServerErrorException e) {
            throw new LlmClientException("Model API error " + e.getStatusCode().value() + ": "
                    + e.getResponseBodyAsString(), true, e);
        } catch (HttpClientErrorException e) {
            throw new LlmClientException("Model API error " + e.getStatusCode().value() + ": "
                    + e.getResponseBodyAsString(), false, e);
        } catch (ResourceAccessException e) {
            throw new LlmClientException("Model API unreachable: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new LlmClientException("Model API call failed: " + e.getMessage(), false, e);
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new LlmClientException("Empty response from model API", false);
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LlmClientException("Malformed response from model API", false, e);
        }

        String text = dialect.extractText(json);
        if (text == null || text.isBlank()) {
            throw new LlmClientException("Model API response contains no text", false);
        }
        if (json.has("usage")) {
            log.debug("Model usage: {}", json.get("usage"));
        }
        return text;
    }

    private String baseUrl(LlmDialect dialect, ModelConfig config) {
        if (config.apiEndpoint() != null) {
            return config.apiEndpoint();
        }
        return dialect == LlmDialect.ANTHROPIC ? anthropicBaseUrl : openAiBaseUrl;
    }

    void sleep(long millis) throws LlmClientException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmClientException("Interrupted while waiting to retry model call", false, e);
        }
    }
}
