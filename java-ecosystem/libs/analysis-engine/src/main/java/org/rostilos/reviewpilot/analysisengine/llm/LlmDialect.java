package org.rostilos.reviewpilot.analysisengine.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rostilos.reviewpilot.core.model.ai.AiProvider;
import org.springframework.http.HttpHeaders;

import java.util.regex.Pattern;

/**
 * Wire formats understood by {@link LlmClient}.
 */
public enum LlmDialect {

    OPENAI {
        @Override
        String resolveUrl(String base) {
            String trimmed = stripTrailingSlash(base);
            if (trimmed.endsWith(CHAT_COMPLETIONS_PATH)) {
                return trimmed;
            }
            if (VERSION_SUFFIX.matcher(trimmed).find()) {
                return trimmed + CHAT_COMPLETIONS_PATH;
            }
            return trimmed + "/v1" + CHAT_COMPLETIONS_PATH;
        }

        @Override
        void applyHeaders(HttpHeaders headers, String apiKey) {
            headers.setBearerAuth(apiKey);
        }

        @Override
        ObjectNode buildBody(ObjectMapper mapper, String systemPrompt, String userPrompt, ModelConfig config) {
            ObjectNode body = mapper.createObjectNode();
            body.put("model", config.modelId());
            ArrayNode messages = body.putArray("messages");
            messages.addObject().put("role", "system").put("content", systemPrompt);
            messages.addObject().put("role", "user").put("content", userPrompt);
            body.put("max_tokens", config.maxTokens());
            body.put("temperature", config.temperature());
            return body;
        }

        @Override
        String extractText(JsonNode response) {
            return response.path("choices").path(0).path("message").path("content").asText("");
        }
    },

    ANTHROPIC {
        @Override
        String resolveUrl(String base) {
            String trimmed = stripTrailingSlash(base);
            return trimmed.endsWith(MESSAGES_PATH) ? trimmed : trimmed + MESSAGES_PATH;
        }

        @Override
        void applyHeaders(HttpHeaders headers, String apiKey) {
            headers.set("x-api-key", apiKey);
            headers.set("anthropic-version", ANTHROPIC_VERSION);
        }

        @Override
        ObjectNode buildBody(ObjectMapper mapper, String systemPrompt, String userPrompt, ModelConfig config) {
            ObjectNode body = mapper.createObjectNode();
            body.put("model", config.modelId());
            body.put("max_tokens", config.maxTokens());
            body.put("system", systemPrompt);
            body.putArray("messages").addObject().put("role", "user").put("content", userPrompt);
            return body;
        }

        @Override
        String extractText(JsonNode response) {
            for (JsonNode block : response.path("content")) {
                if ("text".equals(block.path("type").asText())) {
                    return block.path("text").asText("");
                }
            }
            return "";
        }
    };

    static final String ANTHROPIC_VERSION = "2023-06-01";
    static final String CHAT_COMPLETIONS_PATH = "/chat/completions";
    static final String MESSAGES_PATH = "/v1/messages";
    private static final Pattern VERSION_SUFFIX = Pattern.compile("/v\\d+$");

    abstract String resolveUrl(String base);

    abstract void applyHeaders(HttpHeaders headers, String apiKey);

    abstract ObjectNode buildBody(ObjectMapper mapper, String systemPrompt, String userPrompt, ModelConfig config);

    /**
     * @return the generated text, or an empty string when the response has none
     */
    abstract String extractText(JsonNode response);

    /**
     * Custom endpoints speak the Anthropic format when their URL mentions it, OpenAI otherwise.
     */
    public static LlmDialect select(ModelConfig config) {
        if (config.provider() == AiProvider.ANTHROPIC) {
            return ANTHROPIC;
        }
        if (config.provider() == AiProvider.CUSTOM
                && config.apiEndpoint() != null
                && config.apiEndpoint().toLowerCase().contains("anthropic")) {
            return ANTHROPIC;
        }
        return OPENAI;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
