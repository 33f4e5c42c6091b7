package org.rostilos.reviewpilot.analysisengine.llm;

import org.rostilos.reviewpilot.core.model.ai.AiProvider;

/**
 * Effective model settings for one review run.
 *
 * @param apiEndpoint base URL override; required for {@link AiProvider#CUSTOM}
 */
public record ModelConfig(
        AiProvider provider,
        String modelId,
        String apiKey,
        String apiEndpoint,
        int maxTokens,
        double temperature
) {

    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final double DEFAULT_TEMPERATURE = 0.3;

    public static ModelConfig of(AiProvider provider, String modelId, String apiKey, String apiEndpoint,
                                 Integer maxTokens, Double temperature) {
        return new ModelConfig(
                provider,
                modelId,
                apiKey,
                apiEndpoint == null || apiEndpoint.isBlank() ? null : apiEndpoint.trim(),
                maxTokens != null && maxTokens > 0 ? maxTokens : DEFAULT_MAX_TOKENS,
                temperature != null ? temperature : DEFAULT_TEMPERATURE);
    }

    /**
     * Lowercase provider id as recorded on the review run.
     */
    public String providerId() {
        return provider.name().toLowerCase();
    }

    @Override
    public String toString() {
        return "ModelConfig[provider=" + provider + ", modelId=" + modelId + ", apiEndpoint=" + apiEndpoint
                + ", maxTokens=" + maxTokens + ", temperature=" + temperature + "]";
    }
}
