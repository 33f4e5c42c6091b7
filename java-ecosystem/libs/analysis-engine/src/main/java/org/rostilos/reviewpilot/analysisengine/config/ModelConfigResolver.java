package org.rostilos.reviewpilot.analysisengine.config;

import org.rostilos.reviewpilot.analysisengine.exception.ModelConfigurationException;
import org.rostilos.reviewpilot.analysisengine.llm.ModelConfig;
import org.rostilos.reviewpilot.core.model.ai.AiModel;
import org.rostilos.reviewpilot.core.model.ai.AiProvider;
import org.rostilos.reviewpilot.core.model.config.RepositoryConfig;
import org.rostilos.reviewpilot.core.persistence.repository.ai.AiModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Resolves the model a repository is reviewed with: repository override, then the repository's
 * default model, then the global default model, then application properties.
 */
@Service
public class ModelConfigResolver {
    private static final Logger log = LoggerFactory.getLogger(ModelConfigResolver.class);

    private final AiModelRepository aiModelRepository;

    @Value("${reviewpilot.ai.default.provider:openai}")
    private String defaultProvider = "openai";

    @Value("${reviewpilot.ai.default.model:gpt-4o}")
    private String defaultModel = "gpt-4o";

    @Value("${reviewpilot.ai.default.api-key:}")
    private String defaultApiKey = "";

    @Value("${reviewpilot.ai.default.endpoint:}")
    private String defaultEndpoint = "";

    public ModelConfigResolver(AiModelRepository aiModelRepository) {
        this.aiModelRepository = aiModelRepository;
    }

    /**
     * @throws ModelConfigurationException if the chosen configuration has no API key
     */
    @Transactional(readOnly = true)
    public ModelConfig resolve(RepositoryConfig repository) {
        ModelConfig config = resolveCandidate(repository);
        if (config.apiKey() == null || config.apiKey().isBlank()) {
            throw new ModelConfigurationException(
                    "No API key configured for model " + config.providerId() + "/" + config.modelId());
        }
        log.debug("Resolved model {} for repository {}", config,
                repository != null ? repository.getId() : null);
        return config;
    }

    private ModelConfig resolveCandidate(RepositoryConfig repository) {
        if (repository != null && repository.hasCustomModel()) {
            return ModelConfig.of(
                    repository.getCustomProvider(),
                    repository.getCustomModelId(),
                    repository.getCustomApiKey(),
                    repository.getCustomApiEndpoint(),
                    repository.getCustomMaxTokens(),
                    repository.getCustomTemperature());
        }
        if (repository != null && repository.getDefaultModel() != null && repository.getDefaultModel().isActive()) {
            return fromModel(repository.getDefaultModel());
        }
        Optional<AiModel> global = aiModelRepository.findFirstByDefaultModelTrueAndActiveTrue();
        if (global.isPresent()) {
            return fromModel(global.get());
        }
        AiProvider provider;
        try {
            provider = AiProvider.fromId(defaultProvider);
        } catch (IllegalArgumentException e) {
            throw new ModelConfigurationException("Invalid default AI provider: " + defaultProvider);
        }
        return ModelConfig.of(provider, defaultModel, defaultApiKey, defaultEndpoint, null, null);
    }

    private static ModelConfig fromModel(AiModel model) {
        return ModelConfig.of(
                model.getProvider(),
                model.getModelId(),
                model.getApiKey(),
                model.getApiEndpoint(),
                model.getMaxTokens(),
                model.getTemperature());
    }
}
