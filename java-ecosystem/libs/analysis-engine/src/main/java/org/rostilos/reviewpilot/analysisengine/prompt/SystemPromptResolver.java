package org.rostilos.reviewpilot.analysisengine.prompt;

import org.rostilos.reviewpilot.core.model.config.PromptMode;
import org.rostilos.reviewpilot.core.model.config.RepositoryConfig;
import org.springframework.stereotype.Component;

/**
 * Combines the base review prompt with a repository's custom prompt.
 */
@Component
public class SystemPromptResolver {

    public String resolve(RepositoryConfig repository) {
        String customPrompt = repository != null ? repository.getCustomPrompt() : null;
        if (customPrompt == null || customPrompt.isBlank()) {
            return ReviewPrompts.SYSTEM_PROMPT;
        }
        PromptMode mode = repository.getCustomPromptMode() != null
                ? repository.getCustomPromptMode()
                : PromptMode.EXTEND;
        if (mode == PromptMode.REPLACE) {
            return customPrompt + ReviewPrompts.OUTPUT_FORMAT;
        }
        return ReviewPrompts.SYSTEM_PROMPT + ReviewPrompts.CUSTOM_PROMPT_SEPARATOR + customPrompt;
    }
}
