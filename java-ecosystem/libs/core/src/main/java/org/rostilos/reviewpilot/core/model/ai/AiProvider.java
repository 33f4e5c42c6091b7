package org.rostilos.reviewpilot.core.model.ai;

public enum AiProvider {
    OPENAI,
    ANTHROPIC,
    CUSTOM;

    /**
     * Lenient lookup used for configuration values ("openai", "claude", "anthropic", "custom").
     */
    public static AiProvider fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("AI provider id must not be empty");
        }
        String normalized = id.trim().toLowerCase();
        return switch (normalized) {
            case "openai" -> OPENAI;
            case "anthropic", "claude" -> ANTHROPIC;
            case "custom" -> CUSTOM;
            default -> throw new IllegalArgumentException("Unknown AI provider: " + id);
        };
    }
}
