package org.rostilos.reviewpilot.core.model.config;

import jakarta.persistence.*;
import org.rostilos.reviewpilot.core.model.ai.AiModel;
import org.rostilos.reviewpilot.core.model.ai.AiProvider;
import org.rostilos.reviewpilot.core.model.vcs.GitLabAccount;

import java.time.OffsetDateTime;

/**
 * Review settings of one GitLab project. Managed outside this service and only read here.
 */
@Entity
@Table(name = "repository_config", indexes = {
        @Index(name = "idx_repository_config_project", columnList = "gitlab_project_id")
})
public class RepositoryConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "gitlab_project_id", nullable = false)
    private Long gitLabProjectId;

    @Column(name = "name", nullable = false, length = 256)
    private String name;

    /**
     * Full namespace path, e.g. {@code group/sub/project}. Used to build web links.
     */
    @Column(name = "path", nullable = false, length = 512)
    private String path;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "gitlab_account_id", nullable = false)
    private GitLabAccount gitLabAccount;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "auto_review", nullable = false)
    private boolean autoReview = true;

    @Column(name = "watch_branches", length = 1024)
    private String watchBranches;

    @Column(name = "custom_prompt", columnDefinition = "TEXT")
    private String customPrompt;

    @Enumerated(EnumType.STRING)
    @Column(name = "custom_prompt_mode", length = 16)
    private PromptMode customPromptMode = PromptMode.EXTEND;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "default_ai_model_id")
    private AiModel defaultModel;

    @Enumerated(EnumType.STRING)
    @Column(name = "custom_provider", length = 32)
    private AiProvider customProvider;

    @Column(name = "custom_model_id", length = 256)
    private String customModelId;

    @Column(name = "custom_api_key", length = 512)
    private String customApiKey;

    @Column(name = "custom_api_endpoint", length = 512)
    private String customApiEndpoint;

    @Column(name = "custom_max_tokens")
    private Integer customMaxTokens;

    @Column(name = "custom_temperature")
    private Double customTemperature;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public boolean hasCustomModel() {
        return customProvider != null && customModelId != null && !customModelId.isBlank();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getGitLabProjectId() {
        return gitLabProjectId;
    }

    public void setGitLabProjectId(Long gitLabProjectId) {
        this.gitLabProjectId = gitLabProjectId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public GitLabAccount getGitLabAccount() {
        return gitLabAccount;
    }

    public void setGitLabAccount(GitLabAccount gitLabAccount) {
        this.gitLabAccount = gitLabAccount;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isAutoReview() {
        return autoReview;
    }

    public void setAutoReview(boolean autoReview) {
        this.autoReview = autoReview;
    }

    public String getWatchBranches() {
        return watchBranches;
    }

    public void setWatchBranches(String watchBranches) {
        this.watchBranches = watchBranches;
    }

    public String getCustomPrompt() {
        return customPrompt;
    }

    public void setCustomPrompt(String customPrompt) {
        this.customPrompt = customPrompt;
    }

    public PromptMode getCustomPromptMode() {
        return customPromptMode;
    }

    public void setCustomPromptMode(PromptMode customPromptMode) {
        this.customPromptMode = customPromptMode;
    }

    public AiModel getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(AiModel defaultModel) {
        this.defaultModel = defaultModel;
    }

    public AiProvider getCustomProvider() {
        return customProvider;
    }

    public void setCustomProvider(AiProvider customProvider) {
        this.customProvider = customProvider;
    }

    public String getCustomModelId() {
        return customModelId;
    }

    public void setCustomModelId(String customModelId) {
        this.customModelId = customModelId;
    }

    public String getCustomApiKey() {
        return customApiKey;
    }

    public void setCustomApiKey(String customApiKey) {
        this.customApiKey = customApiKey;
    }

    public String getCustomApiEndpoint() {
        return customApiEndpoint;
    }

    public void setCustomApiEndpoint(String customApiEndpoint) {
        this.customApiEndpoint = customApiEndpoint;
    }

    public Integer getCustomMaxTokens() {
        return customMaxTokens;
    }

    public void setCustomMaxTokens(Integer customMaxTokens) {
        this.customMaxTokens = customMaxTokens;
    }

    public Double getCustomTemperature() {
        return customTemperature;
    }

    public void setCustomTemperature(Double customTemperature) {
        this.customTemperature = customTemperature;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
