package org.rostilos.reviewpilot.core.model.vcs;

import jakarta.persistence.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "gitlab_account")
public class GitLabAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "url", nullable = false, length = 512)
    private String url;

    @Column(name = "access_token", nullable = false, length = 512)
    private String accessToken;

    @Column(name = "webhook_secret", length = 256)
    private String webhookSecret;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public void setWebhookSecret(String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
