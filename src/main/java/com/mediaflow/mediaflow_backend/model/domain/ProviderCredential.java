package com.mediaflow.mediaflow_backend.model.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "provider_credentials",
        uniqueConstraints = @UniqueConstraint(name = "uk_provider_credentials_org", columnNames = {"organization_id", "provider"}))
public class ProviderCredential {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MediaProvider provider;

    @Column(name = "api_key", nullable = false)
    private String apiKey;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() { this.updatedAt = Instant.now(); }

    public UUID getId() { return id; }
    public String getOrganizationId() { return organizationId; }
    public MediaProvider getProvider() { return provider; }
    public String getApiKey() { return apiKey; }
    public boolean isEnabled() { return enabled; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setId(UUID id) { this.id = id; }
    public void setOrganizationId(String organizationId) { this.organizationId = organizationId; }
    public void setProvider(MediaProvider provider) { this.provider = provider; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
