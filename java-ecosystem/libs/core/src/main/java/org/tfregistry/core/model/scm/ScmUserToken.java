package org.tfregistry.core.model.scm;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A user's stored credential for one SCM provider. Both token columns hold ciphertext.
 * Scopes are kept as a single comma-joined string.
 */
@Entity
@Table(name = "scm_oauth_token",
        uniqueConstraints = @UniqueConstraint(name = "uq_scm_oauth_token_user_provider",
                columnNames = {"user_id", "scm_provider_id"}))
public class ScmUserToken {

    public static final String TOKEN_TYPE_BEARER = "bearer";
    public static final String TOKEN_TYPE_PAT = "pat";

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "scm_provider_id", nullable = false)
    private UUID providerId;

    @Column(name = "access_token_encrypted", nullable = false, length = 8192)
    private String accessTokenEncrypted;

    @Column(name = "refresh_token_encrypted", length = 8192)
    private String refreshTokenEncrypted;

    @Column(name = "token_type", nullable = false)
    private String tokenType;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "scopes")
    private String scopes;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public UUID getProviderId() {
        return providerId;
    }

    public void setProviderId(UUID providerId) {
        this.providerId = providerId;
    }

    public String getAccessTokenEncrypted() {
        return accessTokenEncrypted;
    }

    public void setAccessTokenEncrypted(String accessTokenEncrypted) {
        this.accessTokenEncrypted = accessTokenEncrypted;
    }

    public String getRefreshTokenEncrypted() {
        return refreshTokenEncrypted;
    }

    public void setRefreshTokenEncrypted(String refreshTokenEncrypted) {
        this.refreshTokenEncrypted = refreshTokenEncrypted;
    }

    public String getTokenType() {
        return tokenType;
    }

    public void setTokenType(String tokenType) {
        this.tokenType = tokenType;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public String getScopes() {
        return scopes;
    }

    public void setScopes(String scopes) {
        this.scopes = scopes;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Transient
    public boolean hasRefreshToken() {
        return refreshTokenEncrypted != null && !refreshTokenEncrypted.isEmpty();
    }
}
