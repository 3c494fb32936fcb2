package org.tfregistry.webserver.scm.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tfregistry.core.model.scm.EScmProviderType;
import org.tfregistry.core.model.scm.ScmProviderConfig;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Provider configuration as exposed over HTTP. Secrets are never included.
 */
public record ScmProviderDTO(
        @JsonProperty("id") UUID id,
        @JsonProperty("organization_id") UUID organizationId,
        @JsonProperty("provider_type") EScmProviderType providerType,
        @JsonProperty("auth_method") String authMethod,
        @JsonProperty("name") String name,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt
) {
    public static ScmProviderDTO fromProvider(ScmProviderConfig provider) {
        return new ScmProviderDTO(
                provider.getId(),
                provider.getOrganizationId(),
                provider.getProviderType(),
                provider.getProviderType().getAuthMethod().getId(),
                provider.getName(),
                provider.getBaseUrl(),
                provider.getTenantId(),
                provider.getClientId(),
                provider.isActive(),
                provider.getCreatedAt(),
                provider.getUpdatedAt()
        );
    }
}
