package org.tfregistry.webserver.scm.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.UUID;

/**
 * @param organizationId null registers a global provider
 * @param clientId       optional for PAT-based provider types
 */
public record CreateScmProviderRequest(
        @JsonProperty("organization_id") UUID organizationId,
        @JsonProperty("provider_type") @NotBlank(message = "provider_type is required") String providerType,
        @JsonProperty("name") @NotBlank(message = "name is required") String name,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("webhook_secret") String webhookSecret
) {
    @Override
    public String toString() {
        return "CreateScmProviderRequest{providerType=" + providerType + ", name=" + name + ", baseUrl=" + baseUrl + "}";
    }
}
