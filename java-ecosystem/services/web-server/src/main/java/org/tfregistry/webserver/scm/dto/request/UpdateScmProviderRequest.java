package org.tfregistry.webserver.scm.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial update. Null fields are left unchanged.
 */
public record UpdateScmProviderRequest(
        @JsonProperty("name") String name,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        @JsonProperty("webhook_secret") String webhookSecret,
        @JsonProperty("is_active") Boolean active
) {
    @Override
    public String toString() {
        return "UpdateScmProviderRequest{name=" + name + ", baseUrl=" + baseUrl + ", active=" + active + "}";
    }
}
