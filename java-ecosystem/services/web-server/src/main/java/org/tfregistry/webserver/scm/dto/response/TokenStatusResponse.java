package org.tfregistry.webserver.scm.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tfregistry.core.model.scm.ScmUserToken;

import java.time.OffsetDateTime;

/**
 * Connection status for one provider. Carries no token material.
 */
public record TokenStatusResponse(
        @JsonProperty("connected") boolean connected,
        @JsonProperty("connected_at") OffsetDateTime connectedAt,
        @JsonProperty("expires_at") OffsetDateTime expiresAt,
        @JsonProperty("token_type") String tokenType
) {
    public static TokenStatusResponse notConnected() {
        return new TokenStatusResponse(false, null, null, null);
    }

    public static TokenStatusResponse fromToken(ScmUserToken token) {
        return new TokenStatusResponse(true, token.getUpdatedAt(), token.getExpiresAt(), token.getTokenType());
    }
}
