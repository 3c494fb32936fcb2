package org.tfregistry.webserver.scm.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record TokenRefreshResponse(
        @JsonProperty("message") String message,
        @JsonProperty("expires_at") OffsetDateTime expiresAt
) {
    public static TokenRefreshResponse refreshed(OffsetDateTime expiresAt) {
        return new TokenRefreshResponse("token refreshed", expiresAt);
    }
}
