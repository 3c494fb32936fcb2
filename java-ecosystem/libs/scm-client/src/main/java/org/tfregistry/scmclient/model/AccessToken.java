package org.tfregistry.scmclient.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A plaintext SCM credential as returned by a connector, or reconstructed from storage for one request.
 * Never serialized and never persisted in this form.
 *
 * @param expiresAt null when the credential does not expire
 */
public record AccessToken(
        String accessToken,
        String refreshToken,
        String tokenType,
        OffsetDateTime expiresAt,
        List<String> scopes
) {
    public AccessToken {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    /**
     * Applies a renewal response. The refresh token is only replaced when the provider issued a new one.
     */
    public AccessToken renewedWith(AccessToken renewed) {
        return new AccessToken(
                renewed.accessToken(),
                renewed.hasRefreshToken() ? renewed.refreshToken() : refreshToken,
                renewed.tokenType() != null ? renewed.tokenType() : tokenType,
                renewed.expiresAt(),
                renewed.scopes().isEmpty() ? scopes : renewed.scopes()
        );
    }

    @Override
    public String toString() {
        return "AccessToken{tokenType=" + tokenType + ", expiresAt=" + expiresAt
                + ", hasRefreshToken=" + hasRefreshToken() + ", scopes=" + scopes + "}";
    }
}
