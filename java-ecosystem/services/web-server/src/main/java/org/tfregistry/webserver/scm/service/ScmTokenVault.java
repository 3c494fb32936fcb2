package org.tfregistry.webserver.scm.service;

import org.tfregistry.core.model.scm.ScmUserToken;
import org.tfregistry.core.persistence.repository.scm.ScmUserTokenRepository;
import org.tfregistry.scmclient.model.AccessToken;
import org.tfregistry.security.oauth.TokenEncryptionService;
import org.tfregistry.webserver.exception.CredentialEncryptionException;
import org.tfregistry.webserver.exception.ScmIntegrationException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The only place user tokens are sealed, opened and written.
 * Writes are upserts keyed on (user, provider): an existing row keeps its id and creation time.
 */
@Component
public class ScmTokenVault {

    private static final String SCOPE_DELIMITER = ",";

    private final ScmUserTokenRepository tokenRepository;
    private final TokenEncryptionService encryptionService;

    public ScmTokenVault(ScmUserTokenRepository tokenRepository, TokenEncryptionService encryptionService) {
        this.tokenRepository = tokenRepository;
        this.encryptionService = encryptionService;
    }

    public Optional<ScmUserToken> find(UUID userId, UUID providerId) {
        try {
            return tokenRepository.findByUserIdAndProviderId(userId, providerId);
        } catch (DataAccessException e) {
            throw new ScmIntegrationException("failed to load token", e);
        }
    }

    /**
     * Rebuild the plaintext credential of a stored row for the duration of one request.
     */
    public AccessToken unseal(ScmUserToken token) {
        String accessToken = open(token.getAccessTokenEncrypted(), "access token");
        String refreshToken = token.hasRefreshToken() ? open(token.getRefreshTokenEncrypted(), "refresh token") : null;
        return new AccessToken(accessToken, refreshToken, token.getTokenType(), token.getExpiresAt(),
                splitScopes(token.getScopes()));
    }

    /**
     * Store a freshly issued credential, replacing whatever the user had for this provider.
     */
    public ScmUserToken store(UUID userId, UUID providerId, AccessToken credential) {
        ScmUserToken row = find(userId, providerId).orElseGet(() -> {
            ScmUserToken created = new ScmUserToken();
            created.setId(UUID.randomUUID());
            created.setUserId(userId);
            created.setProviderId(providerId);
            return created;
        });

        row.setAccessTokenEncrypted(seal(credential.accessToken(), "access token"));
        row.setRefreshTokenEncrypted(credential.hasRefreshToken()
                ? seal(credential.refreshToken(), "refresh token")
                : null);
        row.setTokenType(credential.tokenType());
        row.setExpiresAt(credential.expiresAt());
        row.setScopes(String.join(SCOPE_DELIMITER, credential.scopes()));
        return save(row);
    }

    /**
     * Write a renewal onto an existing row. The stored refresh token is only replaced when a new one was issued.
     */
    public ScmUserToken applyRenewal(ScmUserToken row, AccessToken renewed) {
        row.setAccessTokenEncrypted(seal(renewed.accessToken(), "access token"));
        if (renewed.hasRefreshToken()) {
            row.setRefreshTokenEncrypted(seal(renewed.refreshToken(), "refresh token"));
        }
        row.setExpiresAt(renewed.expiresAt());
        return save(row);
    }

    public void delete(UUID userId, UUID providerId) {
        try {
            tokenRepository.deleteByUserIdAndProviderId(userId, providerId);
        } catch (DataAccessException e) {
            throw new ScmIntegrationException("failed to revoke token", e);
        }
    }

    public String seal(String plaintext, String what) {
        try {
            return encryptionService.encrypt(plaintext);
        } catch (GeneralSecurityException e) {
            throw new CredentialEncryptionException("failed to encrypt " + what, e);
        }
    }

    public String open(String ciphertext, String what) {
        try {
            return encryptionService.decrypt(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new CredentialEncryptionException("failed to decrypt " + what, e);
        }
    }

    private ScmUserToken save(ScmUserToken row) {
        try {
            return tokenRepository.save(row);
        } catch (DataAccessException e) {
            throw new ScmIntegrationException("failed to store token", e);
        }
    }

    static List<String> splitScopes(String scopes) {
        if (scopes == null || scopes.isBlank()) {
            return List.of();
        }
        return Arrays.stream(scopes.split(SCOPE_DELIMITER))
                .map(String::trim)
                .filter(scope -> !scope.isEmpty())
                .toList();
    }
}
