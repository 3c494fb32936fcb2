package org.tfregistry.webserver.scm.service;

import org.tfregistry.core.model.scm.ScmProviderConfig;
import org.tfregistry.core.model.scm.ScmUserToken;
import org.tfregistry.scmclient.ScmClientException;
import org.tfregistry.scmclient.ScmConnector;
import org.tfregistry.scmclient.model.AccessToken;
import org.tfregistry.webserver.config.RegistryServerProperties;
import org.tfregistry.webserver.config.ScmProperties;
import org.tfregistry.webserver.exception.InvalidScmRequestException;
import org.tfregistry.webserver.exception.ScmResourceNotFoundException;
import org.tfregistry.webserver.exception.ScmUpstreamException;
import org.tfregistry.webserver.scm.dto.response.AuthorizeResponse;
import org.tfregistry.webserver.scm.dto.response.TokenRefreshResponse;
import org.tfregistry.webserver.scm.dto.response.TokenStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Connects users to SCM providers and manages the lifetime of their stored credentials:
 * OAuth authorize and callback, Personal Access Token submission, manual refresh, status and revoke.
 */
@Service
public class ScmCredentialService {

    private static final Logger log = LoggerFactory.getLogger(ScmCredentialService.class);
    private static final String DEFAULT_OAUTH_TOKEN_TYPE = ScmUserToken.TOKEN_TYPE_BEARER;

    private final ScmConnectorResolver connectorResolver;
    private final ScmTokenVault tokenVault;
    private final ScmTokenRenewalService renewalService;
    private final RegistryServerProperties serverProperties;
    private final ScmProperties scmProperties;

    public ScmCredentialService(
            ScmConnectorResolver connectorResolver,
            ScmTokenVault tokenVault,
            ScmTokenRenewalService renewalService,
            RegistryServerProperties serverProperties,
            ScmProperties scmProperties
    ) {
        this.connectorResolver = connectorResolver;
        this.tokenVault = tokenVault;
        this.renewalService = renewalService;
        this.serverProperties = serverProperties;
        this.scmProperties = scmProperties;
    }

    /**
     * Start the OAuth flow, or tell the caller to submit a PAT when the provider does not do OAuth.
     */
    public AuthorizeResponse authorize(UUID providerId, UUID userId) {
        ScmProviderConfig provider = connectorResolver.requireProvider(providerId);
        if (provider.isPatBased()) {
            return AuthorizeResponse.patGuidance();
        }

        ScmConnector connector = connectorResolver.connectorFor(provider);
        String state = new OAuthState(userId, providerId).encode();
        String authorizationUrl = connector.authorizationEndpoint(state, List.of());

        log.info("Starting OAuth flow for user {} on provider {} ({})", userId, providerId,
                provider.getProviderType().getId());
        return AuthorizeResponse.oauth(authorizationUrl, state);
    }

    /**
     * Finish the OAuth flow and store the issued credential.
     *
     * @param error set by the provider when the user declined consent; only logged
     * @return where the browser is sent next
     */
    public String completeAuthorization(UUID providerId, String code, String state, String error) {
        if (code == null || code.isEmpty()) {
            if (error != null && !error.isBlank()) {
                log.warn("OAuth authorization for provider {} returned no code, provider reported: {}",
                        providerId, error);
            }
            throw new InvalidScmRequestException("missing authorization code");
        }
        OAuthState oauthState = OAuthState.parse(state);
        if (!oauthState.providerId().equals(providerId)) {
            throw new InvalidScmRequestException("state does not match provider");
        }

        ScmProviderConfig provider = connectorResolver.requireProvider(providerId);
        ScmConnector connector = connectorResolver.connectorFor(provider);

        AccessToken issued;
        try {
            issued = connector.completeAuthorization(code);
        } catch (IOException | ScmClientException e) {
            throw new ScmUpstreamException("OAuth flow failed: " + e.getMessage(), e);
        }
        if (issued.tokenType() == null || issued.tokenType().isBlank()) {
            issued = new AccessToken(issued.accessToken(), issued.refreshToken(), DEFAULT_OAUTH_TOKEN_TYPE,
                    issued.expiresAt(), issued.scopes());
        }

        ScmUserToken stored = tokenVault.store(oauthState.userId(), providerId, issued);
        log.info("User {} connected to provider {} (token {}, expires at {})",
                oauthState.userId(), providerId, stored.getId(), stored.getExpiresAt());
        return serverProperties.connectedPageUrl(providerId);
    }

    /**
     * Forget the user's credential. Revoking a connection that does not exist succeeds.
     */
    public void revoke(UUID providerId, UUID userId) {
        tokenVault.delete(userId, providerId);
        log.info("Revoked SCM token of user {} for provider {}", userId, providerId);
    }

    /**
     * Renew the stored credential now. A failure is returned as is, without retry.
     */
    public TokenRefreshResponse refresh(UUID providerId, UUID userId) {
        ScmUserToken stored = tokenVault.find(userId, providerId)
                .orElseThrow(() -> new ScmResourceNotFoundException("OAuth token not found"));
        ScmProviderConfig provider = connectorResolver.requireProvider(providerId);
        ScmConnector connector = connectorResolver.connectorFor(provider);

        LiveCredential credential = new LiveCredential(stored, tokenVault.unseal(stored));
        AccessToken renewed;
        try {
            renewed = renewalService.renewNow(connector, credential);
        } catch (IOException | ScmClientException e) {
            throw new ScmUpstreamException("token refresh failed: " + e.getMessage(), e);
        }

        log.info("User {} refreshed token for provider {}", userId, providerId);
        return TokenRefreshResponse.refreshed(renewed.expiresAt());
    }

    /**
     * Store a Personal Access Token for a PAT-based provider.
     */
    public void savePersonalAccessToken(UUID providerId, UUID userId, String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidScmRequestException("access_token is required");
        }
        ScmProviderConfig provider = connectorResolver.requireProvider(providerId);
        if (!provider.isPatBased()) {
            throw new InvalidScmRequestException("this provider uses OAuth, not Personal Access Tokens");
        }

        AccessToken pat = new AccessToken(token, null, ScmUserToken.TOKEN_TYPE_PAT, null,
                List.of(scmProperties.getPatScope()));
        ScmUserToken stored = tokenVault.store(userId, providerId, pat);
        log.info("User {} saved a Personal Access Token for provider {} (token {})", userId, providerId, stored.getId());
    }

    public TokenStatusResponse status(UUID providerId, UUID userId) {
        return tokenVault.find(userId, providerId)
                .map(TokenStatusResponse::fromToken)
                .orElseGet(TokenStatusResponse::notConnected);
    }
}
