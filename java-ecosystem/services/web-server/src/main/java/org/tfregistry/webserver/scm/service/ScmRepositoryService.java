package org.tfregistry.webserver.scm.service;

import org.tfregistry.core.model.scm.ScmProviderConfig;
import org.tfregistry.core.model.scm.ScmUserToken;
import org.tfregistry.scmclient.ScmApiException;
import org.tfregistry.scmclient.ScmClientException;
import org.tfregistry.scmclient.ScmConnector;
import org.tfregistry.scmclient.model.AccessToken;
import org.tfregistry.scmclient.model.Pagination;
import org.tfregistry.scmclient.model.ScmBranch;
import org.tfregistry.scmclient.model.ScmRepository;
import org.tfregistry.scmclient.model.ScmRepositoryPage;
import org.tfregistry.scmclient.model.ScmTag;
import org.tfregistry.webserver.exception.InvalidScmRequestException;
import org.tfregistry.webserver.exception.ScmIntegrationException;
import org.tfregistry.webserver.exception.ScmReconnectRequiredException;
import org.tfregistry.webserver.exception.ScmUpstreamException;
import org.tfregistry.webserver.exception.UnauthenticatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Reads repositories, tags and branches with the user's stored credential.
 * <p>
 * A credential close to expiry is renewed before the read. A read rejected with 401, 403 or 203 is
 * followed by at most one renewal and one retry; a credential that is still rejected means the user
 * has to reconnect.
 */
@Service
public class ScmRepositoryService {

    private static final Logger log = LoggerFactory.getLogger(ScmRepositoryService.class);

    private final ScmConnectorResolver connectorResolver;
    private final ScmTokenVault tokenVault;
    private final ScmTokenRenewalService renewalService;

    public ScmRepositoryService(
            ScmConnectorResolver connectorResolver,
            ScmTokenVault tokenVault,
            ScmTokenRenewalService renewalService
    ) {
        this.connectorResolver = connectorResolver;
        this.tokenVault = tokenVault;
        this.renewalService = renewalService;
    }

    @FunctionalInterface
    interface ScmRead<T> {
        T read(ScmConnector connector, AccessToken token) throws IOException;
    }

    /**
     * @param search searches by name when non-blank, otherwise lists the user's repositories
     */
    public List<ScmRepository> listRepositories(UUID providerId, UUID userId, String search) {
        boolean searching = search != null && !search.isBlank();
        ScmRepositoryPage page = callWithRenewal(providerId, userId, "list repositories",
                (connector, token) -> searching
                        ? connector.searchRepositories(token, search.trim(), Pagination.DEFAULT)
                        : connector.fetchRepositories(token, Pagination.DEFAULT));
        return page == null ? List.of() : page.repositories();
    }

    public List<ScmTag> listTags(UUID providerId, UUID userId, String owner, String repo) {
        requireRepositoryPath(owner, repo);
        List<ScmTag> tags = callWithRenewal(providerId, userId, "list tags",
                (connector, token) -> connector.fetchTags(token, owner, repo, Pagination.DEFAULT));
        return tags == null ? List.of() : tags;
    }

    public List<ScmBranch> listBranches(UUID providerId, UUID userId, String owner, String repo) {
        requireRepositoryPath(owner, repo);
        List<ScmBranch> branches = callWithRenewal(providerId, userId, "list branches",
                (connector, token) -> connector.fetchBranches(token, owner, repo, Pagination.DEFAULT));
        return branches == null ? List.of() : branches;
    }

    <T> T callWithRenewal(UUID providerId, UUID userId, String operation, ScmRead<T> read) {
        ScmProviderConfig provider = connectorResolver.requireProvider(providerId);
        ScmUserToken stored = tokenVault.find(userId, providerId)
                .orElseThrow(() -> new UnauthenticatedException("not connected to this provider"));
        ScmConnector connector = connectorResolver.connectorFor(provider);
        LiveCredential credential = new LiveCredential(stored, tokenVault.unseal(stored));

        if (renewalService.isDueForRenewal(credential.token())) {
            log.info("Credential of user {} for provider {} expires at {}, renewing before {}",
                    userId, providerId, credential.token().expiresAt(), operation);
            try {
                renewalService.renew(connector, credential);
            } catch (IOException | ScmClientException | ScmIntegrationException e) {
                log.warn("Proactive renewal failed for user {} on provider {}, continuing with stored credential: {}",
                        userId, providerId, e.getMessage());
            }
        }

        try {
            return read.read(connector, credential.token());
        } catch (ScmApiException e) {
            if (!e.isAuthFailure() || !credential.token().hasRefreshToken()) {
                throw translate(operation, e);
            }
            log.warn("Provider {} rejected credential of user {} with HTTP {} during {}, renewing once",
                    providerId, userId, e.getStatusCode(), operation);
            try {
                renewalService.renew(connector, credential);
            } catch (IOException | ScmClientException | ScmIntegrationException renewalFailure) {
                log.warn("Renewal after rejection failed for user {} on provider {}: {}",
                        userId, providerId, renewalFailure.getMessage());
                throw new ScmReconnectRequiredException(e);
            }
            return retry(operation, read, connector, credential);
        } catch (IOException | ScmClientException e) {
            throw new ScmUpstreamException("failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private <T> T retry(String operation, ScmRead<T> read, ScmConnector connector, LiveCredential credential) {
        try {
            return read.read(connector, credential.token());
        } catch (ScmApiException e) {
            throw translate(operation, e);
        } catch (IOException | ScmClientException e) {
            throw new ScmUpstreamException("failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private static RuntimeException translate(String operation, ScmApiException e) {
        if (e.isAuthFailure()) {
            return new ScmReconnectRequiredException(e);
        }
        return new ScmUpstreamException("failed to " + operation + ": " + e.getMessage(), e);
    }

    private static void requireRepositoryPath(String owner, String repo) {
        if (owner == null || owner.isBlank() || repo == null || repo.isBlank()) {
            throw new InvalidScmRequestException("owner and repo are required");
        }
    }
}
