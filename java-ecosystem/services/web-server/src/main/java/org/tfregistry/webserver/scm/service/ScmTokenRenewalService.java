package org.tfregistry.webserver.scm.service;

import org.tfregistry.core.model.scm.ScmUserToken;
import org.tfregistry.scmclient.ScmConnector;
import org.tfregistry.scmclient.model.AccessToken;
import org.tfregistry.webserver.config.ScmProperties;
import org.tfregistry.webserver.exception.InvalidScmRequestException;
import org.tfregistry.webserver.exception.ScmResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Renews stored credentials through their connector and persists the result.
 * <p>
 * Renewals for the same (user, provider) run one at a time in this process. A caller that waited
 * for another renewal re-reads the row and adopts the newer credential instead of renewing again.
 */
@Service
public class ScmTokenRenewalService {

    private static final Logger log = LoggerFactory.getLogger(ScmTokenRenewalService.class);

    private final ScmTokenVault tokenVault;
    private final ScmProperties scmProperties;
    private final Clock clock;
    private final ConcurrentMap<String, RenewalGate> renewalGates = new ConcurrentHashMap<>();

    public ScmTokenRenewalService(ScmTokenVault tokenVault, ScmProperties scmProperties, Clock clock) {
        this.tokenVault = tokenVault;
        this.scmProperties = scmProperties;
        this.clock = clock;
    }

    /**
     * True when a refresh token is stored and the credential expires within the renewal window (or already has).
     */
    public boolean isDueForRenewal(AccessToken token) {
        if (!token.hasRefreshToken() || token.expiresAt() == null) {
            return false;
        }
        OffsetDateTime renewFrom = token.expiresAt().minus(scmProperties.getRenewalWindow());
        return !OffsetDateTime.now(clock).isBefore(renewFrom);
    }

    /**
     * Renew unless a concurrent request already did, in which case its credential is adopted.
     */
    AccessToken renew(ScmConnector connector, LiveCredential credential) throws IOException {
        return renewSerialized(connector, credential, true);
    }

    /**
     * Always ask the provider for a new credential.
     */
    AccessToken renewNow(ScmConnector connector, LiveCredential credential) throws IOException {
        return renewSerialized(connector, credential, false);
    }

    private AccessToken renewSerialized(ScmConnector connector, LiveCredential credential, boolean adoptConcurrent)
            throws IOException {
        ScmUserToken seen = credential.record();
        String key = seen.getUserId() + ":" + seen.getProviderId();
        RenewalGate gate = enter(key);
        gate.lock.lock();
        try {
            ScmUserToken latest = tokenVault.find(seen.getUserId(), seen.getProviderId())
                    .orElseThrow(() -> new ScmResourceNotFoundException("OAuth token not found"));
            AccessToken current = tokenVault.unseal(latest);

            if (adoptConcurrent && !Objects.equals(latest.getAccessTokenEncrypted(), credential.sealedAccessToken())) {
                log.info("Adopting credential renewed concurrently for user {} on provider {}",
                        latest.getUserId(), latest.getProviderId());
                credential.replace(latest, current);
                return current;
            }
            if (!current.hasRefreshToken()) {
                throw new InvalidScmRequestException("no refresh token available for this connection");
            }

            AccessToken issued = connector.renewToken(current.refreshToken());
            AccessToken renewed = current.renewedWith(issued);
            ScmUserToken saved = tokenVault.applyRenewal(latest, issued);
            credential.replace(saved, renewed);

            log.info("Renewed SCM credential for user {} on provider {}, expires at {}",
                    saved.getUserId(), saved.getProviderId(), renewed.expiresAt());
            return renewed;
        } finally {
            gate.lock.unlock();
            leave(key);
        }
    }

    /** Number of (user, provider) keys with a renewal in flight or waiting. */
    int activeRenewalGates() {
        return renewalGates.size();
    }

    private RenewalGate enter(String key) {
        return renewalGates.compute(key, (k, existing) -> {
            RenewalGate gate = existing == null ? new RenewalGate() : existing;
            gate.holders++;
            return gate;
        });
    }

    // the last holder out removes the entry so the map only holds keys under renewal
    private void leave(String key) {
        renewalGates.computeIfPresent(key, (k, gate) -> --gate.holders == 0 ? null : gate);
    }

    private static final class RenewalGate {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's compute for this key
        private int holders;
    }
}
