package org.tfregistry.webserver.scm.service;

import org.tfregistry.core.model.scm.ScmUserToken;
import org.tfregistry.scmclient.model.AccessToken;

/**
 * A stored token row paired with its plaintext credential for the duration of one request.
 * Renewals replace both so a retry uses the fresh credential without reading storage again.
 */
final class LiveCredential {

    private ScmUserToken record;
    private AccessToken token;
    private String sealedAccessToken;

    LiveCredential(ScmUserToken record, AccessToken token) {
        replace(record, token);
    }

    ScmUserToken record() {
        return record;
    }

    AccessToken token() {
        return token;
    }

    /**
     * The ciphertext this request last saw, compared against storage to detect a renewal made elsewhere.
     */
    String sealedAccessToken() {
        return sealedAccessToken;
    }

    void replace(ScmUserToken record, AccessToken token) {
        this.record = record;
        this.token = token;
        this.sealedAccessToken = record.getAccessTokenEncrypted();
    }
}
