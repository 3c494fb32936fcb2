package org.tfregistry.scmclient;

import org.tfregistry.core.model.scm.EScmProviderType;

/**
 * Everything a connector needs to talk to one configured provider instance.
 *
 * @param instanceBaseUrl null for the provider's public cloud endpoint
 * @param clientSecret    plaintext OAuth client secret
 * @param tenantId        directory tenant, used by Azure DevOps with Entra ID
 */
public record ConnectorSettings(
        EScmProviderType providerType,
        String instanceBaseUrl,
        String clientId,
        String clientSecret,
        String callbackUrl,
        String tenantId
) {

    /**
     * PAT-based providers need no OAuth credentials. OAuth providers need a client ID, a secret and a callback URL.
     *
     * @throws ScmClientException naming the first missing setting
     */
    public void validate() {
        if (providerType == null) {
            throw new ScmClientException("invalid SCM provider type");
        }
        if (providerType.isPatBased()) {
            return;
        }
        if (isBlank(clientId)) {
            throw new ScmClientException("missing OAuth client ID");
        }
        if (isBlank(clientSecret)) {
            throw new ScmClientException("missing OAuth client secret");
        }
        if (isBlank(callbackUrl)) {
            throw new ScmClientException("missing OAuth redirect URL");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        return "ConnectorSettings{providerType=" + providerType + ", instanceBaseUrl=" + instanceBaseUrl
                + ", clientId=" + clientId + ", callbackUrl=" + callbackUrl + ", tenantId=" + tenantId + "}";
    }
}
