package org.tfregistry.webserver.scm.service;

import org.tfregistry.core.model.scm.ScmProviderConfig;
import org.tfregistry.core.persistence.repository.scm.ScmProviderConfigRepository;
import org.tfregistry.scmclient.ConnectorSettings;
import org.tfregistry.scmclient.ScmClientException;
import org.tfregistry.scmclient.ScmConnector;
import org.tfregistry.scmclient.ScmConnectorFactory;
import org.tfregistry.webserver.config.RegistryServerProperties;
import org.tfregistry.webserver.exception.ScmIntegrationException;
import org.tfregistry.webserver.exception.ScmResourceNotFoundException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Loads provider configurations and turns them into connectors.
 */
@Component
public class ScmConnectorResolver {

    private final ScmProviderConfigRepository providerRepository;
    private final ScmConnectorFactory connectorFactory;
    private final ScmTokenVault tokenVault;
    private final RegistryServerProperties serverProperties;

    public ScmConnectorResolver(
            ScmProviderConfigRepository providerRepository,
            ScmConnectorFactory connectorFactory,
            ScmTokenVault tokenVault,
            RegistryServerProperties serverProperties
    ) {
        this.providerRepository = providerRepository;
        this.connectorFactory = connectorFactory;
        this.tokenVault = tokenVault;
        this.serverProperties = serverProperties;
    }

    /**
     * @throws ScmResourceNotFoundException when no provider has this id
     */
    public ScmProviderConfig requireProvider(UUID providerId) {
        try {
            return providerRepository.findById(providerId)
                    .orElseThrow(() -> new ScmResourceNotFoundException("provider not found"));
        } catch (DataAccessException e) {
            throw new ScmIntegrationException("failed to load provider", e);
        }
    }

    /**
     * Build a connector for the provider. The OAuth client secret is only opened for OAuth-based providers.
     */
    public ScmConnector connectorFor(ScmProviderConfig provider) {
        String clientSecret = provider.isPatBased()
                ? null
                : tokenVault.open(provider.getClientSecretEncrypted(), "client secret");

        ConnectorSettings settings = new ConnectorSettings(
                provider.getProviderType(),
                provider.getBaseUrl(),
                provider.getClientId(),
                clientSecret,
                serverProperties.oauthCallbackUrl(provider.getId()),
                provider.getTenantId()
        );
        try {
            return connectorFactory.create(settings);
        } catch (ScmClientException e) {
            throw new ScmIntegrationException("failed to create connector: " + e.getMessage(), e);
        }
    }
}
