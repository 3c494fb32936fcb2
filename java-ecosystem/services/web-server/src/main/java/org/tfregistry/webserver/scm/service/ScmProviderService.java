package org.tfregistry.webserver.scm.service;

import org.tfregistry.core.model.scm.EScmProviderType;
import org.tfregistry.core.model.scm.ScmProviderConfig;
import org.tfregistry.core.persistence.repository.scm.ScmProviderConfigRepository;
import org.tfregistry.core.persistence.repository.scm.ScmUserTokenRepository;
import org.tfregistry.webserver.exception.InvalidScmRequestException;
import org.tfregistry.webserver.exception.ScmIntegrationException;
import org.tfregistry.webserver.exception.ScmResourceNotFoundException;
import org.tfregistry.webserver.scm.dto.request.CreateScmProviderRequest;
import org.tfregistry.webserver.scm.dto.request.UpdateScmProviderRequest;
import org.tfregistry.webserver.scm.dto.response.ScmProviderDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class ScmProviderService {

    private static final Logger log = LoggerFactory.getLogger(ScmProviderService.class);

    private final ScmProviderConfigRepository providerRepository;
    private final ScmUserTokenRepository tokenRepository;
    private final ScmTokenVault tokenVault;

    public ScmProviderService(
            ScmProviderConfigRepository providerRepository,
            ScmUserTokenRepository tokenRepository,
            ScmTokenVault tokenVault
    ) {
        this.providerRepository = providerRepository;
        this.tokenRepository = tokenRepository;
        this.tokenVault = tokenVault;
    }

    public ScmProviderDTO createProvider(CreateScmProviderRequest request) {
        EScmProviderType type = parseType(request.providerType());

        String clientId = trimToNull(request.clientId());
        String clientSecret = trimToNull(request.clientSecret());
        String baseUrl = trimToNull(request.baseUrl());

        if (type.isPatBased()) {
            if (baseUrl == null) {
                throw new InvalidScmRequestException("base_url is required for Bitbucket Data Center");
            }
            if (clientId == null) {
                clientId = ScmProviderConfig.PAT_CLIENT_ID;
            }
            if (clientSecret == null) {
                clientSecret = ScmProviderConfig.PAT_CLIENT_SECRET;
            }
        } else {
            if (clientId == null) {
                throw new InvalidScmRequestException("client_id is required for OAuth providers");
            }
            if (clientSecret == null) {
                throw new InvalidScmRequestException("client_secret is required for OAuth providers");
            }
        }

        ScmProviderConfig provider = new ScmProviderConfig();
        provider.setId(UUID.randomUUID());
        provider.setOrganizationId(request.organizationId());
        provider.setProviderType(type);
        provider.setName(request.name().trim());
        provider.setBaseUrl(baseUrl);
        provider.setTenantId(trimToNull(request.tenantId()));
        provider.setClientId(clientId);
        provider.setClientSecretEncrypted(tokenVault.seal(clientSecret, "client secret"));
        provider.setWebhookSecret(sealOptional(request.webhookSecret()));
        provider.setActive(true);

        ScmProviderConfig saved = save(provider);
        log.info("Created SCM provider {} ({}) for organization {}", saved.getId(), type.getId(),
                saved.getOrganizationId());
        return ScmProviderDTO.fromProvider(saved);
    }

    /**
     * @param organizationId when set, the organization's providers plus the global ones; otherwise all providers
     */
    public List<ScmProviderDTO> listProviders(UUID organizationId) {
        try {
            List<ScmProviderConfig> providers = organizationId == null
                    ? providerRepository.findAllByOrderByNameAsc()
                    : providerRepository.findVisibleToOrganization(organizationId);
            return providers.stream().map(ScmProviderDTO::fromProvider).toList();
        } catch (DataAccessException e) {
            throw new ScmIntegrationException("failed to list providers", e);
        }
    }

    public ScmProviderDTO getProvider(UUID providerId) {
        return ScmProviderDTO.fromProvider(requireProvider(providerId));
    }

    public ScmProviderDTO updateProvider(UUID providerId, UpdateScmProviderRequest request) {
        ScmProviderConfig provider = requireProvider(providerId);

        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw new InvalidScmRequestException("name cannot be empty");
            }
            provider.setName(request.name().trim());
        }
        if (request.baseUrl() != null) {
            String baseUrl = trimToNull(request.baseUrl());
            if (baseUrl == null && provider.isPatBased()) {
                throw new InvalidScmRequestException("base_url is required for Bitbucket Data Center");
            }
            provider.setBaseUrl(baseUrl);
        }
        if (request.tenantId() != null) {
            provider.setTenantId(trimToNull(request.tenantId()));
        }
        if (request.clientId() != null && !request.clientId().isBlank()) {
            provider.setClientId(request.clientId().trim());
        }
        if (request.clientSecret() != null && !request.clientSecret().isBlank()) {
            provider.setClientSecretEncrypted(tokenVault.seal(request.clientSecret().trim(), "client secret"));
        }
        if (request.webhookSecret() != null) {
            provider.setWebhookSecret(sealOptional(request.webhookSecret()));
        }
        if (request.active() != null) {
            provider.setActive(request.active());
        }

        ScmProviderConfig saved = save(provider);
        log.info("Updated SCM provider {}", saved.getId());
        return ScmProviderDTO.fromProvider(saved);
    }

    /**
     * Removes the provider and every user credential stored for it. Deleting an unknown provider succeeds.
     */
    @Transactional
    public void deleteProvider(UUID providerId) {
        try {
            int tokens = tokenRepository.deleteByProviderId(providerId);
            providerRepository.deleteById(providerId);
            log.info("Deleted SCM provider {} and {} stored token(s)", providerId, tokens);
        } catch (DataAccessException e) {
            throw new ScmIntegrationException("failed to delete provider", e);
        }
    }

    private ScmProviderConfig requireProvider(UUID providerId) {
        try {
            return providerRepository.findById(providerId)
                    .orElseThrow(() -> new ScmResourceNotFoundException("provider not found"));
        } catch (DataAccessException e) {
            throw new ScmIntegrationException("failed to load provider", e);
        }
    }

    private ScmProviderConfig save(ScmProviderConfig provider) {
        try {
            return providerRepository.save(provider);
        } catch (DataAccessException e) {
            throw new ScmIntegrationException("failed to save provider", e);
        }
    }

    private String sealOptional(String secret) {
        String value = trimToNull(secret);
        return value == null ? null : tokenVault.seal(value, "webhook secret");
    }

    private static EScmProviderType parseType(String providerType) {
        try {
            return EScmProviderType.fromId(providerType);
        } catch (IllegalArgumentException e) {
            throw new InvalidScmRequestException(e.getMessage());
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
