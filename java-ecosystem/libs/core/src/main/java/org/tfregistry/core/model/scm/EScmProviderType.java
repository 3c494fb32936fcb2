package org.tfregistry.core.model.scm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Supported SCM hosting providers, each tagged with the way users authenticate against it.
 * Bitbucket Data Center instances are self-hosted and only accept Personal Access Tokens.
 */
public enum EScmProviderType {
    GITHUB("github", EScmAuthMethod.OAUTH),
    GITLAB("gitlab", EScmAuthMethod.OAUTH),
    AZURE_DEVOPS("azuredevops", EScmAuthMethod.OAUTH),
    BITBUCKET_CLOUD("bitbucket_cloud", EScmAuthMethod.OAUTH),
    BITBUCKET_DC("bitbucket_dc", EScmAuthMethod.PAT);

    private final String id;
    private final EScmAuthMethod authMethod;

    EScmProviderType(String id, EScmAuthMethod authMethod) {
        this.id = id;
        this.authMethod = authMethod;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public EScmAuthMethod getAuthMethod() {
        return authMethod;
    }

    public boolean isPatBased() {
        return authMethod == EScmAuthMethod.PAT;
    }

    @JsonCreator
    public static EScmProviderType fromId(String providerType) {
        if (providerType == null || providerType.isBlank()) {
            throw new IllegalArgumentException("Provider type cannot be empty");
        }

        String normalized = providerType.trim().toLowerCase(Locale.ENGLISH).replace('-', '_');
        for (EScmProviderType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }

        try {
            return valueOf(normalized.toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown SCM provider type: " + providerType);
        }
    }
}
