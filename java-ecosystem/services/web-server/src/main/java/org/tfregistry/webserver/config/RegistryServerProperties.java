package org.tfregistry.webserver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Public address of this registry, used for URLs handed to browsers and SCM providers.
 */
@Component
@ConfigurationProperties(prefix = "tfregistry.server")
public class RegistryServerProperties {

    private String baseUrl = "http://localhost:8080";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * Must be identical at authorize and callback time, providers compare it against the registered redirect URI.
     */
    public String oauthCallbackUrl(UUID providerId) {
        return trimmedBaseUrl() + "/api/v1/scm-providers/" + providerId + "/oauth/callback";
    }

    public String connectedPageUrl(UUID providerId) {
        return trimmedBaseUrl() + "/admin/scm-providers/" + providerId + "/connected";
    }

    private String trimmedBaseUrl() {
        String url = baseUrl == null ? "" : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
