package org.tfregistry.webserver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for SCM credential handling.
 */
@Component
@ConfigurationProperties(prefix = "tfregistry.scm")
public class ScmProperties {

    /**
     * A stored credential is renewed before a read when it expires within this window.
     * Applies to repository, tag and branch reads alike.
     */
    private Duration renewalWindow = Duration.ofSeconds(60);

    /**
     * Scope recorded for Personal Access Tokens.
     */
    private String patScope = "repo";

    public Duration getRenewalWindow() {
        return renewalWindow;
    }

    public void setRenewalWindow(Duration renewalWindow) {
        this.renewalWindow = renewalWindow;
    }

    public String getPatScope() {
        return patScope;
    }

    public void setPatScope(String patScope) {
        this.patScope = patScope;
    }
}
