package org.tfregistry.webserver.scm.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Either an OAuth redirect target with its state, or guidance to submit a Personal Access Token instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizeResponse(
        @JsonProperty("authorization_url") String authorizationUrl,
        @JsonProperty("state") String state,
        @JsonProperty("auth_method") String authMethod,
        @JsonProperty("message") String message
) {
    static final String PAT_GUIDANCE = "This provider requires a Personal Access Token. "
            + "Use POST /api/v1/scm-providers/:id/token to save your PAT.";

    public static AuthorizeResponse oauth(String authorizationUrl, String state) {
        return new AuthorizeResponse(authorizationUrl, state, null, null);
    }

    public static AuthorizeResponse patGuidance() {
        return new AuthorizeResponse(null, null, "pat", PAT_GUIDANCE);
    }
}
