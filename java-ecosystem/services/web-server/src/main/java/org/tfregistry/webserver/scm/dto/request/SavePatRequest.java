package org.tfregistry.webserver.scm.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record SavePatRequest(
        @JsonProperty("access_token")
        @NotBlank(message = "access_token is required")
        String accessToken
) {
    @Override
    public String toString() {
        return "SavePatRequest{accessToken=***}";
    }
}
