package org.tfregistry.scmclient.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScmBranch(
        @JsonProperty("name") String name,
        @JsonProperty("commit_sha") String commitSha,
        @JsonProperty("protected") boolean isProtected,
        @JsonProperty("default") boolean isDefault
) {
}
