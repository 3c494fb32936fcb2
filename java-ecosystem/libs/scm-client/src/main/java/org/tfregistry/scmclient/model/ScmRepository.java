package org.tfregistry.scmclient.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A repository as seen through an SCM provider.
 */
public record ScmRepository(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("full_name") String fullName,
        @JsonProperty("owner") String owner,
        @JsonProperty("description") String description,
        @JsonProperty("default_branch") String defaultBranch,
        @JsonProperty("clone_url") String cloneUrl,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("private") boolean isPrivate
) {
}
