package org.tfregistry.scmclient.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScmTag(
        @JsonProperty("name") String name,
        @JsonProperty("commit_sha") String commitSha,
        @JsonProperty("commit_message") String commitMessage,
        @JsonProperty("tagger") String tagger,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
}
