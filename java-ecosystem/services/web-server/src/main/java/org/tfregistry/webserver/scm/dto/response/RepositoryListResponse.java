package org.tfregistry.webserver.scm.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tfregistry.scmclient.model.ScmRepository;

import java.util.List;

public record RepositoryListResponse(@JsonProperty("repositories") List<ScmRepository> repositories) {
}
