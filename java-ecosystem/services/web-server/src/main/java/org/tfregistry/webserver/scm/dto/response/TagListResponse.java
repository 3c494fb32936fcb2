package org.tfregistry.webserver.scm.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tfregistry.scmclient.model.ScmTag;

import java.util.List;

public record TagListResponse(@JsonProperty("tags") List<ScmTag> tags) {
}
