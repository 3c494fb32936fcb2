package org.tfregistry.webserver.scm.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tfregistry.scmclient.model.ScmBranch;

import java.util.List;

public record BranchListResponse(@JsonProperty("branches") List<ScmBranch> branches) {
}
