package org.tfregistry.webserver.scm.controller;

import org.tfregistry.security.service.UserPrincipal;
import org.tfregistry.webserver.scm.dto.response.BranchListResponse;
import org.tfregistry.webserver.scm.dto.response.RepositoryListResponse;
import org.tfregistry.webserver.scm.dto.response.TagListResponse;
import org.tfregistry.webserver.scm.service.ScmRepositoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;
import static org.tfregistry.webserver.scm.controller.ScmRequestSupport.parseProviderId;
import static org.tfregistry.webserver.scm.controller.ScmRequestSupport.requireUserId;

/**
 * Browses repositories, tags and branches with the current user's stored credential.
 */
@CrossOrigin(origins = "*", maxAge = 3600)
@RestController
@RequestMapping(path = "/api/v1/scm-providers/{providerId}/repositories", produces = APPLICATION_JSON_VALUE)
public class ScmRepositoryController {

    private final ScmRepositoryService repositoryService;

    public ScmRepositoryController(ScmRepositoryService repositoryService) {
        this.repositoryService = repositoryService;
    }

    /**
     * @param search optional repository name filter
     */
    @GetMapping
    public ResponseEntity<RepositoryListResponse> listRepositories(
            @PathVariable String providerId,
            @RequestParam(required = false) String search,
            @AuthenticationPrincipal UserPrincipal principal
    ) {
        UUID id = parseProviderId(providerId);
        UUID userId = requireUserId(principal);
        return ResponseEntity.ok(new RepositoryListResponse(repositoryService.listRepositories(id, userId, search)));
    }

    @GetMapping("/{owner}/{repo}/tags")
    public ResponseEntity<TagListResponse> listTags(
            @PathVariable String providerId,
            @PathVariable String owner,
            @PathVariable String repo,
            @AuthenticationPrincipal UserPrincipal principal
    ) {
        UUID id = parseProviderId(providerId);
        UUID userId = requireUserId(principal);
        return ResponseEntity.ok(new TagListResponse(repositoryService.listTags(id, userId, owner, repo)));
    }

    @GetMapping("/{owner}/{repo}/branches")
    public ResponseEntity<BranchListResponse> listBranches(
            @PathVariable String providerId,
            @PathVariable String owner,
            @PathVariable String repo,
            @AuthenticationPrincipal UserPrincipal principal
    ) {
        UUID id = parseProviderId(providerId);
        UUID userId = requireUserId(principal);
        return ResponseEntity.ok(new BranchListResponse(repositoryService.listBranches(id, userId, owner, repo)));
    }
}
