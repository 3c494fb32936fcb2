package org.tfregistry.webserver.scm.controller;

import jakarta.validation.Valid;
import org.tfregistry.security.service.UserPrincipal;
import org.tfregistry.webserver.generic.dto.message.MessageResponse;
import org.tfregistry.webserver.scm.dto.request.SavePatRequest;
import org.tfregistry.webserver.scm.dto.response.AuthorizeResponse;
import org.tfregistry.webserver.scm.dto.response.TokenRefreshResponse;
import org.tfregistry.webserver.scm.dto.response.TokenStatusResponse;
import org.tfregistry.webserver.scm.service.ScmCredentialService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.UUID;

import static org.tfregistry.webserver.scm.controller.ScmRequestSupport.parseProviderId;
import static org.tfregistry.webserver.scm.controller.ScmRequestSupport.requireUserId;

/**
 * Connects the current user to an SCM provider, through OAuth or a Personal Access Token.
 */
@CrossOrigin(origins = "*", maxAge = 3600)
@RestController
@RequestMapping("/api/v1/scm-providers/{providerId}")
public class ScmOAuthController {

    private final ScmCredentialService credentialService;

    public ScmOAuthController(ScmCredentialService credentialService) {
        this.credentialService = credentialService;
    }

    /**
     * GET /api/v1/scm-providers/{providerId}/oauth/authorize
     */
    @GetMapping("/oauth/authorize")
    public ResponseEntity<AuthorizeResponse> authorize(
            @PathVariable String providerId,
            @AuthenticationPrincipal UserPrincipal principal
    ) {
        UUID id = parseProviderId(providerId);
        UUID userId = requireUserId(principal);
        return ResponseEntity.ok(credentialService.authorize(id, userId));
    }

    /**
     * Reached by the browser when the provider redirects back. The user is identified by {@code state} only.
     * <p>
     * GET /api/v1/scm-providers/{providerId}/oauth/callback
     */
    @GetMapping("/oauth/callback")
    public ResponseEntity<Void> callback(
            @PathVariable String providerId,
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error
    ) {
        UUID id = parseProviderId(providerId);
        String redirectUrl = credentialService.completeAuthorization(id, code, state, error);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(redirectUrl))
                .build();
    }

    @DeleteMapping("/oauth/token")
    public ResponseEntity<MessageResponse> revoke(
            @PathVariable String providerId,
            @AuthenticationPrincipal UserPrincipal principal
    ) {
        UUID id = parseProviderId(providerId);
        credentialService.revoke(id, requireUserId(principal));
        return ResponseEntity.ok(new MessageResponse("OAuth token revoked"));
    }

    @GetMapping("/oauth/token")
    public ResponseEntity<TokenStatusResponse> status(
            @PathVariable String providerId,
            @AuthenticationPrincipal UserPrincipal principal
    ) {
        UUID id = parseProviderId(providerId);
        return ResponseEntity.ok(credentialService.status(id, requireUserId(principal)));
    }

    @PostMapping("/oauth/refresh")
    public ResponseEntity<TokenRefreshResponse> refresh(
            @PathVariable String providerId,
            @AuthenticationPrincipal UserPrincipal principal
    ) {
        UUID id = parseProviderId(providerId);
        return ResponseEntity.ok(credentialService.refresh(id, requireUserId(principal)));
    }

    /**
     * Save a Personal Access Token for a PAT-based provider.
     * <p>
     * POST /api/v1/scm-providers/{providerId}/token
     */
    @PostMapping("/token")
    public ResponseEntity<MessageResponse> savePersonalAccessToken(
            @PathVariable String providerId,
            @AuthenticationPrincipal UserPrincipal principal,
            @Valid @RequestBody SavePatRequest request
    ) {
        UUID id = parseProviderId(providerId);
        credentialService.savePersonalAccessToken(id, requireUserId(principal), request.accessToken());
        return ResponseEntity.ok(new MessageResponse("Personal Access Token saved successfully"));
    }
}
