package org.tfregistry.webserver.scm.controller;

import jakarta.validation.Valid;
import org.tfregistry.webserver.generic.dto.message.MessageResponse;
import org.tfregistry.webserver.scm.dto.request.CreateScmProviderRequest;
import org.tfregistry.webserver.scm.dto.request.UpdateScmProviderRequest;
import org.tfregistry.webserver.scm.dto.response.ScmProviderDTO;
import org.tfregistry.webserver.scm.service.ScmProviderService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

import static org.tfregistry.webserver.scm.controller.ScmRequestSupport.parseProviderId;

/**
 * Registry administrators manage the SCM providers users can connect to.
 */
@CrossOrigin(origins = "*", maxAge = 3600)
@RestController
@RequestMapping("/api/v1/scm-providers")
public class ScmProviderController {

    private final ScmProviderService providerService;

    public ScmProviderController(ScmProviderService providerService) {
        this.providerService = providerService;
    }

    @PostMapping
    public ResponseEntity<ScmProviderDTO> createProvider(@Valid @RequestBody CreateScmProviderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(providerService.createProvider(request));
    }

    @GetMapping
    public ResponseEntity<List<ScmProviderDTO>> listProviders(
            @RequestParam(name = "organization_id", required = false) UUID organizationId
    ) {
        return ResponseEntity.ok(providerService.listProviders(organizationId));
    }

    @GetMapping("/{providerId}")
    public ResponseEntity<ScmProviderDTO> getProvider(@PathVariable String providerId) {
        return ResponseEntity.ok(providerService.getProvider(parseProviderId(providerId)));
    }

    @PutMapping("/{providerId}")
    public ResponseEntity<ScmProviderDTO> updateProvider(
            @PathVariable String providerId,
            @RequestBody UpdateScmProviderRequest request
    ) {
        return ResponseEntity.ok(providerService.updateProvider(parseProviderId(providerId), request));
    }

    @DeleteMapping("/{providerId}")
    public ResponseEntity<MessageResponse> deleteProvider(@PathVariable String providerId) {
        providerService.deleteProvider(parseProviderId(providerId));
        return ResponseEntity.ok(new MessageResponse("provider deleted"));
    }
}
