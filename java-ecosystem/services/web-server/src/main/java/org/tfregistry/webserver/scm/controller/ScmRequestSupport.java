package org.tfregistry.webserver.scm.controller;

import org.tfregistry.security.service.UserPrincipal;
import org.tfregistry.webserver.exception.InvalidScmRequestException;
import org.tfregistry.webserver.exception.UnauthenticatedException;

import java.util.UUID;

final class ScmRequestSupport {

    private ScmRequestSupport() {
    }

    static UUID parseProviderId(String providerId) {
        try {
            return UUID.fromString(providerId);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidScmRequestException("invalid provider ID");
        }
    }

    static UUID requireUserId(UserPrincipal principal) {
        if (principal == null) {
            throw new UnauthenticatedException("user not authenticated");
        }
        return principal.getUserId();
    }
}
