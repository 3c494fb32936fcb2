package org.tfregistry.webserver.scm.service;

import org.tfregistry.webserver.exception.InvalidScmRequestException;

import java.util.UUID;

/**
 * The OAuth {@code state} value {@code "{userId}:{providerId}"}. It carries the user through the provider
 * redirect so no server-side session is needed between authorize and callback.
 */
public record OAuthState(UUID userId, UUID providerId) {

    private static final String SEPARATOR = ":";

    public String encode() {
        return userId + SEPARATOR + providerId;
    }

    /**
     * Split on the first separator. Both halves must be identifiers.
     */
    public static OAuthState parse(String state) {
        if (state == null || state.isEmpty()) {
            throw new InvalidScmRequestException("invalid state parameter");
        }
        int separator = state.indexOf(SEPARATOR);
        if (separator <= 0 || separator == state.length() - 1) {
            throw new InvalidScmRequestException("invalid state parameter");
        }

        UUID userId = parseId(state.substring(0, separator), "invalid user ID in state");
        UUID providerId = parseId(state.substring(separator + 1), "invalid provider ID in state");
        return new OAuthState(userId, providerId);
    }

    private static UUID parseId(String value, String error) {
        try {
            UUID id = UUID.fromString(value);
            if (!id.toString().equalsIgnoreCase(value)) {
                throw new InvalidScmRequestException(error);
            }
            return id;
        } catch (IllegalArgumentException e) {
            throw new InvalidScmRequestException(error);
        }
    }
}
