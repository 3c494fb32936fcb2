package org.tfregistry.security.service;

import java.security.Principal;
import java.util.Objects;
import java.util.UUID;

/**
 * Authenticated registry user, resolved from the subject of a request JWT.
 */
public final class UserPrincipal implements Principal {

    private final UUID userId;

    public UserPrincipal(UUID userId) {
        this.userId = Objects.requireNonNull(userId, "userId");
    }

    public UUID getUserId() {
        return userId;
    }

    @Override
    public String getName() {
        return userId.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserPrincipal other)) return false;
        return userId.equals(other.userId);
    }

    @Override
    public int hashCode() {
        return userId.hashCode();
    }

    @Override
    public String toString() {
        return "UserPrincipal{" + userId + "}";
    }
}
