package org.tfregistry.scmclient.model;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AccessTokenTest {

    private static final OffsetDateTime OLD_EXPIRY = OffsetDateTime.of(2026, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime NEW_EXPIRY = OLD_EXPIRY.plusHours(8);

    private final AccessToken stored = new AccessToken("old-access", "old-refresh", "bearer", OLD_EXPIRY, List.of("repo"));

    @Test
    void renewedWith_keepsStoredRefreshTokenWhenNoneIssued() {
        AccessToken renewed = stored.renewedWith(new AccessToken("new-access", "", null, NEW_EXPIRY, null));

        assertThat(renewed.accessToken()).isEqualTo("new-access");
        assertThat(renewed.refreshToken()).isEqualTo("old-refresh");
        assertThat(renewed.tokenType()).isEqualTo("bearer");
        assertThat(renewed.expiresAt()).isEqualTo(NEW_EXPIRY);
        assertThat(renewed.scopes()).containsExactly("repo");
    }

    @Test
    void renewedWith_adoptsRotatedRefreshToken() {
        AccessToken renewed = stored.renewedWith(new AccessToken("new-access", "new-refresh", "bearer", NEW_EXPIRY, List.of("read_api")));

        assertThat(renewed.refreshToken()).isEqualTo("new-refresh");
        assertThat(renewed.scopes()).containsExactly("read_api");
    }

    @Test
    void toString_redactsTokenValues() {
        assertThat(stored.toString()).doesNotContain("old-access").doesNotContain("old-refresh");
    }
}
