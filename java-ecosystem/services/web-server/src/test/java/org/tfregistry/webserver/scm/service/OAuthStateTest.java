package org.tfregistry.webserver.scm.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.tfregistry.webserver.exception.InvalidScmRequestException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OAuthState")
class OAuthStateTest {

    private static final UUID USER = UUID.fromString("0b7c5a4e-3f0d-4c59-9b7e-2d1f6a8c9e01");
    private static final UUID PROVIDER = UUID.fromString("5e2d8f1a-7c3b-4a6e-8d9f-1b2c3d4e5f60");

    @Test
    @DisplayName("should encode as user and provider joined by a colon")
    void shouldEncode() {
        assertThat(new OAuthState(USER, PROVIDER).encode()).isEqualTo(USER + ":" + PROVIDER);
    }

    @Test
    @DisplayName("should recover both identifiers from an encoded state")
    void shouldParseEncodedState() {
        for (int i = 0; i < 20; i++) {
            OAuthState state = new OAuthState(UUID.randomUUID(), UUID.randomUUID());
            assertThat(OAuthState.parse(state.encode())).isEqualTo(state);
        }
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"no-separator", ":5e2d8f1a-7c3b-4a6e-8d9f-1b2c3d4e5f60", "0b7c5a4e-3f0d-4c59-9b7e-2d1f6a8c9e01:"})
    @DisplayName("should reject a state without two non-empty parts")
    void shouldRejectMalformedState(String state) {
        assertThatThrownBy(() -> OAuthState.parse(state))
                .isInstanceOf(InvalidScmRequestException.class)
                .hasMessage("invalid state parameter");
    }

    @Test
    @DisplayName("should reject a user part that is not an identifier")
    void shouldRejectInvalidUser() {
        assertThatThrownBy(() -> OAuthState.parse("alice:" + PROVIDER))
                .isInstanceOf(InvalidScmRequestException.class)
                .hasMessage("invalid user ID in state");
    }

    @Test
    @DisplayName("should reject extra separators in the provider part")
    void shouldRejectExtraSeparator() {
        assertThatThrownBy(() -> OAuthState.parse(USER + ":" + PROVIDER + ":extra"))
                .isInstanceOf(InvalidScmRequestException.class)
                .hasMessage("invalid provider ID in state");
    }
}
