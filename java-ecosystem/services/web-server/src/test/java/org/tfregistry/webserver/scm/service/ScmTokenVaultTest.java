package org.tfregistry.webserver.scm.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tfregistry.core.model.scm.ScmUserToken;
import org.tfregistry.core.persistence.repository.scm.ScmUserTokenRepository;
import org.tfregistry.scmclient.model.AccessToken;
import org.tfregistry.security.oauth.TokenEncryptionService;
import org.tfregistry.webserver.exception.CredentialEncryptionException;
import org.tfregistry.webserver.exception.ScmIntegrationException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.tfregistry.webserver.scm.service.ScmTestData.NOW;
import static org.tfregistry.webserver.scm.service.ScmTestData.PROVIDER_ID;
import static org.tfregistry.webserver.scm.service.ScmTestData.USER_ID;
import static org.tfregistry.webserver.scm.service.ScmTestData.oauthToken;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScmTokenVault")
class ScmTokenVaultTest {

    @Mock
    private ScmUserTokenRepository tokenRepository;

    private TokenEncryptionService encryptionService;
    private InMemoryTokenStore store;
    private ScmTokenVault vault;

    @BeforeEach
    void setUp() {
        store = new InMemoryTokenStore(tokenRepository);
        encryptionService = ScmTestData.encryptionService();
        vault = new ScmTokenVault(tokenRepository, encryptionService);
    }

    @Nested
    @DisplayName("store()")
    class StoreTests {

        @Test
        @DisplayName("should never persist plaintext token values")
        void shouldEncryptTokens() {
            ScmUserToken row = vault.store(USER_ID, PROVIDER_ID, oauthToken("gho_access", "ghr_refresh", NOW.plusHours(8)));

            assertThat(row.getAccessTokenEncrypted()).isNotBlank().doesNotContain("gho_access");
            assertThat(row.getRefreshTokenEncrypted()).isNotBlank().doesNotContain("ghr_refresh");
            assertThat(row.getScopes()).isEqualTo("repo,read:org");
            assertThat(row.getTokenType()).isEqualTo("bearer");
        }

        @Test
        @DisplayName("should leave the refresh token empty when the provider issued none")
        void shouldStoreWithoutRefreshToken() {
            ScmUserToken row = vault.store(USER_ID, PROVIDER_ID, oauthToken("gho_access", null, null));

            assertThat(row.getRefreshTokenEncrypted()).isNull();
            assertThat(row.hasRefreshToken()).isFalse();
        }

        @Test
        @DisplayName("should keep id and creation time when the same connection is stored twice")
        void shouldUpsertOnUserAndProvider() {
            ScmUserToken first = vault.store(USER_ID, PROVIDER_ID, oauthToken("first", "r1", NOW.plusHours(1)));
            UUID firstId = first.getId();
            var firstCreatedAt = first.getCreatedAt();

            ScmUserToken second = vault.store(USER_ID, PROVIDER_ID, oauthToken("second", null, NOW.plusHours(2)));

            assertThat(store.size()).isEqualTo(1);
            assertThat(second.getId()).isEqualTo(firstId);
            assertThat(second.getCreatedAt()).isEqualTo(firstCreatedAt);
            assertThat(vault.unseal(second).accessToken()).isEqualTo("second");
            assertThat(second.hasRefreshToken()).isFalse();
        }

        @Test
        @DisplayName("should keep connections of different users apart")
        void shouldKeepUsersApart() {
            vault.store(USER_ID, PROVIDER_ID, oauthToken("mine", null, null));
            vault.store(UUID.randomUUID(), PROVIDER_ID, oauthToken("theirs", null, null));

            assertThat(store.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should wrap store failures")
        void shouldWrapStoreFailures() {
            doThrow(new DataAccessResourceFailureException("connection refused"))
                    .when(tokenRepository).save(any(ScmUserToken.class));

            assertThatThrownBy(() -> vault.store(USER_ID, PROVIDER_ID, oauthToken("a", null, null)))
                    .isInstanceOf(ScmIntegrationException.class)
                    .hasMessage("failed to store token");
        }
    }

    @Nested
    @DisplayName("unseal()")
    class UnsealTests {

        @Test
        @DisplayName("should rebuild the stored credential")
        void shouldRebuildCredential() {
            ScmUserToken row = vault.store(USER_ID, PROVIDER_ID, oauthToken("gho_access", "ghr_refresh", NOW));

            AccessToken token = vault.unseal(row);

            assertThat(token.accessToken()).isEqualTo("gho_access");
            assertThat(token.refreshToken()).isEqualTo("ghr_refresh");
            assertThat(token.expiresAt()).isEqualTo(NOW);
            assertThat(token.scopes()).containsExactly("repo", "read:org");
        }

        @Test
        @DisplayName("should fail without exposing ciphertext when the key does not match")
        void shouldFailWithForeignKey() {
            ScmUserToken row = vault.store(USER_ID, PROVIDER_ID, oauthToken("gho_access", null, null));
            ScmTokenVault otherVault = new ScmTokenVault(tokenRepository, ScmTestData.encryptionService());

            assertThatThrownBy(() -> otherVault.unseal(row))
                    .isInstanceOf(CredentialEncryptionException.class)
                    .hasMessage("failed to decrypt access token")
                    .hasMessageNotContaining(row.getAccessTokenEncrypted());
        }
    }

    @Nested
    @DisplayName("applyRenewal()")
    class ApplyRenewalTests {

        @Test
        @DisplayName("should keep the stored refresh token when none was issued")
        void shouldKeepRefreshToken() {
            ScmUserToken row = vault.store(USER_ID, PROVIDER_ID, oauthToken("old", "r1", NOW));

            vault.applyRenewal(row, new AccessToken("new", "", null, NOW.plusHours(1), List.of()));

            AccessToken stored = vault.unseal(store.get(USER_ID, PROVIDER_ID).orElseThrow());
            assertThat(stored.accessToken()).isEqualTo("new");
            assertThat(stored.refreshToken()).isEqualTo("r1");
            assertThat(stored.expiresAt()).isEqualTo(NOW.plusHours(1));
        }

        @Test
        @DisplayName("should replace a rotated refresh token")
        void shouldReplaceRotatedRefreshToken() {
            ScmUserToken row = vault.store(USER_ID, PROVIDER_ID, oauthToken("old", "r1", NOW));

            ScmUserToken renewed = vault.applyRenewal(row, new AccessToken("new", "r2", null, NOW.plusHours(1), null));

            assertThat(renewed.getId()).isEqualTo(row.getId());
            assertThat(vault.unseal(renewed).refreshToken()).isEqualTo("r2");
        }
    }

    @Test
    @DisplayName("delete() should succeed when nothing is stored")
    void deleteShouldBeIdempotent() {
        vault.delete(USER_ID, PROVIDER_ID);
        vault.delete(USER_ID, PROVIDER_ID);

        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("splitScopes() should ignore blanks")
    void splitScopesShouldIgnoreBlanks() {
        assertThat(ScmTokenVault.splitScopes(" repo, ,read:org ")).containsExactly("repo", "read:org");
        assertThat(ScmTokenVault.splitScopes(null)).isEmpty();
    }
}
