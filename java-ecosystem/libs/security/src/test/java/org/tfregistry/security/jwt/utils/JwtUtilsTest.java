package org.tfregistry.security.jwt.utils;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Base64;
import java.util.Date;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtUtils")
class JwtUtilsTest {

    private static final String TEST_SECRET = Base64.getEncoder().encodeToString(
            "registry-test-signing-key-with-at-least-32-bytes".getBytes());

    private JwtUtils jwtUtils;

    @BeforeEach
    void setUp() {
        jwtUtils = new JwtUtils();
        ReflectionTestUtils.setField(jwtUtils, "jwtSecret", TEST_SECRET);
    }

    @Test
    @DisplayName("should read the user id from the subject of a valid token")
    void shouldReadUserIdFromSubject() {
        UUID userId = UUID.randomUUID();

        String token = Jwts.builder()
                .setSubject(userId.toString())
                .setIssuedAt(new Date())
                .setExpiration(new Date(System.currentTimeMillis() + 3_600_000L))
                .signWith(Keys.hmacShaKeyFor(Decoders.BASE64.decode(TEST_SECRET)), SignatureAlgorithm.HS256)
                .compact();

        assertThat(jwtUtils.validateJwtToken(token)).isTrue();
        assertThat(jwtUtils.getUserIdFromJwtToken(token)).isEqualTo(userId);
    }

    @Test
    @DisplayName("should reject garbage and empty tokens")
    void shouldRejectGarbage() {
        assertThat(jwtUtils.validateJwtToken("not.a.jwt")).isFalse();
        assertThat(jwtUtils.validateJwtToken("")).isFalse();
    }

    @Test
    @DisplayName("should reject expired tokens")
    void shouldRejectExpired() {
        String expired = Jwts.builder()
                .setSubject(UUID.randomUUID().toString())
                .setIssuedAt(new Date(System.currentTimeMillis() - 7_200_000L))
                .setExpiration(new Date(System.currentTimeMillis() - 3_600_000L))
                .signWith(Keys.hmacShaKeyFor(Decoders.BASE64.decode(TEST_SECRET)), SignatureAlgorithm.HS256)
                .compact();

        assertThat(jwtUtils.validateJwtToken(expired)).isFalse();
    }

    @Test
    @DisplayName("should reject tokens signed with another key")
    void shouldRejectForeignSignature() {
        String otherSecret = Base64.getEncoder().encodeToString(
                "a-completely-different-signing-key-of-32-bytes".getBytes());
        String foreign = Jwts.builder()
                .setSubject(UUID.randomUUID().toString())
                .setExpiration(new Date(System.currentTimeMillis() + 60_000L))
                .signWith(Keys.hmacShaKeyFor(Decoders.BASE64.decode(otherSecret)), SignatureAlgorithm.HS256)
                .compact();

        assertThat(jwtUtils.validateJwtToken(foreign)).isFalse();
    }

    @Test
    @DisplayName("should refuse a subject that is not a user id")
    void shouldRefuseNonUuidSubject() {
        String token = Jwts.builder()
                .setSubject("admin")
                .setExpiration(new Date(System.currentTimeMillis() + 60_000L))
                .signWith(Keys.hmacShaKeyFor(Decoders.BASE64.decode(TEST_SECRET)), SignatureAlgorithm.HS256)
                .compact();

        assertThat(jwtUtils.validateJwtToken(token)).isTrue();
        assertThatThrownBy(() -> jwtUtils.getUserIdFromJwtToken(token))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
