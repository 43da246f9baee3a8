package com.titan.cargo.security;

import com.titan.cargo.exception.InvalidTokenException;
import com.titan.cargo.exception.TokenExpiredException;
import com.titan.cargo.model.User;
import com.titan.cargo.model.enums.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class JwtUtilsTest {

    private static final String SECRET = "test_secret_key_for_titan_cargo_tokens_0123456789";
    private static final long ONE_DAY_MS = 86_400_000L;

    private MutableClock clock;
    private JwtUtils jwtUtils;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-04-04T12:00:00Z"));
        jwtUtils = new JwtUtils(SECRET, ONE_DAY_MS, clock);
    }

    @Test
    void verifyTokenReturnsEmbeddedIdentity() {
        String token = jwtUtils.generateToken(user("u-42", "ada@titan.test", Role.PILOT));

        AuthenticatedUser caller = jwtUtils.verifyToken(token);

        assertEquals("u-42", caller.userId());
        assertEquals("ada@titan.test", caller.email());
        assertEquals(Role.PILOT, caller.role());
        assertFalse(caller.isAdmin());
    }

    @Test
    void tokenIsStillValidJustBeforeExpiry() {
        String token = jwtUtils.generateToken(user("u-1", "a@titan.test", Role.ADMIN));

        clock.advance(Duration.ofHours(23).plusMinutes(59));

        assertTrue(jwtUtils.verifyToken(token).isAdmin());
    }

    @Test
    void tokenIsRejectedAfterExpiry() {
        String token = jwtUtils.generateToken(user("u-1", "a@titan.test", Role.USER));

        clock.advance(Duration.ofHours(24).plusMinutes(1));

        assertThrows(TokenExpiredException.class, () -> jwtUtils.verifyToken(token));
    }

    @Test
    void tamperedTokenIsRejected() {
        String[] token = jwtUtils.generateToken(user("u-1", "a@titan.test", Role.USER)).split("\\.");
        String[] other = jwtUtils.generateToken(user("u-2", "b@titan.test", Role.ADMIN)).split("\\.");
        // admin payload under the user's signature
        String tampered = token[0] + "." + other[1] + "." + token[2];

        assertThrows(InvalidTokenException.class, () -> jwtUtils.verifyToken(tampered));
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        JwtUtils other = new JwtUtils("another_secret_key_which_is_long_enough_for_hs256", ONE_DAY_MS, clock);
        String token = other.generateToken(user("u-1", "a@titan.test", Role.ADMIN));

        assertThrows(InvalidTokenException.class, () -> jwtUtils.verifyToken(token));
    }

    @Test
    void garbageIsRejected() {
        assertThrows(InvalidTokenException.class, () -> jwtUtils.verifyToken("not-a-token"));
    }

    @Test
    void tokensIssuedInTheSameSecondDiffer() {
        User user = user("u-1", "a@titan.test", Role.USER);

        assertNotEquals(jwtUtils.generateToken(user), jwtUtils.generateToken(user));
    }

    @Test
    void extractTokenReadsBearerHeaderOnly() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        assertNull(jwtUtils.extractToken(request));

        request.addHeader("Authorization", "Basic abc");
        assertNull(jwtUtils.extractToken(request));

        MockHttpServletRequest bearer = new MockHttpServletRequest();
        bearer.addHeader("Authorization", "Bearer abc.def.ghi");
        assertEquals("abc.def.ghi", jwtUtils.extractToken(bearer));
    }

    private static User user(String id, String email, Role role) {
        User user = new User();
        user.setId(id);
        user.setEmail(email);
        user.setName("Test");
        user.setRole(role);
        return user;
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
