package com.titan.cargo.security;

import com.titan.cargo.exception.InvalidTokenException;
import com.titan.cargo.exception.TokenExpiredException;
import com.titan.cargo.model.User;
import com.titan.cargo.model.enums.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies the HS256 session tokens. The key is derived once, at construction.
 */
@Component
public class JwtUtils {

    private static final Logger logger = LoggerFactory.getLogger(JwtUtils.class);

    private static final String TOKEN_PREFIX = "Bearer ";
    private static final String HEADER_AUTH = "Authorization";

    static final String CLAIM_USER_ID = "userId";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private final Key signingKey;
    private final long expirationMs;
    private final Clock clock;

    public JwtUtils(@Value("${jwt.secret}") String jwtSecret,
                    @Value("${jwt.expirationMs:86400000}") long expirationMs,
                    Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.expirationMs = expirationMs;
        this.clock = clock;
    }

    public String generateToken(User user) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setId(UUID.randomUUID().toString())
                .setSubject(user.getEmail())
                .claim(CLAIM_USER_ID, user.getId())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().getValue())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusMillis(expirationMs)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    public String extractToken(HttpServletRequest request) {
        String bearerToken = request.getHeader(HEADER_AUTH);
        if (bearerToken != null && bearerToken.startsWith(TOKEN_PREFIX)) {
            String token = bearerToken.substring(TOKEN_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    /**
     * Checks signature and expiry and returns the embedded identity.
     *
     * @throws TokenExpiredException when the expiry has passed
     * @throws InvalidTokenException when the signature or payload is wrong
     */
    public AuthenticatedUser verifyToken(String token) {
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (ExpiredJwtException e) {
            logger.debug("Jeton expiré: {}", e.getMessage());
            throw new TokenExpiredException("Token expired");
        } catch (JwtException | IllegalArgumentException e) {
            logger.debug("Jeton invalide: {}", e.getMessage());
            throw new InvalidTokenException("Invalid token");
        }

        String userId = claims.get(CLAIM_USER_ID, String.class);
        String email = claims.get(CLAIM_EMAIL, String.class);
        Role role = parseRole(claims.get(CLAIM_ROLE, String.class));
        if (userId == null || email == null || role == null) {
            throw new InvalidTokenException("Invalid token");
        }
        return new AuthenticatedUser(userId, email, role);
    }

    private Role parseRole(String raw) {
        for (Role role : Role.values()) {
            if (role.getValue().equals(raw)) {
                return role;
            }
        }
        return null;
    }
}
