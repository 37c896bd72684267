package dev.blog.platform.security;

import dev.blog.platform.exception.JwtTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HMAC-signed, time-bounded identity tokens.
 * Stateless: there is no revocation, a token stays valid until it expires.
 */
public class JwtService {

    static final String USER_ID_CLAIM = "user_id";
    static final String USERNAME_CLAIM = "username";

    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final Duration ttl;
    private final Clock clock;
    private final JwtParser parser;

    public JwtService(String secret, Duration ttl, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("JWT ttl must be positive");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = ttl;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Sign a token for the given user, valid for the configured TTL from now
     */
    public String generateToken(long userId, String username) {
        Instant now = clock.instant();
        Instant exp = now.plus(ttl);
        try {
            return Jwts.builder()
                    .setSubject(String.valueOf(userId))
                    .claim(USER_ID_CLAIM, userId)
                    .claim(USERNAME_CLAIM, username)
                    .setIssuedAt(Date.from(now))
                    .setExpiration(Date.from(exp))
                    .signWith(key, SignatureAlgorithm.HS256)
                    .compact();
        } catch (JwtException e) {
            throw new JwtTokenException("Failed to sign token", e);
        }
    }

    /**
     * Verify signature and expiry and decode the claims
     *
     * @throws JwtTokenException if the token is malformed, badly signed or expired
     */
    public TokenClaims verifyToken(String token) {
        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new JwtTokenException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new JwtTokenException("Invalid token", e);
        }

        long userId;
        try {
            userId = Long.parseLong(claims.getSubject());
        } catch (NumberFormatException e) {
            throw new JwtTokenException("Invalid token", e);
        }

        return new TokenClaims(
                userId,
                claims.get(USERNAME_CLAIM, String.class),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant());
    }
}
