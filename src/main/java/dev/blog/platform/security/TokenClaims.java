package dev.blog.platform.security;

import lombok.Value;

import java.time.Instant;

/**
 * Decoded identity and timing fields of a verified token
 */
@Value
public class TokenClaims {
    long userId;
    String username;
    Instant issuedAt;
    Instant expiresAt;
}
