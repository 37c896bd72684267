package dev.blog.platform.security;

import dev.blog.platform.exception.JwtTokenException;

/**
 * Parsing of the {@code Authorization: Bearer <token>} value shared by the HTTP header and gRPC metadata
 */
public final class BearerTokens {

    public static final String AUTHORIZATION = "authorization";
    public static final String PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * Extract the raw token from an authorization value
     *
     * @throws JwtTokenException if the value is missing or not a bearer credential
     */
    public static String extract(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw new JwtTokenException("Missing authorization header");
        }
        if (!authorization.startsWith(PREFIX)) {
            throw new JwtTokenException("Invalid authorization header format");
        }
        String token = authorization.substring(PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new JwtTokenException("Invalid authorization header format");
        }
        return token;
    }

    public static String headerValue(String token) {
        return PREFIX + token;
    }
}
