package dev.blog.platform.security;

import lombok.Value;

/**
 * Identity of the caller, taken from a verified bearer token
 */
@Value
public class AuthenticatedUser {
    long userId;
    String username;

    public static AuthenticatedUser fromClaims(TokenClaims claims) {
        return new AuthenticatedUser(claims.getUserId(), claims.getUsername());
    }
}
