package dev.blog.platform.domain;

import lombok.Value;

/**
 * Outcome of a successful registration or login
 */
@Value
public class AuthResult {
    String token;
    User user;
}
