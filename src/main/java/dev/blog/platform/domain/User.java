package dev.blog.platform.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * User entity representing a registered account
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    /**
     * Unique user identifier, assigned by the store
     */
    private Long id;

    /**
     * Username (unique, immutable)
     */
    private String username;

    /**
     * Email address (unique, login key)
     */
    private String email;

    /**
     * Hashed password (Argon2id)
     */
    private Password passwordHash;

    /**
     * Timestamp when user was created
     */
    private OffsetDateTime createdAt;
}
