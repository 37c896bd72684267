package dev.blog.platform.domain;

import dev.blog.platform.exception.PasswordHashException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;

import java.util.Objects;

/**
 * Hashed user credential.
 *
 * Only the encoded Argon2id hash is kept after construction; the plaintext is never stored.
 * The textual form is masked so the hash cannot leak into logs.
 */
@Slf4j
public final class Password {

    /**
     * Argon2id parameters: 16-byte salt, 32-byte output, 4 lanes, 32 MiB, 1 iteration
     */
    static final int SALT_LENGTH = 16;
    static final int HASH_LENGTH = 32;
    static final int PARALLELISM = 4;
    static final int MEMORY_KIB = 32 * 1024;
    static final int ITERATIONS = 1;

    private static final Argon2PasswordEncoder ENCODER =
            new Argon2PasswordEncoder(SALT_LENGTH, HASH_LENGTH, PARALLELISM, MEMORY_KIB, ITERATIONS);

    private final String encoded;

    private Password(String encoded) {
        this.encoded = encoded;
    }

    /**
     * Hash a plaintext password with a fresh random salt
     *
     * @param plaintext the raw password
     * @return the hashed password
     * @throws PasswordHashException if the hash cannot be derived
     */
    public static Password hash(String plaintext) {
        if (plaintext == null) {
            throw new PasswordHashException("Password must not be null");
        }
        try {
            return new Password(ENCODER.encode(plaintext));
        } catch (RuntimeException e) {
            throw new PasswordHashException("Failed to hash password", e);
        }
    }

    /**
     * Wrap a hash loaded from storage without rehashing it
     */
    public static Password fromHash(String stored) {
        return new Password(Objects.requireNonNull(stored, "stored hash"));
    }

    /**
     * Check a plaintext candidate against this hash.
     * A malformed stored hash never throws, it simply does not match.
     */
    public boolean verify(String plaintext) {
        if (plaintext == null) {
            return false;
        }
        try {
            return ENCODER.matches(plaintext, encoded);
        } catch (RuntimeException e) {
            log.debug("Password verification failed on malformed hash: {}", e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * The encoded hash, for persistence only
     */
    public String encoded() {
        return encoded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Password)) {
            return false;
        }
        return encoded.equals(((Password) o).encoded);
    }

    @Override
    public int hashCode() {
        return encoded.hashCode();
    }

    @Override
    public String toString() {
        return "Password(********)";
    }
}
