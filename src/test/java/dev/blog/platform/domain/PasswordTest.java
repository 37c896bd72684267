package dev.blog.platform.domain;

import dev.blog.platform.exception.PasswordHashException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Password Tests")
class PasswordTest {

    @Test
    @DisplayName("Hash verifies the original plaintext only")
    void testHashAndVerify() {
        Password password = Password.hash("correct horse battery");

        assertThat(password.verify("correct horse battery")).isTrue();
        assertThat(password.verify("correct horse battery!")).isFalse();
        assertThat(password.verify(null)).isFalse();
    }

    @Test
    @DisplayName("Encoded form is Argon2id and never the plaintext")
    void testEncodedForm() {
        Password password = Password.hash("password123");

        assertThat(password.encoded()).startsWith("$argon2id$");
        assertThat(password.encoded()).doesNotContain("password123");
    }

    @Test
    @DisplayName("Same plaintext hashed twice yields different hashes")
    void testSaltIsRandom() {
        Password first = Password.hash("password123");
        Password second = Password.hash("password123");

        assertThat(first).isNotEqualTo(second);
        assertThat(first.verify("password123")).isTrue();
        assertThat(second.verify("password123")).isTrue();
    }

    @Test
    @DisplayName("Stored hash round-trips through fromHash")
    void testFromHash() {
        Password original = Password.hash("password123");
        Password loaded = Password.fromHash(original.encoded());

        assertThat(loaded).isEqualTo(original);
        assertThat(loaded.verify("password123")).isTrue();
    }

    @Test
    @DisplayName("Malformed stored hash does not match and does not throw")
    void testMalformedHash() {
        assertThat(Password.fromHash("not-a-hash").verify("anything")).isFalse();
    }

    @Test
    @DisplayName("toString masks the hash")
    void testToStringMasked() {
        Password password = Password.hash("password123");

        assertThat(password.toString()).doesNotContain(password.encoded());
    }

    @Test
    void testHashNullRejected() {
        assertThatThrownBy(() -> Password.hash(null))
                .isInstanceOf(PasswordHashException.class);
    }
}
