package dev.blog.platform.security;

import dev.blog.platform.exception.JwtTokenException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BearerTokensTest {

    @Test
    void testExtract() {
        assertThat(BearerTokens.extract("Bearer abc.def.ghi")).isEqualTo("abc.def.ghi");
        assertThat(BearerTokens.extract(BearerTokens.headerValue("xyz"))).isEqualTo("xyz");
    }

    @Test
    void testMissingHeader() {
        assertThatThrownBy(() -> BearerTokens.extract(null))
                .isInstanceOf(JwtTokenException.class)
                .hasMessage("Missing authorization header");
        assertThatThrownBy(() -> BearerTokens.extract("  "))
                .isInstanceOf(JwtTokenException.class)
                .hasMessage("Missing authorization header");
    }

    @Test
    void testWrongScheme() {
        assertThatThrownBy(() -> BearerTokens.extract("Basic dXNlcjpwYXNz"))
                .isInstanceOf(JwtTokenException.class)
                .hasMessage("Invalid authorization header format");
        assertThatThrownBy(() -> BearerTokens.extract("Bearer "))
                .isInstanceOf(JwtTokenException.class)
                .hasMessage("Invalid authorization header format");
    }
}
