package dev.blog.platform.service;

import dev.blog.platform.domain.PageRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Pagination Policy Tests")
class PaginationPolicyTest {

    private final PaginationPolicy policy = new PaginationPolicy(10, 100);

    @Test
    @DisplayName("Absent limit and offset fall back to defaults")
    void testDefaults() {
        assertThat(policy.fromLimitOffset(null, null)).isEqualTo(new PageRequest(10, 0));
    }

    @Test
    @DisplayName("Limit is clamped to [1, max] and offset to >= 0")
    void testClamping() {
        assertThat(policy.fromLimitOffset(1000L, 5L)).isEqualTo(new PageRequest(100, 5));
        assertThat(policy.fromLimitOffset(0L, -3L)).isEqualTo(new PageRequest(1, 0));
        assertThat(policy.fromLimitOffset(-7L, 20L)).isEqualTo(new PageRequest(1, 20));
    }

    @Test
    @DisplayName("Page form: page < 1 becomes 1, zero page size becomes default")
    void testPageForm() {
        assertThat(policy.fromPage(0, 0)).isEqualTo(new PageRequest(10, 0));
        assertThat(policy.fromPage(3, 5)).isEqualTo(new PageRequest(5, 10));
        assertThat(policy.fromPage(2, 500)).isEqualTo(new PageRequest(100, 100));
        assertThat(policy.fromPage(-4, 20)).isEqualTo(new PageRequest(20, 0));
    }

    @Test
    void testPageNumberOfWindow() {
        assertThat(new PageRequest(10, 0).page()).isEqualTo(1);
        assertThat(new PageRequest(10, 20).page()).isEqualTo(3);
    }

    @Test
    void testInvalidConfigRefused() {
        assertThatThrownBy(() -> new PaginationPolicy(200, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
