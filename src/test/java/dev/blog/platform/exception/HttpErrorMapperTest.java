package dev.blog.platform.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HTTP Error Mapping Tests")
class HttpErrorMapperTest {

    @ParameterizedTest
    @EnumSource(ErrorKind.class)
    @DisplayName("Every error kind has a status")
    void testEveryKindMapped(ErrorKind kind) {
        assertThat(HttpErrorMapper.statusOf(kind)).isNotNull();
    }

    @Test
    void testStatusTable() {
        assertThat(HttpErrorMapper.statusOf(ErrorKind.USER_NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(HttpErrorMapper.statusOf(ErrorKind.POST_NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(HttpErrorMapper.statusOf(ErrorKind.USER_ALREADY_EXISTS)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(HttpErrorMapper.statusOf(ErrorKind.INVALID_CREDENTIALS)).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(HttpErrorMapper.statusOf(ErrorKind.JWT)).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(HttpErrorMapper.statusOf(ErrorKind.FORBIDDEN)).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(HttpErrorMapper.statusOf(ErrorKind.VALIDATION)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(HttpErrorMapper.statusOf(ErrorKind.DATABASE)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(HttpErrorMapper.statusOf(ErrorKind.PASSWORD_HASH)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
