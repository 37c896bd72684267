package dev.blog.platform.exception;

import org.springframework.http.HttpStatus;

/**
 * Mapping table from domain error kind to HTTP status
 */
public final class HttpErrorMapper {

    private HttpErrorMapper() {
    }

    public static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case USER_NOT_FOUND, POST_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case USER_ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case INVALID_CREDENTIALS, JWT -> HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case DATABASE, PASSWORD_HASH -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
