package dev.blog.platform.exception;

/**
 * Closed set of domain error kinds.
 * Every transport adapter maps each kind to a wire status in a single exhaustive switch.
 */
public enum ErrorKind {
    USER_NOT_FOUND,
    USER_ALREADY_EXISTS,
    INVALID_CREDENTIALS,
    POST_NOT_FOUND,
    FORBIDDEN,
    VALIDATION,
    DATABASE,
    PASSWORD_HASH,
    JWT
}
