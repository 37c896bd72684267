package dev.blog.platform.client;

/**
 * Transport-neutral failure categories seen by {@link BlogClient} callers
 */
public enum ClientErrorKind {
    NOT_FOUND,
    UNAUTHORIZED,
    FORBIDDEN,
    CONFLICT,
    INVALID_REQUEST,
    /** An authenticated operation was attempted before any token was stored */
    NO_TOKEN,
    SERVER_ERROR,
    /** The server could not be reached or the call was cut off */
    TRANSPORT
}
