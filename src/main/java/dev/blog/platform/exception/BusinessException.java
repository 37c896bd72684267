package dev.blog.platform.exception;

/**
 * Base class for typed domain errors raised by the application core
 */
public abstract class BusinessException extends RuntimeException {

    public static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    protected BusinessException(String message) {
        super(message);
    }

    protected BusinessException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The kind used by transport adapters to pick a wire status
     */
    public abstract ErrorKind getKind();

    /**
     * Message safe to send to any client; server-side failures get a generic text
     */
    public String getPublicMessage() {
        return switch (getKind()) {
            case DATABASE, PASSWORD_HASH -> INTERNAL_ERROR_MESSAGE;
            case USER_NOT_FOUND, USER_ALREADY_EXISTS, INVALID_CREDENTIALS, POST_NOT_FOUND,
                    FORBIDDEN, VALIDATION, JWT -> getMessage();
        };
    }

    /**
     * Whether the failure is transient and the same call may succeed later
     */
    public boolean isRetryable() {
        return false;
    }
}
