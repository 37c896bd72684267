package dev.blog.platform.exception;

/**
 * Password hashing failed
 */
public class PasswordHashException extends BusinessException {

    public PasswordHashException(String message) {
        super(message);
    }

    public PasswordHashException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PASSWORD_HASH;
    }
}
