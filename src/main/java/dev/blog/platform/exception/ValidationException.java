package dev.blog.platform.exception;

/**
 * Malformed input
 */
public class ValidationException extends BusinessException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }
}
