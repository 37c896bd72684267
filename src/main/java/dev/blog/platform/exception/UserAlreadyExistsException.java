package dev.blog.platform.exception;

/**
 * Raised when the store rejects a registration on a uniqueness constraint.
 * The message never says which field collided.
 */
public class UserAlreadyExistsException extends BusinessException {

    public UserAlreadyExistsException() {
        super("User already exists");
    }

    public UserAlreadyExistsException(Throwable cause) {
        super("User already exists", cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.USER_ALREADY_EXISTS;
    }
}
