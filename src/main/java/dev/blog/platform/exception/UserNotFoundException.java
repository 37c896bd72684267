package dev.blog.platform.exception;

/**
 * User not found exception
 */
public class UserNotFoundException extends BusinessException {

    public UserNotFoundException() {
        super("User not found");
    }

    public UserNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.USER_NOT_FOUND;
    }
}
