package dev.blog.platform.exception;

/**
 * Login failed. Unknown email and wrong password are reported identically.
 */
public class InvalidCredentialsException extends BusinessException {

    public InvalidCredentialsException() {
        super("Invalid credentials");
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INVALID_CREDENTIALS;
    }
}
