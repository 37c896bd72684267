package dev.blog.platform.exception;

/**
 * Token signing or verification failure: missing, malformed, badly signed or expired token
 */
public class JwtTokenException extends BusinessException {

    public JwtTokenException(String message) {
        super(message);
    }

    public JwtTokenException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.JWT;
    }
}
