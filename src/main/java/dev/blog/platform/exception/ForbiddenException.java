package dev.blog.platform.exception;

/**
 * Authenticated caller is not the owner of the resource
 */
public class ForbiddenException extends BusinessException {

    public ForbiddenException() {
        super("Forbidden: you don't have permission to perform this action");
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.FORBIDDEN;
    }
}
