package dev.blog.platform.exception;

/**
 * Post not found exception
 */
public class PostNotFoundException extends BusinessException {

    public PostNotFoundException() {
        super("Post not found");
    }

    public PostNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.POST_NOT_FOUND;
    }
}
