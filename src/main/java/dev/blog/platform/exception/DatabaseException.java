package dev.blog.platform.exception;

/**
 * Opaque store failure. The message is for server-side logs only and is never sent to clients.
 */
public class DatabaseException extends BusinessException {

    private final boolean retryable;

    public DatabaseException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * True for timeouts, deadlocks and lost connections
     */
    @Override
    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.DATABASE;
    }
}
