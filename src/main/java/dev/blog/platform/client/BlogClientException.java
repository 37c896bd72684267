package dev.blog.platform.client;

import lombok.Getter;

@Getter
public class BlogClientException extends RuntimeException {

    private final ClientErrorKind kind;

    public BlogClientException(ClientErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BlogClientException(ClientErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
