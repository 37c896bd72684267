package dev.blog.platform.client;

import dev.blog.platform.dto.AuthResponse;
import dev.blog.platform.dto.PostListResponse;
import dev.blog.platform.dto.PostResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Blog client with the same surface over REST and gRPC.
 * The token returned by {@link #register} or {@link #login} is kept and attached to later
 * authenticated calls; those calls fail with {@link ClientErrorKind#NO_TOKEN} before any I/O
 * when no token is held.
 *
 * <pre>
 * try (BlogClient client = new BlogClient(Transport.grpc("localhost", 50051))) {
 *     client.login("alice@example.com", "password123");
 *     client.createPost("Hello", "First post");
 * }
 * </pre>
 */
@Slf4j
public class BlogClient implements AutoCloseable {

    private final Transport transport;
    private volatile String token;

    public BlogClient(Transport transport) {
        this.transport = transport;
    }

    public AuthResponse register(String username, String email, String password) {
        AuthResponse response = transport.register(username, email, password);
        this.token = response.getToken();
        return response;
    }

    public AuthResponse login(String email, String password) {
        AuthResponse response = transport.login(email, password);
        this.token = response.getToken();
        return response;
    }

    public PostResponse createPost(String title, String content) {
        return transport.createPost(requireToken(), title, content);
    }

    public PostResponse getPost(long postId) {
        return transport.getPost(postId);
    }

    public PostResponse updatePost(long postId, String title, String content) {
        return transport.updatePost(requireToken(), postId, title, content);
    }

    public void deletePost(long postId) {
        transport.deletePost(requireToken(), postId);
    }

    public PostListResponse listPosts(Long limit, Long offset) {
        return transport.listPosts(limit, offset);
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public void clearToken() {
        this.token = null;
    }

    @Override
    public void close() {
        transport.close();
    }

    private String requireToken() {
        String current = token;
        if (current == null) {
            throw new BlogClientException(ClientErrorKind.NO_TOKEN, "No token: register or log in first");
        }
        return current;
    }
}
