package dev.blog.platform.client;

import dev.blog.platform.dto.AuthResponse;
import dev.blog.platform.dto.PostListResponse;
import dev.blog.platform.dto.PostResponse;

/**
 * One wire protocol behind {@link BlogClient}.
 * Implementations are stateless with respect to identity: the token is passed per call.
 */
public interface Transport extends AutoCloseable {

    static Transport http(String baseUrl) {
        return new HttpBlogTransport(baseUrl);
    }

    static Transport grpc(String host, int port) {
        return new GrpcBlogTransport(host, port);
    }

    AuthResponse register(String username, String email, String password);

    AuthResponse login(String email, String password);

    PostResponse createPost(String token, String title, String content);

    PostResponse getPost(long postId);

    PostResponse updatePost(String token, long postId, String title, String content);

    void deletePost(String token, long postId);

    /**
     * @param limit  page size, or null for the server default
     * @param offset rows to skip, or null for zero
     */
    PostListResponse listPosts(Long limit, Long offset);

    @Override
    void close();
}
