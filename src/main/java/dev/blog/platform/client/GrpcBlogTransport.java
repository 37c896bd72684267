package dev.blog.platform.client;

import dev.blog.platform.dto.AuthResponse;
import dev.blog.platform.dto.PostListResponse;
import dev.blog.platform.dto.PostResponse;
import dev.blog.platform.dto.UserResponse;
import dev.blog.platform.grpc.proto.BlogServiceGrpc;
import dev.blog.platform.grpc.proto.CreatePostRequest;
import dev.blog.platform.grpc.proto.DeletePostRequest;
import dev.blog.platform.grpc.proto.GetPostRequest;
import dev.blog.platform.grpc.proto.ListPostsRequest;
import dev.blog.platform.grpc.proto.ListPostsResponse;
import dev.blog.platform.grpc.proto.LoginRequest;
import dev.blog.platform.grpc.proto.Post;
import dev.blog.platform.grpc.proto.RegisterRequest;
import dev.blog.platform.grpc.proto.UpdatePostRequest;
import dev.blog.platform.grpc.proto.User;
import dev.blog.platform.security.BearerTokens;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.MetadataUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * gRPC transport using a blocking stub.
 * Limit/offset paging is converted to the wire's page/page_size; an offset that is not a
 * multiple of the limit is rounded down to the start of its page.
 */
@Slf4j
public class GrpcBlogTransport implements Transport {

    private static final long DEADLINE_SECONDS = 10;
    private static final Metadata.Key<String> AUTHORIZATION_KEY =
            Metadata.Key.of(BearerTokens.AUTHORIZATION, Metadata.ASCII_STRING_MARSHALLER);

    private final ManagedChannel channel;
    private final BlogServiceGrpc.BlogServiceBlockingStub stub;

    public GrpcBlogTransport(String host, int port) {
        this(Grpc.newChannelBuilderForAddress(host, port, InsecureChannelCredentials.create()).build());
    }

    /**
     * Use an existing channel; it is shut down by {@link #close()}
     */
    public GrpcBlogTransport(ManagedChannel channel) {
        this.channel = channel;
        this.stub = BlogServiceGrpc.newBlockingStub(channel);
    }

    @Override
    public AuthResponse register(String username, String email, String password) {
        return call(() -> toAuthResponse(stub().register(RegisterRequest.newBuilder()
                .setUsername(nullToEmpty(username))
                .setEmail(nullToEmpty(email))
                .setPassword(nullToEmpty(password))
                .build())));
    }

    @Override
    public AuthResponse login(String email, String password) {
        return call(() -> toAuthResponse(stub().login(LoginRequest.newBuilder()
                .setEmail(nullToEmpty(email))
                .setPassword(nullToEmpty(password))
                .build())));
    }

    @Override
    public PostResponse createPost(String token, String title, String content) {
        return call(() -> toPostResponse(authenticated(token).createPost(CreatePostRequest.newBuilder()
                .setTitle(nullToEmpty(title))
                .setContent(nullToEmpty(content))
                .build()).getPost()));
    }

    @Override
    public PostResponse getPost(long postId) {
        return call(() -> toPostResponse(stub().getPost(GetPostRequest.newBuilder()
                .setPostId(String.valueOf(postId))
                .build()).getPost()));
    }

    @Override
    public PostResponse updatePost(String token, long postId, String title, String content) {
        return call(() -> toPostResponse(authenticated(token).updatePost(UpdatePostRequest.newBuilder()
                .setPostId(String.valueOf(postId))
                .setTitle(nullToEmpty(title))
                .setContent(nullToEmpty(content))
                .build()).getPost()));
    }

    @Override
    public void deletePost(String token, long postId) {
        call(() -> authenticated(token).deletePost(DeletePostRequest.newBuilder()
                .setPostId(String.valueOf(postId))
                .build()));
    }

    @Override
    public PostListResponse listPosts(Long limit, Long offset) {
        int pageSize = limit == null ? 0 : (int) Math.max(1, Math.min(Integer.MAX_VALUE, limit));
        long skip = offset == null ? 0 : Math.max(0, offset);
        int page = pageSize == 0 ? 1 : (int) Math.min(Integer.MAX_VALUE, skip / pageSize + 1);

        ListPostsResponse response = call(() -> stub().listPosts(ListPostsRequest.newBuilder()
                .setPage(page)
                .setPageSize(pageSize)
                .build()));

        return PostListResponse.builder()
                .posts(response.getPostsList().stream()
                        .map(GrpcBlogTransport::toPostResponse)
                        .collect(Collectors.toList()))
                .total(response.getTotalCount())
                .limit((long) response.getPageSize())
                .offset((long) (response.getPage() - 1) * response.getPageSize())
                .build();
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private BlogServiceGrpc.BlogServiceBlockingStub stub() {
        return stub.withDeadlineAfter(DEADLINE_SECONDS, TimeUnit.SECONDS);
    }

    private BlogServiceGrpc.BlogServiceBlockingStub authenticated(String token) {
        Metadata metadata = new Metadata();
        metadata.put(AUTHORIZATION_KEY, BearerTokens.headerValue(token));
        return stub().withInterceptors(MetadataUtils.newAttachHeadersInterceptor(metadata));
    }

    private static <T> T call(Supplier<T> rpc) {
        try {
            return rpc.get();
        } catch (StatusRuntimeException e) {
            Status status = e.getStatus();
            log.debug("RPC failed: code={}, description={}", status.getCode(), status.getDescription());
            String message = status.getDescription() != null ? status.getDescription() : status.getCode().name();
            throw new BlogClientException(kindOf(status.getCode()), message, e);
        }
    }

    static ClientErrorKind kindOf(Status.Code code) {
        return switch (code) {
            case NOT_FOUND -> ClientErrorKind.NOT_FOUND;
            case UNAUTHENTICATED -> ClientErrorKind.UNAUTHORIZED;
            case PERMISSION_DENIED -> ClientErrorKind.FORBIDDEN;
            case ALREADY_EXISTS -> ClientErrorKind.CONFLICT;
            case INVALID_ARGUMENT, FAILED_PRECONDITION, OUT_OF_RANGE -> ClientErrorKind.INVALID_REQUEST;
            case UNAVAILABLE, DEADLINE_EXCEEDED, CANCELLED -> ClientErrorKind.TRANSPORT;
            default -> ClientErrorKind.SERVER_ERROR;
        };
    }

    private static AuthResponse toAuthResponse(dev.blog.platform.grpc.proto.AuthResponse response) {
        User user = response.getUser();
        return AuthResponse.builder()
                .token(response.getToken())
                .user(UserResponse.builder()
                        .id(Long.parseLong(user.getId()))
                        .username(user.getUsername())
                        .email(user.getEmail())
                        .createdAt(parseTimestamp(user.getCreatedAt()))
                        .build())
                .build();
    }

    private static PostResponse toPostResponse(Post post) {
        return PostResponse.builder()
                .id(Long.parseLong(post.getId()))
                .title(post.getTitle())
                .content(post.getContent())
                .authorId(Long.parseLong(post.getAuthorId()))
                .authorUsername(post.getAuthorUsername().isEmpty() ? null : post.getAuthorUsername())
                .createdAt(parseTimestamp(post.getCreatedAt()))
                .updatedAt(parseTimestamp(post.getUpdatedAt()))
                .build();
    }

    private static OffsetDateTime parseTimestamp(String value) {
        return value.isEmpty() ? null : OffsetDateTime.parse(value);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
