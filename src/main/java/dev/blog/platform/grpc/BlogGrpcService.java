package dev.blog.platform.grpc;

import dev.blog.platform.domain.AuthResult;
import dev.blog.platform.domain.PageRequest;
import dev.blog.platform.domain.Post;
import dev.blog.platform.domain.PostPage;
import dev.blog.platform.domain.command.CreatePostCommand;
import dev.blog.platform.domain.command.LoginCommand;
import dev.blog.platform.domain.command.RegisterCommand;
import dev.blog.platform.domain.command.UpdatePostCommand;
import dev.blog.platform.exception.BusinessException;
import dev.blog.platform.grpc.proto.AuthResponse;
import dev.blog.platform.grpc.proto.BlogServiceGrpc;
import dev.blog.platform.grpc.proto.CreatePostRequest;
import dev.blog.platform.grpc.proto.DeletePostRequest;
import dev.blog.platform.grpc.proto.DeleteResponse;
import dev.blog.platform.grpc.proto.GetPostRequest;
import dev.blog.platform.grpc.proto.ListPostsRequest;
import dev.blog.platform.grpc.proto.ListPostsResponse;
import dev.blog.platform.grpc.proto.LoginRequest;
import dev.blog.platform.grpc.proto.PostResponse;
import dev.blog.platform.grpc.proto.RegisterRequest;
import dev.blog.platform.grpc.proto.UpdatePostRequest;
import dev.blog.platform.security.AuthenticatedUser;
import dev.blog.platform.service.AuthService;
import dev.blog.platform.service.BlogService;
import dev.blog.platform.service.PaginationPolicy;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * gRPC adapter over the same services the REST controllers use
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlogGrpcService extends BlogServiceGrpc.BlogServiceImplBase {

    private final AuthService authService;
    private final BlogService blogService;
    private final PaginationPolicy paginationPolicy;

    @Override
    public void register(RegisterRequest request, StreamObserver<AuthResponse> responseObserver) {
        respond(responseObserver, () -> {
            log.info("Register RPC: username={}", request.getUsername());
            AuthResult result = authService.register(RegisterCommand.builder()
                    .username(request.getUsername())
                    .email(request.getEmail())
                    .password(request.getPassword())
                    .build());
            return toAuthResponse(result);
        });
    }

    @Override
    public void login(LoginRequest request, StreamObserver<AuthResponse> responseObserver) {
        respond(responseObserver, () -> toAuthResponse(authService.login(LoginCommand.builder()
                .email(request.getEmail())
                .password(request.getPassword())
                .build())));
    }

    @Override
    public void createPost(CreatePostRequest request, StreamObserver<PostResponse> responseObserver) {
        respond(responseObserver, () -> {
            AuthenticatedUser user = currentUser();
            Post post = blogService.createPost(user.getUserId(), CreatePostCommand.builder()
                    .title(request.getTitle())
                    .content(request.getContent())
                    .build());
            return toPostResponse(post);
        });
    }

    @Override
    public void getPost(GetPostRequest request, StreamObserver<PostResponse> responseObserver) {
        respond(responseObserver, () ->
                toPostResponse(blogService.getPost(ProtoConverter.parsePostId(request.getPostId()))));
    }

    @Override
    public void updatePost(UpdatePostRequest request, StreamObserver<PostResponse> responseObserver) {
        respond(responseObserver, () -> {
            AuthenticatedUser user = currentUser();
            long postId = ProtoConverter.parsePostId(request.getPostId());
            Post post = blogService.updatePost(postId, user.getUserId(), UpdatePostCommand.builder()
                    .title(request.getTitle())
                    .content(request.getContent())
                    .build());
            return toPostResponse(post);
        });
    }

    @Override
    public void deletePost(DeletePostRequest request, StreamObserver<DeleteResponse> responseObserver) {
        respond(responseObserver, () -> {
            AuthenticatedUser user = currentUser();
            long postId = ProtoConverter.parsePostId(request.getPostId());
            blogService.deletePost(postId, user.getUserId());
            return DeleteResponse.newBuilder()
                    .setSuccess(true)
                    .setMessage("Post deleted successfully")
                    .build();
        });
    }

    @Override
    public void listPosts(ListPostsRequest request, StreamObserver<ListPostsResponse> responseObserver) {
        respond(responseObserver, () -> {
            PageRequest pageRequest = paginationPolicy.fromPage(request.getPage(), request.getPageSize());
            PostPage page = blogService.listPosts(pageRequest);
            ListPostsResponse.Builder builder = ListPostsResponse.newBuilder()
                    .setTotalCount(page.getTotal())
                    .setPage((int) pageRequest.page())
                    .setPageSize((int) pageRequest.getLimit());
            page.getPosts().forEach(post -> builder.addPosts(ProtoConverter.toProto(post)));
            return builder.build();
        });
    }

    private AuthenticatedUser currentUser() {
        return authService.authenticate(AuthorizationServerInterceptor.AUTHORIZATION.get());
    }

    private static AuthResponse toAuthResponse(AuthResult result) {
        return AuthResponse.newBuilder()
                .setToken(result.getToken())
                .setUser(ProtoConverter.toProto(result.getUser()))
                .build();
    }

    private static PostResponse toPostResponse(Post post) {
        return PostResponse.newBuilder()
                .setPost(ProtoConverter.toProto(post))
                .build();
    }

    /**
     * Run a unary call and translate failures into gRPC statuses
     */
    private static <T> void respond(StreamObserver<T> responseObserver, Supplier<T> call) {
        T response;
        try {
            response = call.get();
        } catch (BusinessException e) {
            responseObserver.onError(GrpcErrorMapper.toStatusException(e));
            return;
        } catch (StatusRuntimeException e) {
            responseObserver.onError(e);
            return;
        } catch (RuntimeException e) {
            responseObserver.onError(GrpcErrorMapper.internal(e));
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
