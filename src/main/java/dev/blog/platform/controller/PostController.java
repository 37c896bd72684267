package dev.blog.platform.controller;

import dev.blog.platform.config.OpenApiConfig;
import dev.blog.platform.domain.Post;
import dev.blog.platform.dto.PostListResponse;
import dev.blog.platform.dto.PostRequest;
import dev.blog.platform.dto.PostResponse;
import dev.blog.platform.security.AuthenticatedUser;
import dev.blog.platform.security.BearerAuthInterceptor;
import dev.blog.platform.security.RequiresAuthentication;
import dev.blog.platform.service.BlogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for blog posts
 * Reads are public; mutations need a bearer token and are restricted to the post's author
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/posts")
@RequiredArgsConstructor
@Tag(name = "Posts", description = "Blog post operations")
public class PostController {

    private final BlogService blogService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RequiresAuthentication
    @Operation(summary = "Create a post", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public PostResponse createPost(
            @RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) AuthenticatedUser user,
            @RequestBody PostRequest request) {
        log.info("Creating post: userId={}", user.getUserId());
        Post post = blogService.createPost(user.getUserId(), request.toCreateCommand());
        return PostResponse.fromPost(post);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a post by ID")
    public PostResponse getPost(
            @Parameter(description = "Post ID", required = true) @PathVariable Long id) {
        log.debug("Getting post: id={}", id);
        return PostResponse.fromPost(blogService.getPost(id));
    }

    @PutMapping("/{id}")
    @RequiresAuthentication
    @Operation(summary = "Update a post", description = "Only the author may update a post",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public PostResponse updatePost(
            @RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) AuthenticatedUser user,
            @Parameter(description = "Post ID", required = true) @PathVariable Long id,
            @RequestBody PostRequest request) {
        log.info("Updating post: id={}, userId={}", id, user.getUserId());
        Post post = blogService.updatePost(id, user.getUserId(), request.toUpdateCommand());
        return PostResponse.fromPost(post);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @RequiresAuthentication
    @Operation(summary = "Delete a post", description = "Only the author may delete a post",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public void deletePost(
            @RequestAttribute(BearerAuthInterceptor.AUTHENTICATED_USER) AuthenticatedUser user,
            @Parameter(description = "Post ID", required = true) @PathVariable Long id) {
        log.info("Deleting post: id={}, userId={}", id, user.getUserId());
        blogService.deletePost(id, user.getUserId());
    }

    @GetMapping
    @Operation(summary = "List posts", description = "Newest first; limit is clamped to the configured maximum")
    public PostListResponse listPosts(
            @Parameter(description = "Page size") @RequestParam(required = false) Long limit,
            @Parameter(description = "Rows to skip") @RequestParam(required = false) Long offset) {
        return PostListResponse.fromPage(blogService.listPosts(limit, offset));
    }
}
