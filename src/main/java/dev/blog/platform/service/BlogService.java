package dev.blog.platform.service;

import dev.blog.platform.domain.PageRequest;
import dev.blog.platform.domain.Post;
import dev.blog.platform.domain.PostPage;
import dev.blog.platform.domain.command.CreatePostCommand;
import dev.blog.platform.domain.command.UpdatePostCommand;
import dev.blog.platform.exception.BusinessException;
import dev.blog.platform.exception.ForbiddenException;
import dev.blog.platform.exception.PostNotFoundException;
import dev.blog.platform.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Post CRUD with ownership enforcement.
 *
 * Updates and deletes are issued as a single store operation scoped by post ID and author ID.
 * Only when that operation matches nothing is the post looked up again, to tell
 * "not yours" (Forbidden) from "does not exist" (PostNotFound). If the post disappears
 * between the two steps the outcome is PostNotFound, which reflects the state at lookup time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlogService {

    private final PostRepository postRepository;
    private final CommandValidator commandValidator;
    private final PaginationPolicy paginationPolicy;

    /**
     * Create a post
     *
     * @param authorId the caller's user ID, taken from a verified token
     */
    public Post createPost(long authorId, CreatePostCommand command) {
        commandValidator.validate(command);
        return postRepository.create(command.getTitle(), command.getContent(), authorId);
    }

    public Post getPost(long id) {
        return postRepository.findById(id)
                .orElseThrow(PostNotFoundException::new);
    }

    /**
     * Update a post owned by the caller
     *
     * @throws ForbiddenException if the post belongs to someone else
     * @throws PostNotFoundException if the post does not exist
     */
    public Post updatePost(long id, long authorId, UpdatePostCommand command) {
        commandValidator.validate(command);

        return postRepository.updateByAuthor(id, authorId, command.getTitle(), command.getContent())
                .orElseThrow(() -> classifyMiss(id, authorId, "update"));
    }

    /**
     * Delete a post owned by the caller
     *
     * @throws ForbiddenException if the post belongs to someone else
     * @throws PostNotFoundException if the post does not exist
     */
    public void deletePost(long id, long authorId) {
        if (postRepository.deleteByAuthor(id, authorId)) {
            return;
        }
        throw classifyMiss(id, authorId, "delete");
    }

    /**
     * Page of posts, newest first, with the total count computed independently of the page
     */
    public PostPage listPosts(Long limit, Long offset) {
        return listPosts(paginationPolicy.fromLimitOffset(limit, offset));
    }

    public PostPage listPosts(PageRequest page) {
        List<Post> posts = postRepository.list(page.getLimit(), page.getOffset());
        long total = postRepository.count();
        return new PostPage(posts, total, page.getLimit(), page.getOffset());
    }

    private BusinessException classifyMiss(long id, long authorId, String operation) {
        if (postRepository.findById(id).isPresent()) {
            log.warn("Post {} rejected, not the owner: postId={}, userId={}", operation, id, authorId);
            return new ForbiddenException();
        }
        log.debug("Post {} missed, no such post: postId={}", operation, id);
        return new PostNotFoundException();
    }
}
