package dev.blog.platform.repository;

import dev.blog.platform.domain.Post;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for posts.
 * Mutations are conditional on both the post ID and the author ID so ownership is checked atomically.
 */
public interface PostRepository {

    /**
     * Insert a post and return it as stored, author username included
     *
     * @throws dev.blog.platform.exception.UserNotFoundException if no user has the given author ID
     */
    Post create(String title, String content, long authorId);

    /**
     * Find a post joined with its author's username
     */
    Optional<Post> findById(long id);

    /**
     * Update title and content when the post exists and belongs to the author
     *
     * @return the updated post, or empty when no row matched both ID and author
     */
    Optional<Post> updateByAuthor(long id, long authorId, String title, String content);

    /**
     * Delete the post when it exists and belongs to the author
     *
     * @return true if a row was deleted
     */
    boolean deleteByAuthor(long id, long authorId);

    /**
     * Page of posts ordered newest first, joined with author usernames
     */
    List<Post> list(long limit, long offset);

    long count();
}
