package dev.blog.platform.mapper;

import dev.blog.platform.domain.Post;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * MyBatis mapper interface for Post entity
 */
@Mapper
public interface PostMapper {

    /**
     * Insert a new post
     * @param post the post to insert; the generated ID is written back
     * @return number of rows affected
     */
    int insert(Post post);

    /**
     * Find post by ID, joined with the author's username
     * @param id the post ID
     * @return the post, or null if not found
     */
    Post findById(@Param("id") Long id);

    /**
     * Update title and content only when the row belongs to the given author
     * @return number of rows affected (0 when the ID or the author does not match)
     */
    int updateByAuthor(@Param("id") Long id,
                       @Param("authorId") Long authorId,
                       @Param("title") String title,
                       @Param("content") String content,
                       @Param("updatedAt") OffsetDateTime updatedAt);

    /**
     * Delete a post only when it belongs to the given author
     * @return number of rows affected
     */
    int deleteByAuthor(@Param("id") Long id, @Param("authorId") Long authorId);

    /**
     * Page of posts joined with author usernames, newest first
     */
    List<Post> findPage(@Param("limit") long limit, @Param("offset") long offset);

    long countAll();

    /**
     * Delete all posts (for testing)
     */
    int deleteAll();
}
