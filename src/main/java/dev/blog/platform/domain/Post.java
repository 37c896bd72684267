package dev.blog.platform.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Post entity representing a blog entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Post {
    /**
     * Unique post identifier
     */
    private Long id;

    private String title;

    private String content;

    /**
     * Author user ID, fixed at creation
     */
    private Long authorId;

    /**
     * Author username, only populated on reads joined with users
     */
    private String authorUsername;

    private OffsetDateTime createdAt;

    /**
     * Refreshed on every successful update
     */
    private OffsetDateTime updatedAt;
}
