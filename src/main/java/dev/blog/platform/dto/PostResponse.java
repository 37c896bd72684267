package dev.blog.platform.dto;

import dev.blog.platform.domain.Post;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Post response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Post response")
public class PostResponse {

    @Schema(description = "Post ID", example = "42")
    private Long id;

    @Schema(description = "Title", example = "Hello world")
    private String title;

    @Schema(description = "Content", example = "My first post")
    private String content;

    @Schema(description = "Author user ID", example = "1")
    private Long authorId;

    @Schema(description = "Author username, when known", example = "alice", nullable = true)
    private String authorUsername;

    @Schema(description = "Created timestamp", example = "2025-01-15T10:30:00Z")
    private OffsetDateTime createdAt;

    @Schema(description = "Updated timestamp", example = "2025-01-15T10:35:00Z")
    private OffsetDateTime updatedAt;

    /**
     * Convert Post entity to PostResponse DTO
     */
    public static PostResponse fromPost(Post post) {
        if (post == null) {
            return null;
        }

        return PostResponse.builder()
                .id(post.getId())
                .title(post.getTitle())
                .content(post.getContent())
                .authorId(post.getAuthorId())
                .authorUsername(post.getAuthorUsername())
                .createdAt(post.getCreatedAt())
                .updatedAt(post.getUpdatedAt())
                .build();
    }
}
