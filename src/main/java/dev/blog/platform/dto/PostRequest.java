package dev.blog.platform.dto;

import dev.blog.platform.domain.command.CreatePostCommand;
import dev.blog.platform.domain.command.UpdatePostCommand;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of create and update post requests
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create or update post request")
public class PostRequest {

    @Schema(description = "Post title", example = "Hello world")
    private String title;

    @Schema(description = "Post content", example = "My first post")
    private String content;

    public CreatePostCommand toCreateCommand() {
        return CreatePostCommand.builder()
                .title(title)
                .content(content)
                .build();
    }

    public UpdatePostCommand toUpdateCommand() {
        return UpdatePostCommand.builder()
                .title(title)
                .content(content)
                .build();
    }
}
