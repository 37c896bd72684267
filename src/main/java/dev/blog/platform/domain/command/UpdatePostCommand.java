package dev.blog.platform.domain.command;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

/**
 * Domain command for updating a post
 */
@Value
@Builder
public class UpdatePostCommand {

    @NotBlank(message = "Title cannot be blank")
    @Size(max = 255, message = "Title must be at most 255 characters")
    String title;

    @NotNull(message = "Content cannot be null")
    String content;
}
