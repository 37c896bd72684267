package dev.blog.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by every failed HTTP request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Error response")
public class ErrorResponse {

    @Schema(description = "Client-visible error message", example = "Post not found")
    private String error;

    @Schema(description = "HTTP status code", example = "404")
    private Integer status;

    @Builder.Default
    private Long timestamp = System.currentTimeMillis();

    public static ErrorResponse of(int status, String error) {
        return ErrorResponse.builder()
                .status(status)
                .error(error)
                .build();
    }
}
