package dev.blog.platform.dto;

import dev.blog.platform.domain.PostPage;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paginated post list")
public class PostListResponse {

    private List<PostResponse> posts;

    @Schema(description = "Total number of posts", example = "25")
    private Long total;

    @Schema(description = "Effective page size", example = "10")
    private Long limit;

    @Schema(description = "Effective offset", example = "0")
    private Long offset;

    public static PostListResponse fromPage(PostPage page) {
        return PostListResponse.builder()
                .posts(page.getPosts().stream()
                        .map(PostResponse::fromPost)
                        .collect(Collectors.toList()))
                .total(page.getTotal())
                .limit(page.getLimit())
                .offset(page.getOffset())
                .build();
    }
}
