package dev.blog.platform.domain;

import lombok.Value;

import java.util.List;

/**
 * One page of posts, newest first, with the total post count for pagination math
 */
@Value
public class PostPage {
    List<Post> posts;
    long total;
    long limit;
    long offset;
}
