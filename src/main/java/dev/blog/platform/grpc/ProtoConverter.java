package dev.blog.platform.grpc;

import dev.blog.platform.domain.Post;
import dev.blog.platform.domain.User;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Domain to wire message conversion. IDs travel as decimal strings, timestamps as RFC 3339.
 */
final class ProtoConverter {

    private ProtoConverter() {
    }

    static dev.blog.platform.grpc.proto.User toProto(User user) {
        return dev.blog.platform.grpc.proto.User.newBuilder()
                .setId(String.valueOf(user.getId()))
                .setUsername(user.getUsername())
                .setEmail(user.getEmail())
                .setCreatedAt(timestamp(user.getCreatedAt()))
                .build();
    }

    static dev.blog.platform.grpc.proto.Post toProto(Post post) {
        return dev.blog.platform.grpc.proto.Post.newBuilder()
                .setId(String.valueOf(post.getId()))
                .setTitle(post.getTitle())
                .setContent(post.getContent())
                .setAuthorId(String.valueOf(post.getAuthorId()))
                .setAuthorUsername(post.getAuthorUsername() == null ? "" : post.getAuthorUsername())
                .setCreatedAt(timestamp(post.getCreatedAt()))
                .setUpdatedAt(timestamp(post.getUpdatedAt()))
                .build();
    }

    static String timestamp(OffsetDateTime value) {
        return value == null ? "" : DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value);
    }

    /**
     * @throws io.grpc.StatusRuntimeException with INVALID_ARGUMENT when the text is not a decimal number
     */
    static long parsePostId(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw GrpcErrorMapper.invalidArgument("Invalid post ID: " + value);
        }
    }
}
