package dev.blog.platform.repository.mybatis;

import dev.blog.platform.domain.Post;
import dev.blog.platform.exception.UserNotFoundException;
import dev.blog.platform.mapper.PostMapper;
import dev.blog.platform.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * PostRepository backed by the MyBatis {@link PostMapper}
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MyBatisPostRepository implements PostRepository {

    private final PostMapper postMapper;
    private final Clock clock;

    /**
     * Insert, then read the row back so the result carries the author's username
     */
    @Override
    @Transactional
    public Post create(String title, String content, long authorId) {
        OffsetDateTime now = now();
        Post post = Post.builder()
                .title(title)
                .content(content)
                .authorId(authorId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            postMapper.insert(post);
        } catch (DataIntegrityViolationException e) {
            // FK on author_id: the token outlived its user row
            log.warn("Post insert rejected, author does not exist: authorId={}", authorId);
            throw new UserNotFoundException("Author not found");
        } catch (DataAccessException e) {
            throw StoreErrors.translate("insert post", e);
        }
        log.info("Post created: id={}, authorId={}", post.getId(), authorId);
        return findById(post.getId()).orElse(post);
    }

    @Override
    public Optional<Post> findById(long id) {
        try {
            return Optional.ofNullable(postMapper.findById(id));
        } catch (DataAccessException e) {
            throw StoreErrors.translate("find post by id", e);
        }
    }

    /**
     * The conditional UPDATE and the re-read of the row it touched share one transaction
     */
    @Override
    @Transactional
    public Optional<Post> updateByAuthor(long id, long authorId, String title, String content) {
        try {
            int rows = postMapper.updateByAuthor(id, authorId, title, content, now());
            if (rows == 0) {
                return Optional.empty();
            }
            log.debug("Post updated: id={}, authorId={}", id, authorId);
            return Optional.ofNullable(postMapper.findById(id));
        } catch (DataAccessException e) {
            throw StoreErrors.translate("update post", e);
        }
    }

    @Override
    public boolean deleteByAuthor(long id, long authorId) {
        try {
            boolean deleted = postMapper.deleteByAuthor(id, authorId) > 0;
            if (deleted) {
                log.info("Post deleted: id={}, authorId={}", id, authorId);
            }
            return deleted;
        } catch (DataAccessException e) {
            throw StoreErrors.translate("delete post", e);
        }
    }

    @Override
    public List<Post> list(long limit, long offset) {
        try {
            return postMapper.findPage(limit, offset);
        } catch (DataAccessException e) {
            throw StoreErrors.translate("list posts", e);
        }
    }

    @Override
    public long count() {
        try {
            return postMapper.countAll();
        } catch (DataAccessException e) {
            throw StoreErrors.translate("count posts", e);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
