package dev.blog.platform;

import dev.blog.platform.domain.AuthResult;
import dev.blog.platform.domain.Post;
import dev.blog.platform.domain.command.CreatePostCommand;
import dev.blog.platform.mapper.PostMapper;
import dev.blog.platform.mapper.UserMapper;
import dev.blog.platform.service.AuthService;
import dev.blog.platform.service.BlogService;
import dev.blog.platform.testutil.RegisterCommandTestBuilder;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Base class for integration tests against the in-memory database
 * Not transactional: several tests read committed data from other threads or over the wire
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class BaseIntegrationTest {

    @Autowired
    protected UserMapper userMapper;

    @Autowired
    protected PostMapper postMapper;

    @Autowired
    protected AuthService authService;

    @Autowired
    protected BlogService blogService;

    /**
     * Cleanup method run after each test
     */
    @AfterEach
    void baseCleanup() {
        // Posts first due to the FK on author_id
        postMapper.deleteAll();
        userMapper.deleteAll();
    }

    // ============= TEST DATA HELPERS =============

    protected AuthResult registerUser(String username) {
        return authService.register(RegisterCommandTestBuilder.user(username).build());
    }

    protected Post createPost(long authorId, String title) {
        return blogService.createPost(authorId, CreatePostCommand.builder()
                .title(title)
                .content("Content of " + title)
                .build());
    }
}
