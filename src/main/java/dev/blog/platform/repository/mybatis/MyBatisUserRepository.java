package dev.blog.platform.repository.mybatis;

import dev.blog.platform.domain.Password;
import dev.blog.platform.domain.User;
import dev.blog.platform.exception.UserAlreadyExistsException;
import dev.blog.platform.mapper.UserMapper;
import dev.blog.platform.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * UserRepository backed by the MyBatis {@link UserMapper}
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MyBatisUserRepository implements UserRepository {

    private final UserMapper userMapper;
    private final Clock clock;

    @Override
    public User create(String username, String email, Password passwordHash) {
        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordHash)
                .createdAt(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS))
                .build();
        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException e) {
            // Unique constraint on username or email; which one is not reported
            log.debug("User insert rejected by unique constraint");
            throw new UserAlreadyExistsException(e);
        } catch (DataAccessException e) {
            throw StoreErrors.translate("insert user", e);
        }
        log.info("User created: id={}, username={}", user.getId(), user.getUsername());
        return user;
    }

    @Override
    public Optional<User> findByEmail(String email) {
        try {
            return Optional.ofNullable(userMapper.findByEmail(email));
        } catch (DataAccessException e) {
            throw StoreErrors.translate("find user by email", e);
        }
    }

    @Override
    public Optional<User> findById(long id) {
        try {
            return Optional.ofNullable(userMapper.findById(id));
        } catch (DataAccessException e) {
            throw StoreErrors.translate("find user by id", e);
        }
    }

    @Override
    public Optional<User> findByUsername(String username) {
        try {
            return Optional.ofNullable(userMapper.findByUsername(username));
        } catch (DataAccessException e) {
            throw StoreErrors.translate("find user by username", e);
        }
    }
}
