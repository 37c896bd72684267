package dev.blog.platform.repository;

import dev.blog.platform.domain.Password;
import dev.blog.platform.domain.User;
import dev.blog.platform.exception.DatabaseException;
import dev.blog.platform.exception.UserAlreadyExistsException;

import java.util.Optional;

/**
 * Persistence contract for users.
 * Implementations report store failures as {@link DatabaseException}, never as raw store exceptions.
 */
public interface UserRepository {

    /**
     * Insert a user row
     *
     * @throws UserAlreadyExistsException if the username or the email is already taken
     */
    User create(String username, String email, Password passwordHash);

    Optional<User> findByEmail(String email);

    Optional<User> findById(long id);

    Optional<User> findByUsername(String username);
}
