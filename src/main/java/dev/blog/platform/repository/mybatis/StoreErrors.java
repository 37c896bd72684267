package dev.blog.platform.repository.mybatis;

import dev.blog.platform.exception.DatabaseException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Translation of Spring's data access exceptions into the domain's opaque database error
 */
final class StoreErrors {

    private StoreErrors() {
    }

    static DatabaseException translate(String operation, DataAccessException e) {
        boolean retryable = e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException;
        return new DatabaseException("Database operation failed: " + operation, e, retryable);
    }
}
