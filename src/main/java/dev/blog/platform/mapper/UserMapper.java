package dev.blog.platform.mapper;

import dev.blog.platform.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * MyBatis mapper for User operations
 */
@Mapper
public interface UserMapper {
    /**
     * Insert a new user; the generated ID is written back into the entity
     * @return number of rows affected
     */
    int insert(User user);

    User findById(@Param("id") Long id);

    User findByUsername(@Param("username") String username);

    User findByEmail(@Param("email") String email);

    /**
     * Delete all users (for testing)
     */
    int deleteAll();
}
