package dev.blog.platform.security;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a controller method that needs a valid bearer token.
 * The resolved {@link AuthenticatedUser} is exposed as the request attribute
 * {@link BearerAuthInterceptor#AUTHENTICATED_USER}.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresAuthentication {
}
