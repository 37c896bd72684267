package dev.blog.platform.security;

import dev.blog.platform.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Authenticates requests to handlers annotated with {@link RequiresAuthentication}.
 * A missing or invalid token raises a JwtTokenException, which the global handler maps to 401.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerAuthInterceptor implements HandlerInterceptor {

    public static final String AUTHENTICATED_USER = "blog.authenticatedUser";

    private final AuthService authService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)
                || !((HandlerMethod) handler).hasMethodAnnotation(RequiresAuthentication.class)) {
            return true;
        }

        AuthenticatedUser user = authService.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
        request.setAttribute(AUTHENTICATED_USER, user);
        log.debug("Authenticated request: userId={}, URI={}", user.getUserId(), request.getRequestURI());
        return true;
    }
}
