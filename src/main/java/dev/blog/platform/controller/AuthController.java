package dev.blog.platform.controller;

import dev.blog.platform.domain.AuthResult;
import dev.blog.platform.dto.AuthResponse;
import dev.blog.platform.dto.LoginRequest;
import dev.blog.platform.dto.RegisterRequest;
import dev.blog.platform.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for registration and login
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Register and log in")
public class AuthController {

    private final AuthService authService;

    /**
     * Register a new user
     *
     * @param request the registration request
     * @return token and created user
     */
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register a new user", description = "Creates an account and returns a bearer token")
    public AuthResponse register(@RequestBody RegisterRequest request) {
        log.info("Register request: username={}", request.getUsername());
        AuthResult result = authService.register(request.toCommand());
        return AuthResponse.fromResult(result);
    }

    /**
     * Log in with email and password
     *
     * @param request the login request
     * @return token and user
     */
    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Exchanges email and password for a bearer token")
    public AuthResponse login(@RequestBody LoginRequest request) {
        AuthResult result = authService.login(request.toCommand());
        return AuthResponse.fromResult(result);
    }
}
