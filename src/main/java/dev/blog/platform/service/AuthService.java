package dev.blog.platform.service;

import dev.blog.platform.domain.AuthResult;
import dev.blog.platform.domain.Password;
import dev.blog.platform.domain.User;
import dev.blog.platform.domain.command.LoginCommand;
import dev.blog.platform.domain.command.RegisterCommand;
import dev.blog.platform.exception.InvalidCredentialsException;
import dev.blog.platform.repository.UserRepository;
import dev.blog.platform.security.AuthenticatedUser;
import dev.blog.platform.security.BearerTokens;
import dev.blog.platform.security.JwtService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Registration, login and bearer-token authentication
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final JwtService jwtService;
    private final CommandValidator commandValidator;
    private final MeterRegistry meterRegistry;

    /**
     * Verified against when the email is unknown so both login failures cost one Argon2 run
     */
    private final Password timingDummy = Password.hash("timing-equaliser-password");

    /**
     * Register a new user.
     * Duplicates are detected by the store's unique constraints, not by a prior lookup.
     */
    public AuthResult register(RegisterCommand command) {
        commandValidator.validate(command);

        Password passwordHash = Password.hash(command.getPassword());
        User user = userRepository.create(command.getUsername(), command.getEmail(), passwordHash);

        String token = jwtService.generateToken(user.getId(), user.getUsername());
        meterRegistry.counter("blog.auth.registrations").increment();
        log.info("User registered: userId={}, username={}", user.getId(), user.getUsername());
        return new AuthResult(token, user);
    }

    /**
     * Log in by email. Unknown email and wrong password raise the same error.
     */
    public AuthResult login(LoginCommand command) {
        commandValidator.validate(command);

        User user = userRepository.findByEmail(command.getEmail()).orElse(null);
        if (user == null) {
            timingDummy.verify(command.getPassword());
            throw loginFailed();
        }
        if (!user.getPasswordHash().verify(command.getPassword())) {
            throw loginFailed();
        }

        String token = jwtService.generateToken(user.getId(), user.getUsername());
        meterRegistry.counter("blog.auth.logins", "outcome", "success").increment();
        log.info("User logged in: userId={}", user.getId());
        return new AuthResult(token, user);
    }

    private InvalidCredentialsException loginFailed() {
        meterRegistry.counter("blog.auth.logins", "outcome", "failure").increment();
        log.warn("Login failed");
        return new InvalidCredentialsException();
    }

    /**
     * Resolve the caller from an {@code Authorization} value
     *
     * @throws dev.blog.platform.exception.JwtTokenException if the header is missing or the token is invalid
     */
    public AuthenticatedUser authenticate(String authorization) {
        String token = BearerTokens.extract(authorization);
        return AuthenticatedUser.fromClaims(jwtService.verifyToken(token));
    }
}
