package dev.blog.platform.config;

import dev.blog.platform.security.JwtService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Token service and clock wiring
 */
@Slf4j
@Configuration
public class SecurityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JwtService jwtService(@Value("${blog.jwt.secret}") String secret,
                                 @Value("${blog.jwt.ttl:24h}") Duration ttl,
                                 Clock clock) {
        log.info("JWT service configured: ttl={}", ttl);
        return new JwtService(secret, ttl, clock);
    }
}
