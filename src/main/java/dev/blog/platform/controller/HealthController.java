package dev.blog.platform.controller;

import dev.blog.platform.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final Clock clock;

    @GetMapping("/api/v1/health")
    @Operation(summary = "Liveness check")
    public HealthResponse health() {
        return new HealthResponse("ok", OffsetDateTime.now(clock));
    }
}
