package dev.blog.platform.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for Prometheus monitoring
 * Auth counters are registered lazily by AuthService; this only adds the tags every meter shares
 */
@Slf4j
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> serviceTagCustomizer(
            @Value("${spring.application.name:blog-platform}") String serviceName) {
        return registry -> {
            registry.config().commonTags("service", serviceName);
            log.info("Registered common metric tag: service={}, registry={}",
                    serviceName, registry.getClass().getSimpleName());
        };
    }
}
