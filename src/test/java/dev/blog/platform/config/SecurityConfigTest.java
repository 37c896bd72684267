package dev.blog.platform.config;

import dev.blog.platform.security.JwtService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.PropertyPlaceholderAutoConfiguration;
import org.springframework.boot.convert.ApplicationConversionService;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Security Config Tests")
class SecurityConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PropertyPlaceholderAutoConfiguration.class))
            .withInitializer(context -> context.getBeanFactory()
                    .setConversionService(ApplicationConversionService.getSharedInstance()))
            .withUserConfiguration(SecurityConfig.class);

    @Test
    @DisplayName("Runtime config reads the signing secret from the environment without a fallback")
    void testSecretHasNoDefault() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));

        assertThat(sources).isNotEmpty();
        assertThat(sources.get(0).getProperty("blog.jwt.secret")).hasToString("${JWT_SECRET}");
    }

    @Test
    @DisplayName("Context refuses to start without a signing secret")
    void testMissingSecretFailsStartup() {
        runner.run(context -> assertThat(context).hasFailed()
                        .getFailure().isInstanceOf(BeanCreationException.class));
    }

    @Test
    void testSecretProvided() {
        runner.withPropertyValues("blog.jwt.secret=a-deployment-secret-that-is-long-enough")
                .run(context -> assertThat(context).hasNotFailed().hasSingleBean(JwtService.class));
    }
}
