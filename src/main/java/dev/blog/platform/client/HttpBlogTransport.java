package dev.blog.platform.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.blog.platform.config.JacksonConfig;
import dev.blog.platform.dto.AuthResponse;
import dev.blog.platform.dto.ErrorResponse;
import dev.blog.platform.dto.LoginRequest;
import dev.blog.platform.dto.PostListResponse;
import dev.blog.platform.dto.PostRequest;
import dev.blog.platform.dto.PostResponse;
import dev.blog.platform.dto.RegisterRequest;
import dev.blog.platform.security.BearerTokens;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * REST transport over {@code /api/v1} using Spring's {@link RestClient}
 */
@Slf4j
public class HttpBlogTransport implements Transport {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public HttpBlogTransport(String baseUrl) {
        this.objectMapper = JacksonConfig.blogObjectMapper();
        this.restClient = RestClient.builder()
                .baseUrl(stripTrailingSlash(baseUrl) + "/api/v1")
                .messageConverters(converters -> {
                    converters.removeIf(c -> c instanceof MappingJackson2HttpMessageConverter);
                    converters.add(0, new MappingJackson2HttpMessageConverter(objectMapper));
                })
                .defaultStatusHandler(HttpStatusCode::isError, (request, response) -> {
                    throw toClientException(response);
                })
                .build();
    }

    @Override
    public AuthResponse register(String username, String email, String password) {
        return call(() -> restClient.post()
                .uri("/auth/register")
                .body(new RegisterRequest(username, email, password))
                .retrieve()
                .body(AuthResponse.class));
    }

    @Override
    public AuthResponse login(String email, String password) {
        return call(() -> restClient.post()
                .uri("/auth/login")
                .body(new LoginRequest(email, password))
                .retrieve()
                .body(AuthResponse.class));
    }

    @Override
    public PostResponse createPost(String token, String title, String content) {
        return call(() -> restClient.post()
                .uri("/posts")
                .header(HttpHeaders.AUTHORIZATION, BearerTokens.headerValue(token))
                .body(new PostRequest(title, content))
                .retrieve()
                .body(PostResponse.class));
    }

    @Override
    public PostResponse getPost(long postId) {
        return call(() -> restClient.get()
                .uri("/posts/{id}", postId)
                .retrieve()
                .body(PostResponse.class));
    }

    @Override
    public PostResponse updatePost(String token, long postId, String title, String content) {
        return call(() -> restClient.put()
                .uri("/posts/{id}", postId)
                .header(HttpHeaders.AUTHORIZATION, BearerTokens.headerValue(token))
                .body(new PostRequest(title, content))
                .retrieve()
                .body(PostResponse.class));
    }

    @Override
    public void deletePost(String token, long postId) {
        call(() -> restClient.delete()
                .uri("/posts/{id}", postId)
                .header(HttpHeaders.AUTHORIZATION, BearerTokens.headerValue(token))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public PostListResponse listPosts(Long limit, Long offset) {
        return call(() -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/posts")
                        .queryParamIfPresent("limit", Optional.ofNullable(limit))
                        .queryParamIfPresent("offset", Optional.ofNullable(offset))
                        .build())
                .retrieve()
                .body(PostListResponse.class));
    }

    @Override
    public void close() {
        // RestClient holds no resources of its own
    }

    private static <T> T call(Supplier<T> request) {
        try {
            return request.get();
        } catch (ResourceAccessException e) {
            throw new BlogClientException(ClientErrorKind.TRANSPORT, "HTTP request failed: " + e.getMessage(), e);
        }
    }

    private BlogClientException toClientException(ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String message = readErrorMessage(response);
        log.debug("HTTP call failed: status={}, error={}", status, message);
        return new BlogClientException(kindOf(status), message);
    }

    private String readErrorMessage(ClientHttpResponse response) throws IOException {
        try (InputStream body = response.getBody()) {
            ErrorResponse error = objectMapper.readValue(body, ErrorResponse.class);
            if (error != null && error.getError() != null) {
                return error.getError();
            }
        } catch (IOException e) {
            log.debug("Unreadable error body: {}", e.getMessage());
        }
        return "HTTP " + response.getStatusCode().value();
    }

    static ClientErrorKind kindOf(int status) {
        if (status >= 500) {
            return ClientErrorKind.SERVER_ERROR;
        }
        return switch (status) {
            case 401 -> ClientErrorKind.UNAUTHORIZED;
            case 403 -> ClientErrorKind.FORBIDDEN;
            case 404 -> ClientErrorKind.NOT_FOUND;
            case 409 -> ClientErrorKind.CONFLICT;
            default -> ClientErrorKind.INVALID_REQUEST;
        };
    }

    private static String stripTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
