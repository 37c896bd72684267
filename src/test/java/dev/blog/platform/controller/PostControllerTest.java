package dev.blog.platform.controller;

import dev.blog.platform.BaseIntegrationTest;
import dev.blog.platform.domain.AuthResult;
import dev.blog.platform.domain.Post;
import dev.blog.platform.security.BearerTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface tests: status codes, error bodies and ownership rules
 */
@AutoConfigureMockMvc
@DisplayName("Post Controller Tests")
class PostControllerTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private AuthResult alice;
    private AuthResult bob;

    @BeforeEach
    void setUp() {
        alice = registerUser("alice");
        bob = registerUser("bob");
    }

    @Test
    @DisplayName("Register returns 201 with token and user, duplicate returns 409")
    void testRegister() throws Exception {
        String body = "{\"username\":\"carol\",\"email\":\"carol@example.com\",\"password\":\"password123\"}";

        mockMvc.perform(post("/api/v1/auth/register").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token").isNotEmpty())
                .andExpect(jsonPath("$.user.username").value("carol"))
                .andExpect(jsonPath("$.user.created_at").isNotEmpty())
                .andExpect(jsonPath("$.user.password_hash").doesNotExist());

        mockMvc.perform(post("/api/v1/auth/register").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("User already exists"))
                .andExpect(jsonPath("$.status").value(409))
                .andExpect(jsonPath("$.timestamp").isNumber());
    }

    @Test
    @DisplayName("Invalid registration input returns 400")
    void testRegisterValidation() throws Exception {
        mockMvc.perform(post("/api/v1/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"carol\",\"email\":\"carol@example.com\",\"password\":\"short\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Password must be at least 8 characters"));
    }

    @Test
    @DisplayName("Login succeeds with the right password and returns 401 otherwise")
    void testLogin() throws Exception {
        mockMvc.perform(post("/api/v1/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"password123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.id").value(alice.getUser().getId()));

        mockMvc.perform(post("/api/v1/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@example.com\",\"password\":\"wrong-password\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid credentials"));
    }

    @Test
    @DisplayName("Mutations without a valid bearer token return 401")
    void testUnauthenticated() throws Exception {
        String body = "{\"title\":\"Hello\",\"content\":\"World\"}";

        mockMvc.perform(post("/api/v1/posts").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Missing authorization header"));

        mockMvc.perform(post("/api/v1/posts").contentType(MediaType.APPLICATION_JSON).content(body)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid token"));

        mockMvc.perform(delete("/api/v1/posts/1").header(HttpHeaders.AUTHORIZATION, "Token abc"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Create returns 201 with the author's username")
    void testCreatePost() throws Exception {
        mockMvc.perform(post("/api/v1/posts").contentType(MediaType.APPLICATION_JSON)
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice))
                        .content("{\"title\":\"Hello\",\"content\":\"World\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.title").value("Hello"))
                .andExpect(jsonPath("$.author_id").value(alice.getUser().getId()))
                .andExpect(jsonPath("$.author_username").value("alice"))
                .andExpect(jsonPath("$.updated_at").isNotEmpty());
    }

    @Test
    void testCreatePostBlankTitle() throws Exception {
        mockMvc.perform(post("/api/v1/posts").contentType(MediaType.APPLICATION_JSON)
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice))
                        .content("{\"title\":\"\",\"content\":\"World\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Title cannot be blank"));
    }

    @Test
    @DisplayName("Update and delete by a non-owner return 403, by the owner succeed")
    void testOwnership() throws Exception {
        Post post = createPost(alice.getUser().getId(), "Original");
        String body = "{\"title\":\"Changed\",\"content\":\"New\"}";

        mockMvc.perform(put("/api/v1/posts/{id}", post.getId()).contentType(MediaType.APPLICATION_JSON)
                        .header(HttpHeaders.AUTHORIZATION, bearer(bob)).content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value(startsWith("Forbidden")));

        mockMvc.perform(delete("/api/v1/posts/{id}", post.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(bob)))
                .andExpect(status().isForbidden());

        mockMvc.perform(put("/api/v1/posts/{id}", post.getId()).contentType(MediaType.APPLICATION_JSON)
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice)).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Changed"));

        mockMvc.perform(delete("/api/v1/posts/{id}", post.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/posts/{id}", post.getId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Post not found"));
    }

    @Test
    @DisplayName("Mutating a missing post returns 404")
    void testMissingPost() throws Exception {
        mockMvc.perform(put("/api/v1/posts/{id}", 999999).contentType(MediaType.APPLICATION_JSON)
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice))
                        .content("{\"title\":\"T\",\"content\":\"C\"}"))
                .andExpect(status().isNotFound());

        mockMvc.perform(delete("/api/v1/posts/{id}", 999999)
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Non-numeric ID and malformed JSON return 400")
    void testBadInput() throws Exception {
        mockMvc.perform(get("/api/v1/posts/abc"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/posts").contentType(MediaType.APPLICATION_JSON)
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice))
                        .content("{\"title\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    @DisplayName("Bodies that are not JSON return 415")
    void testUnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/api/v1/auth/register").contentType(MediaType.TEXT_PLAIN)
                        .content("{\"username\":\"carol\",\"email\":\"carol@example.com\",\"password\":\"password123\"}"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error").value("Unsupported media type"))
                .andExpect(jsonPath("$.status").value(415));

        mockMvc.perform(post("/api/v1/posts")
                        .header(HttpHeaders.AUTHORIZATION, bearer(alice))
                        .content("{\"title\":\"Hello\",\"content\":\"World\"}"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.status").value(415));
    }

    @Test
    void testNotAcceptable() throws Exception {
        mockMvc.perform(get("/api/v1/health").accept(MediaType.IMAGE_PNG))
                .andExpect(status().isNotAcceptable());
    }

    @Test
    @DisplayName("List clamps the limit and reports the total")
    void testListPosts() throws Exception {
        for (int i = 0; i < 3; i++) {
            createPost(alice.getUser().getId(), "Post " + i);
        }

        mockMvc.perform(get("/api/v1/posts").param("limit", "1000").param("offset", "-5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit").value(100))
                .andExpect(jsonPath("$.offset").value(0))
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.posts[0].title").value("Post 2"));

        mockMvc.perform(get("/api/v1/posts"))
                .andExpect(jsonPath("$.limit").value(10));
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.timestamp").isNotEmpty());
    }

    private static String bearer(AuthResult result) {
        return BearerTokens.headerValue(result.getToken());
    }
}
