package dev.blog.platform.dto;

import dev.blog.platform.domain.AuthResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Authentication response")
public class AuthResponse {

    @Schema(description = "Signed bearer token")
    private String token;

    private UserResponse user;

    public static AuthResponse fromResult(AuthResult result) {
        return AuthResponse.builder()
                .token(result.getToken())
                .user(UserResponse.fromUser(result.getUser()))
                .build();
    }
}
