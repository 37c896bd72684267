package dev.blog.platform.dto;

import dev.blog.platform.domain.command.RegisterCommand;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Register user request")
public class RegisterRequest {

    @Schema(description = "Username", example = "alice")
    private String username;

    @Schema(description = "Email address", example = "alice@example.com")
    private String email;

    @Schema(description = "Password (at least 8 characters)", example = "securePassword123")
    @ToString.Exclude
    private String password;

    public RegisterCommand toCommand() {
        return RegisterCommand.builder()
                .username(username)
                .email(email)
                .password(password)
                .build();
    }
}
