package dev.blog.platform.dto;

import dev.blog.platform.domain.command.LoginCommand;
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
@Schema(description = "Login request")
public class LoginRequest {

    @Schema(description = "Email address", example = "alice@example.com")
    private String email;

    @Schema(description = "Password", example = "securePassword123")
    @ToString.Exclude
    private String password;

    public LoginCommand toCommand() {
        return LoginCommand.builder()
                .email(email)
                .password(password)
                .build();
    }
}
