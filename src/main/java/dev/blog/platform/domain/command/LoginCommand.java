package dev.blog.platform.domain.command;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Domain command for user login (keyed by email)
 */
@Value
@Builder
public class LoginCommand {

    @NotBlank(message = "Email cannot be blank")
    String email;

    @NotBlank(message = "Password cannot be blank")
    @ToString.Exclude
    String password;
}
