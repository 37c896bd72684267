package dev.blog.platform.service;

import dev.blog.platform.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs Bean Validation on domain commands so both transports reject the same input the same way
 */
@Component
@RequiredArgsConstructor
public class CommandValidator {

    private final Validator validator;

    /**
     * @throws ValidationException listing every violated constraint, ordered by field name
     */
    public <T> T validate(T command) {
        if (command == null) {
            throw new ValidationException("Request body is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(command);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(ConstraintViolation::getMessage)
                    .collect(Collectors.joining("; "));
            throw new ValidationException(message);
        }
        return command;
    }
}
