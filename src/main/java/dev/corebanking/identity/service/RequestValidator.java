package dev.corebanking.identity.service;

import dev.corebanking.identity.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Bean Validation of inbound request records. Violations become a single
 * {@link ValidationException} whose details read {@code field: message}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private final Validator validator;

    public <T> Mono<T> validate(T request) {
        if (request == null) {
            return Mono.error(new ValidationException("Request is required"));
        }
        return Mono.fromCallable(() -> {
            Set<ConstraintViolation<T>> violations = validator.validate(request);
            if (!violations.isEmpty()) {
                List<String> details = violations.stream()
                        .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                        .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                        .toList();
                log.debug("Rejected {}: {}", request.getClass().getSimpleName(), details);
                throw new ValidationException("Validation failed", details);
            }
            return request;
        });
    }
}
