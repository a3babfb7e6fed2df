package dev.corebanking.identity.util;

import java.util.List;

/**
 * Outcome of a password strength check. {@code violations} lists every rule the candidate broke.
 */
public record PasswordStrength(boolean valid, List<String> violations) {

    public PasswordStrength {
        violations = List.copyOf(violations);
    }

    public static PasswordStrength of(List<String> violations) {
        return new PasswordStrength(violations.isEmpty(), violations);
    }
}
