package dev.corebanking.identity.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for password complexity validation.
 * Enforces: min 8 chars, at least 1 uppercase, 1 lowercase, 1 digit, 1 special character.
 */
public final class PasswordValidator {

    public static final int MIN_LENGTH = 8;

    private PasswordValidator() {
    }

    /**
     * Evaluates every rule, so callers can report the complete list at once.
     */
    public static PasswordStrength check(String password) {
        List<String> errors = new ArrayList<>();
        if (password == null || password.length() < MIN_LENGTH) {
            errors.add("At least " + MIN_LENGTH + " characters");
        }
        if (password == null) {
            errors.add("At least one uppercase letter");
            errors.add("At least one lowercase letter");
            errors.add("At least one number");
            errors.add("At least one special character");
            return PasswordStrength.of(errors);
        }
        if (password.chars().noneMatch(Character::isUpperCase)) {
            errors.add("At least one uppercase letter");
        }
        if (password.chars().noneMatch(Character::isLowerCase)) {
            errors.add("At least one lowercase letter");
        }
        if (password.chars().noneMatch(Character::isDigit)) {
            errors.add("At least one number");
        }
        if (password.chars().allMatch(c -> Character.isLetterOrDigit(c) || Character.isWhitespace(c))) {
            errors.add("At least one special character");
        }
        return PasswordStrength.of(errors);
    }
}
