package dev.corebanking.identity.entity;

import dev.corebanking.identity.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalised (trimmed, lower-case) email address.
 */
public record EmailAddress(String value) {

    private static final Pattern FORMAT = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final int MAX_LENGTH = 255;

    public EmailAddress {
        if (value == null || value.length() > MAX_LENGTH || !FORMAT.matcher(value).matches()) {
            throw new ValidationException("Invalid email format");
        }
    }

    public static EmailAddress of(String raw) {
        if (raw == null) {
            throw new ValidationException("Invalid email format");
        }
        return new EmailAddress(raw.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return value;
    }
}
