package dev.corebanking.identity.entity;

import dev.corebanking.identity.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Phone number in E.164 form: {@code +[country code][number]}, at most 15 digits.
 */
public record PhoneNumber(String value) {

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");

    public PhoneNumber {
        if (value == null || !E164.matcher(value).matches()) {
            throw new ValidationException("Invalid phone format. Expected format: +[country code][number]");
        }
    }

    /**
     * @return the parsed number, or {@code null} when {@code raw} is null or blank
     */
    public static PhoneNumber ofNullable(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return new PhoneNumber(raw.trim());
    }

    @Override
    public String toString() {
        return value;
    }
}
