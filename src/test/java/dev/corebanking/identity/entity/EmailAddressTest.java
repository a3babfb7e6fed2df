package dev.corebanking.identity.entity;

import dev.corebanking.identity.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmailAddressTest {

    @Test
    @DisplayName("should trim and lower-case the address")
    void of_ShouldNormalise() {
        assertThat(EmailAddress.of("  John.Smith@Example.COM ").value()).isEqualTo("john.smith@example.com");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "plainaddress", "no-at.example.com", "a@b", "with space@example.com"})
    @DisplayName("should reject malformed addresses")
    void of_ShouldRejectMalformed(String raw) {
        assertThatThrownBy(() -> EmailAddress.of(raw))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid email format");
    }

    @Test
    @DisplayName("should reject addresses longer than 255 characters")
    void of_ShouldRejectTooLong() {
        String local = "a".repeat(250);
        assertThatThrownBy(() -> EmailAddress.of(local + "@example.com"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("phone numbers should follow E.164")
    void phoneNumber_ShouldFollowE164() {
        assertThat(PhoneNumber.ofNullable("+14155550123").value()).isEqualTo("+14155550123");
        assertThat(PhoneNumber.ofNullable("  ")).isNull();
        assertThat(PhoneNumber.ofNullable(null)).isNull();
        assertThatThrownBy(() -> PhoneNumber.ofNullable("4155550123")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> PhoneNumber.ofNullable("+0123")).isInstanceOf(ValidationException.class);
    }
}
