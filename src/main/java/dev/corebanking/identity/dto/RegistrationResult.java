package dev.corebanking.identity.dto;

import dev.corebanking.identity.service.NotificationOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The new user's id and whether the verification email went out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationResult {
    private String userId;
    private NotificationOutcome verificationEmail;
}
