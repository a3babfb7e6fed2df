package dev.corebanking.identity.dto;

import dev.corebanking.identity.service.NotificationOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProvisioningResult {
    private UserResponse user;
    private NotificationOutcome credentialsEmail;
}
