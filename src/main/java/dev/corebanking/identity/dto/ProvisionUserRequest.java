package dev.corebanking.identity.dto;

import dev.corebanking.identity.entity.UserRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

/**
 * Administrator-created account; the password is generated and emailed.
 */
@Builder(toBuilder = true)
public record ProvisionUserRequest(
    @NotBlank(message = "Email is required")
    @Size(max = 255, message = "Email must be at most 255 characters")
    String email,

    @NotBlank(message = "First name is required")
    @Size(max = 100, message = "First name must be at most 100 characters")
    String firstName,

    @NotBlank(message = "Last name is required")
    @Size(max = 100, message = "Last name must be at most 100 characters")
    String lastName,

    String phone,

    @NotNull(message = "Role is required")
    UserRole role,

    @NotBlank(message = "Tenant is required")
    String tenantSlug,

    @NotBlank(message = "Creator is required")
    String createdBy
) {}
