package dev.corebanking.identity.dto;

import dev.corebanking.identity.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Public view of a user; never carries the hash or one-time tokens.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private String id;
    private String email;
    private String firstName;
    private String lastName;
    private String phone;
    private String role;
    private String status;
    private boolean emailVerified;
    private LocalDateTime lastLoginAt;

    public static UserResponse fromUser(User user) {
        return UserResponse.builder()
                .id(user.id())
                .email(user.email())
                .firstName(user.firstName())
                .lastName(user.lastName())
                .phone(user.phone())
                .role(user.role().name())
                .status(user.status().name())
                .emailVerified(user.emailVerified())
                .lastLoginAt(user.lastLoginAt())
                .build();
    }
}
