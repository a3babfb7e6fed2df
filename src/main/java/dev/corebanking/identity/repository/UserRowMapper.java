package dev.corebanking.identity.repository;

import dev.corebanking.identity.entity.User;
import dev.corebanking.identity.entity.UserRole;
import dev.corebanking.identity.entity.UserStatus;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;

import java.time.LocalDateTime;
import java.util.function.BiFunction;

/**
 * Maps a {@code users} row (snake_case columns) to a {@link User}.
 */
final class UserRowMapper implements BiFunction<Row, RowMetadata, User> {

    static final UserRowMapper INSTANCE = new UserRowMapper();

    private UserRowMapper() {
    }

    @Override
    public User apply(Row row, RowMetadata metadata) {
        Boolean emailVerified = row.get("email_verified", Boolean.class);
        Integer failedAttempts = row.get("failed_login_attempts", Integer.class);
        return User.builder()
                .id(row.get("id", String.class))
                .email(row.get("email", String.class))
                .passwordHash(row.get("password_hash", String.class))
                .firstName(row.get("first_name", String.class))
                .lastName(row.get("last_name", String.class))
                .phone(row.get("phone", String.class))
                .role(UserRole.valueOf(row.get("role", String.class)))
                .status(UserStatus.valueOf(row.get("status", String.class)))
                .emailVerified(Boolean.TRUE.equals(emailVerified))
                .failedLoginAttempts(failedAttempts != null ? failedAttempts : 0)
                .lockedUntil(row.get("locked_until", LocalDateTime.class))
                .emailVerificationToken(row.get("email_verification_token", String.class))
                .emailVerificationExpires(row.get("email_verification_expires", LocalDateTime.class))
                .passwordResetToken(row.get("password_reset_token", String.class))
                .passwordResetExpires(row.get("password_reset_expires", LocalDateTime.class))
                .lastLoginAt(row.get("last_login_at", LocalDateTime.class))
                .createdAt(row.get("created_at", LocalDateTime.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .createdBy(row.get("created_by", String.class))
                .build();
    }
}
