package dev.corebanking.identity.entity;

import lombok.Builder;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A user of exactly one tenant. Immutable: every state change is a pure
 * transition that returns the next {@code User}, taking the current time as an argument.
 *
 * <p>Lockout policy: {@value #MAX_FAILED_ATTEMPTS} consecutive failed logins lock an
 * ACTIVE account for {@link #LOCK_DURATION}; the lock is lifted lazily by
 * {@link #unlockIfExpired(LocalDateTime)} once that window has passed.</p>
 */
@Builder(toBuilder = true)
public record User(
        String id,
        String email,
        String passwordHash,
        String firstName,
        String lastName,
        String phone,
        UserRole role,
        UserStatus status,
        boolean emailVerified,
        int failedLoginAttempts,
        LocalDateTime lockedUntil,
        String emailVerificationToken,
        LocalDateTime emailVerificationExpires,
        String passwordResetToken,
        LocalDateTime passwordResetExpires,
        LocalDateTime lastLoginAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        String createdBy
) {

    public static final int MAX_FAILED_ATTEMPTS = 5;
    public static final Duration LOCK_DURATION = Duration.ofMinutes(30);

    public User {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(status, "status");
        if (failedLoginAttempts < 0) {
            throw new IllegalArgumentException("failedLoginAttempts must be >= 0");
        }
        if (status == UserStatus.LOCKED && lockedUntil == null) {
            throw new IllegalArgumentException("A LOCKED user requires lockedUntil");
        }
    }

    /**
     * New self-service or admin-created account: ACTIVE, unverified, no failed attempts.
     */
    public static User newAccount(String id, EmailAddress email, String passwordHash, String firstName,
                                  String lastName, PhoneNumber phone, UserRole role, String createdBy,
                                  LocalDateTime now) {
        return User.builder()
                .id(id)
                .email(email.value())
                .passwordHash(passwordHash)
                .firstName(firstName)
                .lastName(lastName)
                .phone(phone != null ? phone.value() : null)
                .role(role)
                .status(UserStatus.ACTIVE)
                .emailVerified(false)
                .failedLoginAttempts(0)
                .createdAt(now)
                .updatedAt(now)
                .createdBy(createdBy)
                .build();
    }

    // ── Lockout ──────────────────────────────────────────────────────────────

    public boolean isLocked(LocalDateTime now) {
        return status == UserStatus.LOCKED && lockedUntil.isAfter(now);
    }

    /**
     * Lifts an expired lock: back to ACTIVE with the counter reset.
     * Returns {@code this} when there is nothing to lift.
     */
    public User unlockIfExpired(LocalDateTime now) {
        if (status != UserStatus.LOCKED || lockedUntil.isAfter(now)) {
            return this;
        }
        return unlock(now);
    }

    /**
     * Counts a failed login. An ACTIVE account reaching {@value #MAX_FAILED_ATTEMPTS}
     * becomes LOCKED; a lock still in force is never extended, and SUSPENDED or
     * INACTIVE accounts only accumulate the counter.
     */
    public User registerFailedLogin(LocalDateTime now) {
        if (isLocked(now)) {
            return this;
        }
        User next = toBuilder()
                .failedLoginAttempts(failedLoginAttempts + 1)
                .updatedAt(now)
                .build();
        if (next.status == UserStatus.ACTIVE && next.failedLoginAttempts >= MAX_FAILED_ATTEMPTS) {
            return next.lock(now);
        }
        return next;
    }

    public User lock(LocalDateTime now) {
        return toBuilder()
                .status(UserStatus.LOCKED)
                .lockedUntil(now.plus(LOCK_DURATION))
                .updatedAt(now)
                .build();
    }

    public User unlock(LocalDateTime now) {
        if (status != UserStatus.LOCKED) {
            return this;
        }
        return toBuilder()
                .status(UserStatus.ACTIVE)
                .lockedUntil(null)
                .failedLoginAttempts(0)
                .updatedAt(now)
                .build();
    }

    public User recordLogin(LocalDateTime now) {
        return toBuilder()
                .lastLoginAt(now)
                .failedLoginAttempts(0)
                .updatedAt(now)
                .build();
    }

    // ── Email verification ──────────────────────────────────────────────────

    public User withEmailVerificationToken(String token, LocalDateTime expires, LocalDateTime now) {
        return toBuilder()
                .emailVerificationToken(token)
                .emailVerificationExpires(expires)
                .updatedAt(now)
                .build();
    }

    public boolean isEmailVerificationTokenValid(String token, LocalDateTime now) {
        return token != null
                && token.equals(emailVerificationToken)
                && emailVerificationExpires != null
                && emailVerificationExpires.isAfter(now);
    }

    public User verifyEmail(LocalDateTime now) {
        if (emailVerified) {
            throw new IllegalStateException("Email already verified");
        }
        return toBuilder()
                .emailVerified(true)
                .emailVerificationToken(null)
                .emailVerificationExpires(null)
                .updatedAt(now)
                .build();
    }

    /**
     * Marks the address verified up front, for accounts whose email an administrator vouches for.
     */
    public User markEmailVerified(LocalDateTime now) {
        return toBuilder()
                .emailVerified(true)
                .emailVerificationToken(null)
                .emailVerificationExpires(null)
                .updatedAt(now)
                .build();
    }

    // ── Passwords ───────────────────────────────────────────────────────────

    public User withPasswordResetToken(String token, LocalDateTime expires, LocalDateTime now) {
        return toBuilder()
                .passwordResetToken(token)
                .passwordResetExpires(expires)
                .updatedAt(now)
                .build();
    }

    public boolean isPasswordResetTokenValid(String token, LocalDateTime now) {
        return token != null
                && token.equals(passwordResetToken)
                && passwordResetExpires != null
                && passwordResetExpires.isAfter(now);
    }

    /**
     * Token-based reset: new hash, reset fields consumed, lock and counter cleared.
     */
    public User resetPassword(String newPasswordHash, LocalDateTime now) {
        return unlock(now).toBuilder()
                .passwordHash(newPasswordHash)
                .passwordResetToken(null)
                .passwordResetExpires(null)
                .failedLoginAttempts(0)
                .updatedAt(now)
                .build();
    }

    public User changePassword(String newPasswordHash, LocalDateTime now) {
        return toBuilder()
                .passwordHash(newPasswordHash)
                .failedLoginAttempts(0)
                .updatedAt(now)
                .build();
    }

    // ── Administrative status ───────────────────────────────────────────────

    public User suspend(LocalDateTime now) {
        return toBuilder().status(UserStatus.SUSPENDED).updatedAt(now).build();
    }

    public User activate(LocalDateTime now) {
        return toBuilder().status(UserStatus.ACTIVE).lockedUntil(null).updatedAt(now).build();
    }

    public User deactivate(LocalDateTime now) {
        return toBuilder().status(UserStatus.INACTIVE).updatedAt(now).build();
    }

    @Override
    public String toString() {
        return "User{id=" + id + ", email=" + email + ", role=" + role + ", status=" + status
                + ", emailVerified=" + emailVerified + ", failedLoginAttempts=" + failedLoginAttempts + "}";
    }
}
