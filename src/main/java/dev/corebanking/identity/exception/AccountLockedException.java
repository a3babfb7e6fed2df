package dev.corebanking.identity.exception;

import java.time.LocalDateTime;

/**
 * Exception thrown when a user account is temporarily locked due to too many failed login attempts.
 */
public class AccountLockedException extends AuthenticationFailedException {

    private final LocalDateTime lockedUntil;

    public AccountLockedException(LocalDateTime lockedUntil) {
        super(ErrorCode.ACCOUNT_LOCKED, "Account is locked. Please try again later.");
        this.lockedUntil = lockedUntil;
    }

    public LocalDateTime getLockedUntil() {
        return lockedUntil;
    }
}
