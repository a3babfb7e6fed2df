package dev.corebanking.identity.exception;

import java.util.List;

/**
 * An email verification or password reset token did not match, was already used or has expired.
 */
public class InvalidOrExpiredTokenException extends ValidationException {

    public InvalidOrExpiredTokenException(String message) {
        super(ErrorCode.INVALID_OR_EXPIRED_TOKEN, message, List.of());
    }
}
