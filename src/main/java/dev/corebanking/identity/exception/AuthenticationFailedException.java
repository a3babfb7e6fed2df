package dev.corebanking.identity.exception;

/**
 * Parent of all authentication failures. Messages stay deliberately vague
 * wherever a precise one would reveal whether an account or tenant exists.
 */
public abstract class AuthenticationFailedException extends IdentityException {

    protected AuthenticationFailedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
