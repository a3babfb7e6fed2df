package dev.corebanking.identity.exception;

public class InvalidCredentialsException extends AuthenticationFailedException {

    public InvalidCredentialsException() {
        super(ErrorCode.INVALID_CREDENTIALS, "Invalid credentials");
    }
}
