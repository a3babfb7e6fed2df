package dev.corebanking.identity.exception;

public class EmailNotVerifiedException extends AuthenticationFailedException {

    public EmailNotVerifiedException() {
        super(ErrorCode.EMAIL_NOT_VERIFIED, "Email not verified. Please verify your email first.");
    }
}
