package dev.corebanking.identity.exception;

public class DuplicateEmailException extends IdentityException {

    public DuplicateEmailException() {
        super(ErrorCode.DUPLICATE_EMAIL, "User with this email already exists");
    }
}
