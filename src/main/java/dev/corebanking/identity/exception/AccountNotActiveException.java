package dev.corebanking.identity.exception;

public class AccountNotActiveException extends AuthenticationFailedException {

    public AccountNotActiveException() {
        super(ErrorCode.ACCOUNT_NOT_ACTIVE, "Account is not active");
    }
}
