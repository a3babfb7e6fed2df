package dev.corebanking.identity.exception;

public class TokenRevokedException extends AuthenticationFailedException {

    public TokenRevokedException() {
        super(ErrorCode.TOKEN_REVOKED, "Token has been revoked");
    }
}
