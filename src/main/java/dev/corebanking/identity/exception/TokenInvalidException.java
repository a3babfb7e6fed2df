package dev.corebanking.identity.exception;

public class TokenInvalidException extends AuthenticationFailedException {

    public TokenInvalidException(String message) {
        super(ErrorCode.TOKEN_INVALID, message);
    }
}
