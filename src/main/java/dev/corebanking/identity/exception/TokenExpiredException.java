package dev.corebanking.identity.exception;

public class TokenExpiredException extends AuthenticationFailedException {

    public TokenExpiredException() {
        super(ErrorCode.TOKEN_EXPIRED, "Token expired");
    }
}
