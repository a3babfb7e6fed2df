package dev.corebanking.identity.exception;

public class ResourceNotFoundException extends IdentityException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    protected ResourceNotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
