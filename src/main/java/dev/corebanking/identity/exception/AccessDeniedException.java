package dev.corebanking.identity.exception;

/**
 * The caller is authenticated but may not perform the operation: wrong role,
 * or a tenant other than its own.
 */
public class AccessDeniedException extends IdentityException {

    public AccessDeniedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
