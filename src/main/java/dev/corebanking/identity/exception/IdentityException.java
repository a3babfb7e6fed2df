package dev.corebanking.identity.exception;

/**
 * Base type for every typed failure raised at the identity boundary.
 * Business-rule violations are never retried internally; only
 * {@link ConnectivityException} reports itself as retryable.
 */
public abstract class IdentityException extends RuntimeException {

    private final ErrorCode errorCode;

    protected IdentityException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected IdentityException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }

    public boolean isRetryable() {
        return false;
    }
}
