package dev.corebanking.identity.exception;

/**
 * Stable machine-readable codes carried by every {@link IdentityException}.
 */
public enum ErrorCode {
    VALIDATION_ERROR(ErrorCategory.VALIDATION),
    WEAK_PASSWORD(ErrorCategory.VALIDATION),
    INVALID_OR_EXPIRED_TOKEN(ErrorCategory.VALIDATION),
    INCORRECT_PASSWORD(ErrorCategory.VALIDATION),
    INVALID_CREDENTIALS(ErrorCategory.AUTHENTICATION),
    ACCOUNT_LOCKED(ErrorCategory.AUTHENTICATION),
    EMAIL_NOT_VERIFIED(ErrorCategory.AUTHENTICATION),
    ACCOUNT_NOT_ACTIVE(ErrorCategory.AUTHENTICATION),
    TOKEN_EXPIRED(ErrorCategory.AUTHENTICATION),
    TOKEN_INVALID(ErrorCategory.AUTHENTICATION),
    TOKEN_REVOKED(ErrorCategory.AUTHENTICATION),
    INSUFFICIENT_PERMISSIONS(ErrorCategory.FORBIDDEN),
    CROSS_TENANT_ACCESS_DENIED(ErrorCategory.FORBIDDEN),
    NOT_FOUND(ErrorCategory.NOT_FOUND),
    TENANT_NOT_FOUND(ErrorCategory.NOT_FOUND),
    DUPLICATE_EMAIL(ErrorCategory.CONFLICT),
    CONNECTIVITY_ERROR(ErrorCategory.CONNECTIVITY);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
