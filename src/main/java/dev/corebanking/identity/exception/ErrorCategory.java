package dev.corebanking.identity.exception;

/**
 * Coarse classification of identity failures, used by callers to pick a response class.
 */
public enum ErrorCategory {
    VALIDATION,
    AUTHENTICATION,
    FORBIDDEN,
    NOT_FOUND,
    CONFLICT,
    CONNECTIVITY
}
