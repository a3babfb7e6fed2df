package dev.corebanking.identity.service;

/**
 * Result of a best-effort notification. A failed send never fails the operation that triggered it.
 */
public enum NotificationOutcome {
    SENT,
    FAILED
}
