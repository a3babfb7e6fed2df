package dev.corebanking.identity.exception;

import java.util.List;

/**
 * Thrown when a candidate password fails one or more strength rules.
 * {@link #getDetails()} lists every violated rule.
 */
public class WeakPasswordException extends ValidationException {

    public WeakPasswordException(List<String> violations) {
        super(ErrorCode.WEAK_PASSWORD, "Weak password: " + String.join(", ", violations), violations);
    }
}
