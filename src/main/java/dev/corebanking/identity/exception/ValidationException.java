package dev.corebanking.identity.exception;

import java.util.List;

/**
 * Input was malformed. The caller is at fault and may fix the request.
 */
public class ValidationException extends IdentityException {

    private final List<String> details;

    public ValidationException(String message) {
        this(ErrorCode.VALIDATION_ERROR, message, List.of());
    }

    public ValidationException(String message, List<String> details) {
        this(ErrorCode.VALIDATION_ERROR, message, details);
    }

    protected ValidationException(ErrorCode errorCode, String message, List<String> details) {
        super(errorCode, message);
        this.details = List.copyOf(details);
    }

    public List<String> getDetails() {
        return details;
    }
}
