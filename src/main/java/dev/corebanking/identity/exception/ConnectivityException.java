package dev.corebanking.identity.exception;

/**
 * A data store, Redis or another network dependency was unreachable or timed out.
 * Callers may retry once; this is never converted into an authentication decision.
 */
public class ConnectivityException extends IdentityException {

    public ConnectivityException(String message, Throwable cause) {
        super(ErrorCode.CONNECTIVITY_ERROR, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
