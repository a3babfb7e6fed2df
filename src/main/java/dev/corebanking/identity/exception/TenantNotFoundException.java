package dev.corebanking.identity.exception;

/**
 * The tenant is missing or not ACTIVE. Both cases produce the same message
 * so that suspended tenants cannot be told apart from unknown ones.
 */
public class TenantNotFoundException extends ResourceNotFoundException {

    public TenantNotFoundException() {
        super(ErrorCode.TENANT_NOT_FOUND, "Tenant not found");
    }
}
