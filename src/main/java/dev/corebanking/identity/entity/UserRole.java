package dev.corebanking.identity.entity;

/**
 * Role values for tenant users. Persisted and embedded in tokens by name.
 */
public enum UserRole {
    SUPER_ADMIN,
    TENANT_ADMIN,
    MANAGER,
    TELLER,
    CUSTOMER;

    /**
     * Check if the given role string matches this enum value.
     */
    public boolean matches(String role) {
        return this.name().equals(role);
    }
}
