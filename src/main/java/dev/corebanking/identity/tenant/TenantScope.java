package dev.corebanking.identity.tenant;

import dev.corebanking.identity.entity.Tenant;
import dev.corebanking.identity.repository.UserStore;

/**
 * An ACTIVE tenant together with the credential store bound to its database.
 */
public record TenantScope(Tenant tenant, UserStore users) {

    public String tenantId() {
        return tenant.getId();
    }
}
