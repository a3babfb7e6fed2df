package dev.corebanking.identity.tenant;

import dev.corebanking.identity.entity.Tenant;
import reactor.core.publisher.Mono;

public interface TenantLookup {

    /**
     * @param identifier tenant id or slug
     * @return the tenant when it exists and is ACTIVE, otherwise empty
     */
    Mono<Tenant> findActiveTenant(String identifier);
}
