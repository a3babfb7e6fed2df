package dev.corebanking.identity.tenant;

import dev.corebanking.identity.config.ResilienceConfig;
import dev.corebanking.identity.exception.TenantNotFoundException;
import dev.corebanking.identity.repository.R2dbcUserStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Registry lookup, connection routing and store creation in one step.
 */
@Component
@RequiredArgsConstructor
public class TenantStoreResolver {

    private final TenantLookup tenantLookup;
    private final TenantConnectionRouter router;
    private final ResilienceConfig resilience;

    /**
     * @param identifier tenant id or slug
     * @return the scope, or empty when the tenant is missing or not ACTIVE
     */
    public Mono<TenantScope> resolve(String identifier) {
        return tenantLookup.findActiveTenant(identifier)
                .flatMap(tenant -> router.resolve(tenant.getId(), tenant.getDatabaseUrl())
                        .map(connection -> new TenantScope(tenant,
                                new R2dbcUserStore(connection.databaseClient(), resilience))));
    }

    /**
     * Like {@link #resolve(String)} but fails with {@link TenantNotFoundException} instead of completing empty.
     */
    public Mono<TenantScope> require(String identifier) {
        return resolve(identifier)
                .switchIfEmpty(Mono.error(TenantNotFoundException::new));
    }
}
