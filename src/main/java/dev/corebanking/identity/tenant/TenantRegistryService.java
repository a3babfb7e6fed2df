package dev.corebanking.identity.tenant;

import dev.corebanking.identity.config.ResilienceConfig;
import dev.corebanking.identity.entity.Tenant;
import dev.corebanking.identity.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Tenant lookups against the control-plane registry. Suspended, inactive and deleted
 * tenants are reported exactly like missing ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantRegistryService implements TenantLookup {

    private final TenantRepository tenantRepository;
    private final ResilienceConfig resilience;

    @Override
    public Mono<Tenant> findActiveTenant(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Mono.empty();
        }
        return tenantRepository.findByIdOrSlug(identifier.trim())
                .transform(resilience.databaseCall("tenant lookup"))
                .filter(tenant -> {
                    if (!tenant.isActive()) {
                        log.debug("Tenant {} is {}, not routable", tenant.getId(), tenant.getStatus());
                        return false;
                    }
                    return true;
                });
    }
}
