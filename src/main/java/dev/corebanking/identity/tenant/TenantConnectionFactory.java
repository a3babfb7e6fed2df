package dev.corebanking.identity.tenant;

import reactor.core.publisher.Mono;

/**
 * Opens a {@link TenantConnection} from a tenant's connection descriptor.
 */
@FunctionalInterface
public interface TenantConnectionFactory {

    Mono<TenantConnection> open(String tenantId, String connectionDescriptor);
}
