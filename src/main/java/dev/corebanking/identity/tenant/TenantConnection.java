package dev.corebanking.identity.tenant;

import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

/**
 * Live handle on one tenant's dedicated database. Owned by {@link TenantConnectionRouter};
 * callers never close it themselves.
 */
public interface TenantConnection {

    String tenantId();

    DatabaseClient databaseClient();

    /**
     * Releases the underlying resources. Completes once they are released.
     */
    Mono<Void> close();
}
