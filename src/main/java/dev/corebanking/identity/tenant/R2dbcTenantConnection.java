package dev.corebanking.identity.tenant;

import io.r2dbc.pool.ConnectionPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

/**
 * Pool-backed tenant connection; closing disposes the pool.
 */
@Slf4j
class R2dbcTenantConnection implements TenantConnection {

    private final String tenantId;
    private final ConnectionPool pool;
    private final DatabaseClient databaseClient;

    R2dbcTenantConnection(String tenantId, ConnectionPool pool) {
        this.tenantId = tenantId;
        this.pool = pool;
        this.databaseClient = DatabaseClient.create(pool);
    }

    @Override
    public String tenantId() {
        return tenantId;
    }

    @Override
    public DatabaseClient databaseClient() {
        return databaseClient;
    }

    @Override
    public Mono<Void> close() {
        return pool.disposeLater()
                .doOnSuccess(v -> log.debug("Disposed connection pool for tenant {}", tenantId));
    }
}
