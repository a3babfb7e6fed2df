package dev.corebanking.identity.tenant;

import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Builds an r2dbc-pool {@link ConnectionPool} from a tenant's {@code r2dbc:} URL and
 * warms it up before handing it out, so a bad descriptor fails at open time.
 * A pool whose open fails or is cancelled mid-warmup is disposed.
 */
@Slf4j
@Component
public class R2dbcTenantConnectionFactory implements TenantConnectionFactory {

    private final int initialSize;
    private final int maxSize;
    private final Duration maxIdleTime;

    public R2dbcTenantConnectionFactory(
            @Value("${tenancy.pool.initial-size:1}") int initialSize,
            @Value("${tenancy.pool.max-size:10}") int maxSize,
            @Value("${tenancy.pool.max-idle-minutes:30}") int maxIdleMinutes
    ) {
        this.initialSize = initialSize;
        this.maxSize = maxSize;
        this.maxIdleTime = Duration.ofMinutes(maxIdleMinutes);
    }

    @Override
    public Mono<TenantConnection> open(String tenantId, String connectionDescriptor) {
        return Mono.fromCallable(() -> createPool(connectionDescriptor))
                .flatMap(pool -> pool.warmup()
                        .doOnNext(count -> log.info("Opened connection pool for tenant {} ({} warm connections)",
                                tenantId, count))
                        .<TenantConnection>thenReturn(new R2dbcTenantConnection(tenantId, pool))
                        .onErrorResume(e -> dispose(tenantId, pool).then(Mono.error(e)))
                        .doOnCancel(() -> {
                            log.debug("Open of tenant {} cancelled, disposing its pool", tenantId);
                            dispose(tenantId, pool).subscribe();
                        }));
    }

    private Mono<Void> dispose(String tenantId, ConnectionPool pool) {
        return pool.disposeLater()
                .onErrorResume(disposeError -> {
                    log.warn("Failed to dispose pool for tenant {}: {}", tenantId, disposeError.getMessage());
                    return Mono.empty();
                });
    }

    ConnectionPool createPool(String url) {
        ConnectionFactory connectionFactory = ConnectionFactories.get(url);
        ConnectionPoolConfiguration configuration = ConnectionPoolConfiguration.builder(connectionFactory)
                .initialSize(initialSize)
                .maxSize(maxSize)
                .maxIdleTime(maxIdleTime)
                .build();
        return new ConnectionPool(configuration);
    }
}
