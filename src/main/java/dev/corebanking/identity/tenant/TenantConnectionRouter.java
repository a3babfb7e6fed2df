package dev.corebanking.identity.tenant;

import dev.corebanking.identity.config.ResilienceConfig;
import dev.corebanking.identity.exception.ConnectivityException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps at most one live {@link TenantConnection} per tenant id.
 *
 * <p>The cache is bounded ({@code tenancy.router.max-connections}); when an insert
 * pushes it over capacity the oldest-inserted entry is evicted and its connection
 * closed asynchronously, exactly once.</p>
 *
 * <p>Concurrent {@link #resolve} calls for the same unseen tenant share a single
 * cached opening {@link Mono}, so only one connection is ever opened. Lookups are
 * lock-free; the eviction lock guards bookkeeping only and is never held across I/O.
 * A failed or timed-out opening is removed from the cache so the next call retries.</p>
 */
@Slf4j
@Component
public class TenantConnectionRouter {

    private final TenantConnectionFactory connectionFactory;
    private final ResilienceConfig resilience;
    private final int maxConnections;

    private final ConcurrentHashMap<String, CachedConnection> connections = new ConcurrentHashMap<>();
    private final Deque<CachedConnection> insertionOrder = new ConcurrentLinkedDeque<>();
    private final ReentrantLock evictionLock = new ReentrantLock();

    public TenantConnectionRouter(
            TenantConnectionFactory connectionFactory,
            ResilienceConfig resilience,
            @Value("${tenancy.router.max-connections:10}") int maxConnections) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("tenancy.router.max-connections must be at least 1");
        }
        this.connectionFactory = connectionFactory;
        this.resilience = resilience;
        this.maxConnections = maxConnections;
    }

    /**
     * Returns the cached connection for {@code tenantId}, opening it from
     * {@code connectionDescriptor} on first use.
     *
     * @return the connection, or {@link ConnectivityException} when it cannot be opened in time
     */
    public Mono<TenantConnection> resolve(String tenantId, String connectionDescriptor) {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(connectionDescriptor, "connectionDescriptor");
        return Mono.defer(() -> {
            CachedConnection existing = connections.get(tenantId);
            if (existing != null) {
                return existing.handle;
            }
            CachedConnection created = new CachedConnection(tenantId, connectionDescriptor);
            CachedConnection raced = connections.putIfAbsent(tenantId, created);
            if (raced != null) {
                return raced.handle;
            }
            insertionOrder.addLast(created);
            evictOverflow();
            return created.handle;
        });
    }

    /**
     * Removes and closes the connection for {@code tenantId}; completes after it is closed.
     */
    public Mono<Void> evict(String tenantId) {
        return Mono.defer(() -> {
            CachedConnection entry = connections.remove(tenantId);
            if (entry == null) {
                return Mono.empty();
            }
            insertionOrder.remove(entry);
            log.info("Evicting connection for tenant {}", tenantId);
            return entry.close();
        });
    }

    public Mono<Void> evictAll() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(connections.keySet())))
                .flatMap(this::evict)
                .then();
    }

    public int cachedConnectionCount() {
        return connections.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} tenant connection(s)...", connections.size());
        try {
            evictAll().block(resilience.getDatabaseTimeout().plus(Duration.ofSeconds(5)));
        } catch (RuntimeException e) {
            log.warn("Tenant connections not fully closed on shutdown: {}", e.getMessage());
        }
        log.info("Tenant connection router shutdown complete");
    }

    private void evictOverflow() {
        List<CachedConnection> evicted = new ArrayList<>();
        evictionLock.lock();
        try {
            while (connections.size() > maxConnections) {
                CachedConnection oldest = insertionOrder.pollFirst();
                if (oldest == null) {
                    break;
                }
                if (connections.remove(oldest.tenantId, oldest)) {
                    evicted.add(oldest);
                }
            }
        } finally {
            evictionLock.unlock();
        }
        for (CachedConnection entry : evicted) {
            log.info("Connection cache full ({}), evicting oldest tenant {}", maxConnections, entry.tenantId);
            entry.close().subscribe(
                    null,
                    e -> log.warn("Error closing evicted connection for tenant {}: {}", entry.tenantId, e.getMessage()));
        }
    }

    private final class CachedConnection {

        private final String tenantId;
        private final String descriptor;
        private final AtomicBoolean started = new AtomicBoolean();
        private final AtomicBoolean closed = new AtomicBoolean();
        private final Mono<TenantConnection> handle;

        private CachedConnection(String tenantId, String descriptor) {
            this.tenantId = tenantId;
            this.descriptor = descriptor;
            this.handle = Mono.defer(this::open)
                    .timeout(resilience.getDatabaseTimeout())
                    .onErrorMap(e -> !(e instanceof ConnectivityException), this::connectivityFailure)
                    .doOnError(e -> discard())
                    .cache();
        }

        private Mono<TenantConnection> open() {
            started.set(true);
            if (closed.get()) {
                return Mono.error(new ConnectivityException(
                        "Connection for tenant " + tenantId + " was evicted before it was opened", null));
            }
            log.debug("Opening connection for tenant {}", tenantId);
            return connectionFactory.open(tenantId, descriptor);
        }

        private ConnectivityException connectivityFailure(Throwable cause) {
            String reason = cause instanceof TimeoutException ? "timed out" : "failed";
            log.error("Opening connection for tenant {} {}: {}", tenantId, reason, cause.toString());
            return new ConnectivityException("Connection to tenant " + tenantId + " " + reason, cause);
        }

        private void discard() {
            connections.remove(tenantId, this);
            insertionOrder.remove(this);
        }

        /**
         * Closes the underlying connection at most once. Completes without error even when
         * opening failed or closing fails.
         */
        private Mono<Void> close() {
            return Mono.defer(() -> {
                if (!closed.compareAndSet(false, true) || !started.get()) {
                    return Mono.empty();
                }
                return handle.flatMap(TenantConnection::close)
                        .onErrorResume(e -> {
                            log.warn("Closing connection for tenant {} failed: {}", tenantId, e.getMessage());
                            return Mono.empty();
                        });
            });
        }
    }
}
