package dev.corebanking.identity.repository;

import dev.corebanking.identity.entity.Tenant;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Control-plane tenant registry table. Read-only from this service.
 */
@Repository
public interface TenantRepository extends ReactiveCrudRepository<Tenant, String> {

    @Query("SELECT * FROM tenants WHERE id = :identifier OR slug = :identifier LIMIT 1")
    Mono<Tenant> findByIdOrSlug(String identifier);
}
