package dev.corebanking.identity.config;

import dev.corebanking.identity.exception.ConnectivityException;
import io.r2dbc.spi.R2dbcException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Centralised resilience settings: timeouts for every outbound call.
 * Inject this component directly and wrap store calls with the transformers below.
 *
 * <pre>
 * return tenantRepository.findByIdOrSlug(identifier)
 *         .transform(resilience.databaseCall("tenant lookup"));
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration redisTimeout;
    private final Duration externalTimeout;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.redis.timeout-seconds:5}") int redisTimeoutSeconds,
            @Value("${resilience.external.timeout-seconds:30}") int externalTimeoutSeconds
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.redisTimeout = Duration.ofSeconds(redisTimeoutSeconds);
        this.externalTimeout = Duration.ofSeconds(externalTimeoutSeconds);
        log.info("Resilience configuration initialized (database={}s, redis={}s, external={}s)",
                databaseTimeoutSeconds, redisTimeoutSeconds, externalTimeoutSeconds);
    }

    /**
     * Applies the database timeout and turns infrastructure failures into {@link ConnectivityException}.
     * Anything else, typed identity errors and programming errors alike, passes through untouched.
     */
    public <T> Function<Mono<T>, Mono<T>> databaseCall(String operation) {
        return mono -> mono.timeout(databaseTimeout)
                .onErrorMap(ResilienceConfig::isInfrastructureFailure,
                        e -> connectivityFailure(operation, e));
    }

    /**
     * Same contract as {@link #databaseCall(String)} with the Redis timeout.
     */
    public <T> Function<Mono<T>, Mono<T>> redisCall(String operation) {
        return mono -> mono.timeout(redisTimeout)
                .onErrorMap(ResilienceConfig::isInfrastructureFailure,
                        e -> connectivityFailure(operation, e));
    }

    private static boolean isInfrastructureFailure(Throwable throwable) {
        return throwable instanceof TimeoutException
                || throwable instanceof DataAccessException
                || throwable instanceof R2dbcException;
    }

    private static ConnectivityException connectivityFailure(String operation, Throwable cause) {
        log.error("{} failed: {}", operation, cause.toString());
        return new ConnectivityException(operation + " failed", cause);
    }
}
