package dev.corebanking.identity.service;

import dev.corebanking.identity.config.ResilienceConfig;
import dev.corebanking.identity.util.DigestUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed revocation list for issued tokens. Each entry lives exactly as long
 * as the token it revokes would have, so the list never needs cleaning up.
 * Keys hold the SHA-256 of the token, never the token itself.
 *
 * <p>Redis failures surface as {@code ConnectivityException}; an unreachable
 * store is never read as "not revoked".</p>
 */
@Service
@Slf4j
public class TokenRevocationService {

    static final String REVOKED_PREFIX = "jwt:revoked:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ResilienceConfig resilience;

    public TokenRevocationService(ReactiveRedisTemplate<String, String> redisTemplate, ResilienceConfig resilience) {
        this.redisTemplate = redisTemplate;
        this.resilience = resilience;
    }

    /**
     * Revokes {@code token} for {@code ttl}. A blank token or a non-positive TTL is a no-op.
     */
    public Mono<Void> revoke(String token, Duration ttl) {
        if (token == null || token.isBlank() || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Mono.empty();
        }
        String key = keyFor(token);
        return redisTemplate.opsForValue()
                .set(key, "1", ttl)
                .doOnSuccess(ok -> log.debug("Revoked token {} for {}s", abbreviate(key), ttl.toSeconds()))
                .transform(resilience.redisCall("token revocation"))
                .then();
    }

    public Mono<Boolean> isRevoked(String token) {
        if (token == null || token.isBlank()) {
            return Mono.just(false);
        }
        return redisTemplate.hasKey(keyFor(token))
                .defaultIfEmpty(false)
                .transform(resilience.redisCall("token revocation check"));
    }

    static String keyFor(String token) {
        return REVOKED_PREFIX + DigestUtils.sha256Hex(token);
    }

    private static String abbreviate(String key) {
        return key.substring(0, REVOKED_PREFIX.length() + 8) + "...";
    }
}
