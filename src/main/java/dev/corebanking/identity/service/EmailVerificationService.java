package dev.corebanking.identity.service;

import dev.corebanking.identity.entity.User;
import dev.corebanking.identity.exception.InvalidOrExpiredTokenException;
import dev.corebanking.identity.tenant.TenantStoreResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Consumes email verification tokens issued at registration.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EmailVerificationService {

    public static final Duration TOKEN_VALIDITY = Duration.ofHours(24);

    private final TenantStoreResolver storeResolver;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    /**
     * Marks the owner of {@code token} as verified and clears the token, then sends a
     * best-effort welcome email.
     *
     * @throws InvalidOrExpiredTokenException (as error signal) when the token is unknown,
     *         expired or the address is already verified
     */
    public Mono<Void> verifyEmail(String token, String tenantId) {
        if (token == null || token.isBlank()) {
            return Mono.error(new InvalidOrExpiredTokenException("Invalid or expired verification token"));
        }
        return storeResolver.require(tenantId)
                .flatMap(scope -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    return scope.users().findByVerificationToken(token)
                            .filter(user -> !user.emailVerified() && user.isEmailVerificationTokenValid(token, now))
                            .switchIfEmpty(Mono.error(() ->
                                    new InvalidOrExpiredTokenException("Invalid or expired verification token")))
                            .flatMap(user -> scope.users().save(user.verifyEmail(now)))
                            .doOnNext(saved -> log.info("Email verified for user {} in tenant {}",
                                    saved.id(), scope.tenantId()));
                })
                .flatMap(this::sendWelcome)
                .then();
    }

    private Mono<NotificationOutcome> sendWelcome(User user) {
        return notifications.welcome(user);
    }
}
