package dev.corebanking.identity.service;

import dev.corebanking.identity.exception.InvalidOrExpiredTokenException;
import dev.corebanking.identity.exception.WeakPasswordException;
import dev.corebanking.identity.security.PasswordHasher;
import dev.corebanking.identity.tenant.TenantStoreResolver;
import dev.corebanking.identity.util.PasswordStrength;
import dev.corebanking.identity.util.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Forgot-password and token-based password reset.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PasswordResetService {

    public static final Duration TOKEN_VALIDITY = Duration.ofHours(1);

    private final TenantStoreResolver storeResolver;
    private final PasswordHasher passwordHasher;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    /**
     * Issues a reset token and emails it when the tenant and user exist.
     * Always completes empty: callers learn nothing about which accounts exist,
     * so every failure in this flow is logged and swallowed.
     */
    public Mono<Void> forgotPassword(String email, String tenantSlug) {
        if (email == null || email.isBlank()) {
            return Mono.empty();
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return storeResolver.resolve(tenantSlug)
                .flatMap(scope -> scope.users().findByEmail(normalized)
                        .flatMap(user -> {
                            LocalDateTime now = LocalDateTime.now(clock);
                            String token = SecureTokens.generate();
                            return scope.users()
                                    .save(user.withPasswordResetToken(token, now.plus(TOKEN_VALIDITY), now))
                                    .flatMap(saved -> notifications.passwordReset(saved, scope.tenantId(), token));
                        }))
                .doOnNext(outcome -> log.debug("Password reset email outcome: {}", outcome))
                .onErrorResume(e -> {
                    log.warn("Password reset request could not be processed: {}", e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Sets a new password from a valid reset token; also clears any lock and the failed-attempt counter.
     */
    public Mono<Void> resetPassword(String token, String newPassword, String tenantId) {
        if (token == null || token.isBlank()) {
            return Mono.error(new InvalidOrExpiredTokenException("Invalid or expired password reset token"));
        }
        return storeResolver.require(tenantId)
                .flatMap(scope -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    return scope.users().findByResetToken(token)
                            .filter(user -> user.isPasswordResetTokenValid(token, now))
                            .switchIfEmpty(Mono.error(() ->
                                    new InvalidOrExpiredTokenException("Invalid or expired password reset token")))
                            .flatMap(user -> {
                                PasswordStrength strength = passwordHasher.validateStrength(newPassword);
                                if (!strength.valid()) {
                                    return Mono.error(new WeakPasswordException(strength.violations()));
                                }
                                return passwordHasher.hash(newPassword)
                                        .flatMap(hash -> scope.users().save(user.resetPassword(hash, now)));
                            })
                            .doOnNext(saved -> log.info("Password reset completed for user {} in tenant {}",
                                    saved.id(), scope.tenantId()));
                })
                .then();
    }
}
