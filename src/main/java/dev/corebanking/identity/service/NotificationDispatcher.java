package dev.corebanking.identity.service;

import dev.corebanking.identity.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * Best-effort front for {@link Notifier}: builds the links users follow and turns any
 * delivery failure into {@link NotificationOutcome#FAILED} with a WARN log, so a
 * lost email never rolls back the operation that triggered it.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final Notifier notifier;
    private final String frontendUrl;

    public NotificationDispatcher(Notifier notifier,
                                  @Value("${app.frontend-url:http://localhost:4200}") String frontendUrl) {
        this.notifier = notifier;
        this.frontendUrl = frontendUrl.endsWith("/")
                ? frontendUrl.substring(0, frontendUrl.length() - 1)
                : frontendUrl;
    }

    public Mono<NotificationOutcome> verification(User user, String tenantId, String token) {
        String url = frontendUrl + "/verify-email?token=" + encode(token) + "&tenant=" + encode(tenantId);
        return deliver("verification", user.email(),
                () -> notifier.sendVerification(user.email(), user.firstName(), url));
    }

    public Mono<NotificationOutcome> passwordReset(User user, String tenantId, String token) {
        String url = frontendUrl + "/reset-password?token=" + encode(token) + "&tenant=" + encode(tenantId);
        return deliver("password reset", user.email(),
                () -> notifier.sendPasswordReset(user.email(), user.firstName(), url));
    }

    public Mono<NotificationOutcome> welcome(User user) {
        return deliver("welcome", user.email(), () -> notifier.sendWelcome(user.email(), user.firstName()));
    }

    public Mono<NotificationOutcome> credentials(User user, String tenantSlug, String temporaryPassword) {
        String loginUrl = frontendUrl + "/login?tenant=" + encode(tenantSlug);
        return deliver("credentials", user.email(),
                () -> notifier.sendCredentials(user.email(), user.firstName(), temporaryPassword, loginUrl));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private Mono<NotificationOutcome> deliver(String kind, String recipient, Supplier<Mono<Void>> send) {
        return Mono.defer(send)
                .thenReturn(NotificationOutcome.SENT)
                .onErrorResume(e -> {
                    log.warn("Failed to send {} email to {}: {}", kind, recipient, e.getMessage());
                    return Mono.just(NotificationOutcome.FAILED);
                });
    }
}
