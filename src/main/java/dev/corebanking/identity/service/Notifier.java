package dev.corebanking.identity.service;

import reactor.core.publisher.Mono;

/**
 * Outbound user notifications. Implementations signal an error when delivery fails;
 * {@link NotificationDispatcher} turns that into a {@link NotificationOutcome}.
 */
public interface Notifier {

    Mono<Void> sendVerification(String to, String name, String verificationUrl);

    Mono<Void> sendPasswordReset(String to, String name, String resetUrl);

    Mono<Void> sendWelcome(String to, String name);

    Mono<Void> sendCredentials(String to, String name, String temporaryPassword, String loginUrl);
}
