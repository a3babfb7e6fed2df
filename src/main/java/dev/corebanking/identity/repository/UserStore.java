package dev.corebanking.identity.repository;

import dev.corebanking.identity.entity.User;
import reactor.core.publisher.Mono;

/**
 * Credential store of a single tenant. Every instance is bound to one tenant's
 * database; callers obtain it through {@code TenantStoreResolver}.
 *
 * <p>Emails are expected in normalised (lower-case) form. Infrastructure
 * failures surface as {@code ConnectivityException}.</p>
 */
public interface UserStore {

    Mono<User> findByEmail(String email);

    Mono<User> findById(String id);

    /**
     * Looks up by token value only; expiry is checked by the caller against the loaded user.
     */
    Mono<User> findByVerificationToken(String token);

    Mono<User> findByResetToken(String token);

    /**
     * Inserts or updates by id.
     *
     * @return the saved user
     * @throws dev.corebanking.identity.exception.DuplicateEmailException (as error signal)
     *         when another user of the tenant already owns the email
     */
    Mono<User> save(User user);

    Mono<Boolean> exists(String email);
}
