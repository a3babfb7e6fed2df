package dev.corebanking.identity.service;

import dev.corebanking.identity.dto.LoginRequest;
import dev.corebanking.identity.dto.LoginResult;
import dev.corebanking.identity.dto.RefreshResult;
import dev.corebanking.identity.dto.RegisterRequest;
import dev.corebanking.identity.dto.RegistrationResult;
import dev.corebanking.identity.dto.UserResponse;
import dev.corebanking.identity.entity.EmailAddress;
import dev.corebanking.identity.entity.PhoneNumber;
import dev.corebanking.identity.entity.User;
import dev.corebanking.identity.entity.UserRole;
import dev.corebanking.identity.entity.UserStatus;
import dev.corebanking.identity.exception.AccountLockedException;
import dev.corebanking.identity.exception.AccountNotActiveException;
import dev.corebanking.identity.exception.DuplicateEmailException;
import dev.corebanking.identity.exception.EmailNotVerifiedException;
import dev.corebanking.identity.exception.IncorrectPasswordException;
import dev.corebanking.identity.exception.InvalidCredentialsException;
import dev.corebanking.identity.exception.ResourceNotFoundException;
import dev.corebanking.identity.exception.TenantNotFoundException;
import dev.corebanking.identity.exception.TokenExpiredException;
import dev.corebanking.identity.exception.TokenRevokedException;
import dev.corebanking.identity.exception.WeakPasswordException;
import dev.corebanking.identity.security.AccessPolicy;
import dev.corebanking.identity.security.AuthenticatedUser;
import dev.corebanking.identity.security.JwtTokenProvider;
import dev.corebanking.identity.security.PasswordHasher;
import dev.corebanking.identity.security.TokenClaims;
import dev.corebanking.identity.security.TokenKind;
import dev.corebanking.identity.security.TokenPair;
import dev.corebanking.identity.tenant.TenantLookup;
import dev.corebanking.identity.tenant.TenantScope;
import dev.corebanking.identity.tenant.TenantStoreResolver;
import dev.corebanking.identity.util.PasswordStrength;
import dev.corebanking.identity.util.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Registration, login, token refresh, logout and request authentication for tenant users.
 *
 * <p>Login runs its checks in a fixed order: tenant, user, lock (after lifting an
 * expired one), password, email verification, status. An unknown tenant and an
 * unknown email fail with the same {@link InvalidCredentialsException}.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuthService {

    private final TenantStoreResolver storeResolver;
    private final TenantLookup tenantLookup;
    private final PasswordHasher passwordHasher;
    private final JwtTokenProvider tokenProvider;
    private final TokenRevocationService revocationService;
    private final NotificationDispatcher notifications;
    private final RequestValidator requestValidator;
    private final Clock clock;
    private final AccessPolicy accessPolicy;

    // ── Registration ────────────────────────────────────────────────────────

    public Mono<RegistrationResult> register(RegisterRequest request) {
        return requestValidator.validate(request)
                .flatMap(valid -> storeResolver.require(valid.tenantSlug()))
                .flatMap(scope -> createUnverifiedUser(scope, request));
    }

    private Mono<RegistrationResult> createUnverifiedUser(TenantScope scope, RegisterRequest request) {
        EmailAddress email = EmailAddress.of(request.email());
        PhoneNumber phone = PhoneNumber.ofNullable(request.phone());

        return scope.users().exists(email.value())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateEmailException());
                    }
                    PasswordStrength strength = passwordHasher.validateStrength(request.password());
                    if (!strength.valid()) {
                        return Mono.error(new WeakPasswordException(strength.violations()));
                    }
                    return passwordHasher.hash(request.password());
                })
                .flatMap(hash -> {
                    LocalDateTime now = now();
                    String verificationToken = SecureTokens.generate();
                    User user = User.newAccount(UUID.randomUUID().toString(), email, hash,
                                    request.firstName(), request.lastName(), phone, request.role(),
                                    request.createdBy(), now)
                            .withEmailVerificationToken(verificationToken,
                                    now.plus(EmailVerificationService.TOKEN_VALIDITY), now);
                    return scope.users().save(user)
                            .flatMap(saved -> {
                                log.info("Registered user {} in tenant {}", saved.id(), scope.tenantId());
                                return notifications.verification(saved, scope.tenantId(), verificationToken)
                                        .map(outcome -> RegistrationResult.builder()
                                                .userId(saved.id())
                                                .verificationEmail(outcome)
                                                .build());
                            });
                });
    }

    // ── Login ───────────────────────────────────────────────────────────────

    public Mono<LoginResult> login(LoginRequest request) {
        return requestValidator.validate(request)
                .flatMap(valid -> storeResolver.resolve(valid.tenantSlug()))
                .switchIfEmpty(Mono.error(InvalidCredentialsException::new))
                .flatMap(scope -> attemptLogin(scope, request));
    }

    private Mono<LoginResult> attemptLogin(TenantScope scope, LoginRequest request) {
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        return scope.users().findByEmail(email)
                .switchIfEmpty(Mono.error(InvalidCredentialsException::new))
                .flatMap(stored -> {
                    LocalDateTime now = now();
                    User user = stored.unlockIfExpired(now);
                    if (user.isLocked(now)) {
                        log.warn("Login rejected for locked user {} in tenant {}", user.id(), scope.tenantId());
                        return Mono.error(new AccountLockedException(user.lockedUntil()));
                    }
                    return passwordHasher.verify(request.password(), user.passwordHash())
                            .flatMap(matches -> matches
                                    ? completeLogin(scope, stored, user, now)
                                    : rejectPassword(scope, user, now));
                });
    }

    private Mono<LoginResult> rejectPassword(TenantScope scope, User user, LocalDateTime now) {
        User failed = user.registerFailedLogin(now);
        return scope.users().save(failed)
                .flatMap(saved -> {
                    if (saved.isLocked(now)) {
                        log.warn("User {} in tenant {} locked after {} failed attempts",
                                saved.id(), scope.tenantId(), saved.failedLoginAttempts());
                        return Mono.error(new AccountLockedException(saved.lockedUntil()));
                    }
                    log.debug("Failed login {} of {} for user {}", saved.failedLoginAttempts(),
                            User.MAX_FAILED_ATTEMPTS, saved.id());
                    return Mono.error(new InvalidCredentialsException());
                });
    }

    private Mono<LoginResult> completeLogin(TenantScope scope, User stored, User user, LocalDateTime now) {
        if (!user.emailVerified()) {
            return persistIfChanged(scope, stored, user).then(Mono.error(new EmailNotVerifiedException()));
        }
        if (user.status() != UserStatus.ACTIVE) {
            return persistIfChanged(scope, stored, user).then(Mono.error(new AccountNotActiveException()));
        }
        TokenPair tokens = tokenProvider.issuePair(user.id(), scope.tenantId(), user.role(), user.email());
        return scope.users().save(user.recordLogin(now))
                .map(saved -> {
                    log.info("User {} logged in to tenant {}", saved.id(), scope.tenantId());
                    return LoginResult.builder()
                            .user(UserResponse.fromUser(saved))
                            .accessToken(tokens.accessToken())
                            .refreshToken(tokens.refreshToken())
                            .expiresIn(tokens.expiresIn())
                            .build();
                });
    }

    /**
     * Keeps a lazily lifted lock durable even when the login is rejected afterwards.
     */
    private Mono<Void> persistIfChanged(TenantScope scope, User stored, User current) {
        return stored == current ? Mono.empty() : scope.users().save(current).then();
    }

    // ── Tokens ──────────────────────────────────────────────────────────────

    public Mono<RefreshResult> refresh(String refreshToken) {
        return Mono.fromCallable(() -> tokenProvider.verify(refreshToken, TokenKind.REFRESH))
                .flatMap(claims -> rejectIfRevoked(refreshToken, claims))
                .map(claims -> RefreshResult.builder()
                        .accessToken(tokenProvider.issueAccessToken(claims))
                        .expiresIn(tokenProvider.getAccessExpirationSeconds())
                        .build());
    }

    public Mono<Void> logout(String accessToken) {
        return logout(accessToken, null);
    }

    /**
     * Revokes both tokens for the rest of their lifetimes. An already expired token needs no revocation.
     */
    public Mono<Void> logout(String accessToken, String refreshToken) {
        Mono<Void> revokeRefresh = refreshToken != null
                ? revokeForRemainingLifetime(refreshToken, TokenKind.REFRESH)
                : Mono.empty();
        return revokeForRemainingLifetime(accessToken, TokenKind.ACCESS)
                .then(revokeRefresh)
                .doOnSuccess(v -> log.debug("Logout completed"));
    }

    private Mono<Void> revokeForRemainingLifetime(String token, TokenKind kind) {
        return Mono.fromCallable(() -> tokenProvider.verify(token, kind))
                .flatMap(claims -> revocationService.revoke(token, tokenProvider.remainingLifetime(claims)))
                .onErrorResume(TokenExpiredException.class, e -> Mono.empty());
    }

    /**
     * Establishes the caller behind an access token: signature and expiry, then
     * revocation, then that the tenant is still ACTIVE.
     */
    public Mono<AuthenticatedUser> authenticate(String accessToken) {
        return Mono.fromCallable(() -> tokenProvider.verify(accessToken, TokenKind.ACCESS))
                .flatMap(claims -> rejectIfRevoked(accessToken, claims))
                .flatMap(claims -> tenantLookup.findActiveTenant(claims.tenantId())
                        .switchIfEmpty(Mono.error(TenantNotFoundException::new))
                        .thenReturn(AuthenticatedUser.from(claims)));
    }

    /**
     * {@link #authenticate(String)}, then the role and tenant checks of {@link AccessPolicy}.
     *
     * @param tenantId     the tenant the caller wants to act in
     * @param allowedRoles roles permitted to proceed; none means any role
     */
    public Mono<AuthenticatedUser> authorize(String accessToken, String tenantId, UserRole... allowedRoles) {
        return authenticate(accessToken)
                .map(caller -> accessPolicy.requireRole(caller, allowedRoles))
                .map(caller -> accessPolicy.requireTenantAccess(caller, tenantId));
    }

    private Mono<TokenClaims> rejectIfRevoked(String token, TokenClaims claims) {
        return revocationService.isRevoked(token)
                .flatMap(revoked -> revoked
                        ? Mono.<TokenClaims>error(new TokenRevokedException())
                        : Mono.just(claims));
    }

    // ── Password change ─────────────────────────────────────────────────────

    public Mono<Void> changePassword(String tenantId, String userId, String oldPassword, String newPassword) {
        return storeResolver.require(tenantId)
                .flatMap(scope -> scope.users().findById(userId)
                        .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("User not found")))
                        .flatMap(user -> passwordHasher.verify(oldPassword, user.passwordHash())
                                .flatMap(matches -> {
                                    if (!matches) {
                                        return Mono.error(new IncorrectPasswordException());
                                    }
                                    PasswordStrength strength = passwordHasher.validateStrength(newPassword);
                                    if (!strength.valid()) {
                                        return Mono.error(new WeakPasswordException(strength.violations()));
                                    }
                                    return passwordHasher.hash(newPassword);
                                })
                                .flatMap(hash -> scope.users().save(user.changePassword(hash, now())))
                                .doOnSuccess(saved -> log.info("Password changed for user {} in tenant {}",
                                        userId, scope.tenantId()))))
                .then();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
