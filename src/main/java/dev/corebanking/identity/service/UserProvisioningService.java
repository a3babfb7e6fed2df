package dev.corebanking.identity.service;

import dev.corebanking.identity.dto.ProvisionUserRequest;
import dev.corebanking.identity.dto.ProvisioningResult;
import dev.corebanking.identity.dto.UserResponse;
import dev.corebanking.identity.entity.EmailAddress;
import dev.corebanking.identity.entity.PhoneNumber;
import dev.corebanking.identity.entity.User;
import dev.corebanking.identity.entity.UserRole;
import dev.corebanking.identity.exception.DuplicateEmailException;
import dev.corebanking.identity.security.AccessPolicy;
import dev.corebanking.identity.security.AuthenticatedUser;
import dev.corebanking.identity.security.PasswordHasher;
import dev.corebanking.identity.tenant.TenantScope;
import dev.corebanking.identity.tenant.TenantStoreResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Administrator-driven account creation. The account is created already verified with a
 * generated password, which is emailed to the user and never returned to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserProvisioningService {

    private final TenantStoreResolver storeResolver;
    private final PasswordHasher passwordHasher;
    private final NotificationDispatcher notifications;
    private final RequestValidator requestValidator;
    private final Clock clock;
    private final AccessPolicy accessPolicy;

    public Mono<ProvisioningResult> createUserWithTemporaryPassword(ProvisionUserRequest request) {
        return requestValidator.validate(request)
                .flatMap(valid -> storeResolver.require(valid.tenantSlug()))
                .flatMap(scope -> provision(scope, request));
    }

    /**
     * Provisioning on behalf of an authenticated administrator. The caller must be a
     * SUPER_ADMIN or a TENANT_ADMIN of the target tenant, and is recorded as the creator.
     */
    public Mono<ProvisioningResult> createUserWithTemporaryPassword(AuthenticatedUser caller,
                                                                    ProvisionUserRequest request) {
        return Mono.fromCallable(() -> accessPolicy.requireRole(caller, UserRole.SUPER_ADMIN, UserRole.TENANT_ADMIN))
                .flatMap(admin -> requestValidator.validate(
                        request == null ? null : request.toBuilder().createdBy(admin.userId()).build()))
                .flatMap(valid -> storeResolver.require(valid.tenantSlug())
                        .map(scope -> {
                            accessPolicy.requireTenantAccess(caller, scope.tenantId());
                            return scope;
                        })
                        .flatMap(scope -> provision(scope, valid)));
    }

    private Mono<ProvisioningResult> provision(TenantScope scope, ProvisionUserRequest request) {
        EmailAddress email = EmailAddress.of(request.email());
        PhoneNumber phone = PhoneNumber.ofNullable(request.phone());
        String temporaryPassword = passwordHasher.generateRandom();

        return scope.users().exists(email.value())
                .flatMap(exists -> exists
                        ? Mono.<String>error(new DuplicateEmailException())
                        : passwordHasher.hash(temporaryPassword))
                .flatMap(hash -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    User user = User.newAccount(UUID.randomUUID().toString(), email, hash,
                                    request.firstName(), request.lastName(), phone, request.role(),
                                    request.createdBy(), now)
                            .markEmailVerified(now);
                    return scope.users().save(user);
                })
                .flatMap(saved -> {
                    log.info("User {} provisioned in tenant {} by {}", saved.id(), scope.tenantId(),
                            request.createdBy());
                    return notifications.credentials(saved, scope.tenant().getSlug(), temporaryPassword)
                            .map(outcome -> ProvisioningResult.builder()
                                    .user(UserResponse.fromUser(saved))
                                    .credentialsEmail(outcome)
                                    .build());
                });
    }
}
