package dev.corebanking.identity.service;

import dev.corebanking.identity.entity.EmailAddress;
import dev.corebanking.identity.entity.Tenant;
import dev.corebanking.identity.entity.User;
import dev.corebanking.identity.entity.UserRole;
import dev.corebanking.identity.exception.InvalidOrExpiredTokenException;
import dev.corebanking.identity.exception.TenantNotFoundException;
import dev.corebanking.identity.support.InMemoryUserStore;
import dev.corebanking.identity.support.MutableClock;
import dev.corebanking.identity.support.RecordingNotifier;
import dev.corebanking.identity.tenant.TenantScope;
import dev.corebanking.identity.tenant.TenantStoreResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmailVerificationService")
class EmailVerificationServiceTest {

    private static final String TOKEN = "a".repeat(64);

    @Mock
    private TenantStoreResolver storeResolver;

    private MutableClock clock;
    private InMemoryUserStore users;
    private RecordingNotifier notifier;
    private EmailVerificationService verificationService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-10T09:00:00Z");
        users = new InMemoryUserStore();
        notifier = new RecordingNotifier();
        verificationService = new EmailVerificationService(storeResolver,
                new NotificationDispatcher(notifier, "https://app.example.com/"), clock);
    }

    private void tenantResolves() {
        Tenant tenant = Tenant.builder().id("tenant-1").slug("first-bank").build();
        when(storeResolver.require("tenant-1")).thenReturn(Mono.just(new TenantScope(tenant, users)));
    }

    private void seedUnverified() {
        LocalDateTime now = LocalDateTime.now(clock);
        users.with(User.newAccount("u-1", EmailAddress.of("ada@example.com"), "$2a$04$hash", "Ada", "Lovelace",
                        null, UserRole.CUSTOMER, null, now)
                .withEmailVerificationToken(TOKEN, now.plus(EmailVerificationService.TOKEN_VALIDITY), now));
    }

    @Test
    @DisplayName("should verify the address, consume the token and send a welcome email")
    void validToken_ShouldVerify() {
        tenantResolves();
        seedUnverified();
        clock.advance(Duration.ofHours(3));

        StepVerifier.create(verificationService.verifyEmail(TOKEN, "tenant-1")).verifyComplete();

        User stored = users.get("u-1");
        assertThat(stored.emailVerified()).isTrue();
        assertThat(stored.emailVerificationToken()).isNull();
        assertThat(stored.emailVerificationExpires()).isNull();
        assertThat(notifier.last().kind()).isEqualTo("welcome");
    }

    @Test
    @DisplayName("the same token should not verify twice")
    void reusedToken_ShouldFail() {
        tenantResolves();
        seedUnverified();
        verificationService.verifyEmail(TOKEN, "tenant-1").block();

        StepVerifier.create(verificationService.verifyEmail(TOKEN, "tenant-1"))
                .expectError(InvalidOrExpiredTokenException.class)
                .verify();
    }

    @Test
    @DisplayName("an expired token should fail and leave the user unverified")
    void expiredToken_ShouldFail() {
        tenantResolves();
        seedUnverified();
        clock.advance(Duration.ofHours(25));

        StepVerifier.create(verificationService.verifyEmail(TOKEN, "tenant-1"))
                .expectError(InvalidOrExpiredTokenException.class)
                .verify();

        assertThat(users.get("u-1").emailVerified()).isFalse();
        assertThat(notifier.sent()).isEmpty();
    }

    @Test
    @DisplayName("an unknown token should fail")
    void unknownToken_ShouldFail() {
        tenantResolves();

        StepVerifier.create(verificationService.verifyEmail("b".repeat(64), "tenant-1"))
                .expectError(InvalidOrExpiredTokenException.class)
                .verify();
    }

    @Test
    @DisplayName("a blank token should fail without touching the tenant")
    void blankToken_ShouldFail() {
        StepVerifier.create(verificationService.verifyEmail("  ", "tenant-1"))
                .expectError(InvalidOrExpiredTokenException.class)
                .verify();

        verifyNoInteractions(storeResolver);
    }

    @Test
    @DisplayName("an unknown tenant should fail with TenantNotFoundException")
    void unknownTenant_ShouldFail() {
        when(storeResolver.require("ghost")).thenReturn(Mono.error(new TenantNotFoundException()));

        StepVerifier.create(verificationService.verifyEmail(TOKEN, "ghost"))
                .expectError(TenantNotFoundException.class)
                .verify();
    }

    @Test
    @DisplayName("a failed welcome email should not fail verification")
    void welcomeFailure_ShouldStillVerify() {
        tenantResolves();
        seedUnverified();
        notifier.failAll();

        StepVerifier.create(verificationService.verifyEmail(TOKEN, "tenant-1")).verifyComplete();

        assertThat(users.get("u-1").emailVerified()).isTrue();
    }
}
