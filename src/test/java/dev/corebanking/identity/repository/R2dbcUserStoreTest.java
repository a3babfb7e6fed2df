package dev.corebanking.identity.repository;

import dev.corebanking.identity.config.ResilienceConfig;
import dev.corebanking.identity.entity.EmailAddress;
import dev.corebanking.identity.entity.PhoneNumber;
import dev.corebanking.identity.entity.User;
import dev.corebanking.identity.entity.UserRole;
import dev.corebanking.identity.entity.UserStatus;
import dev.corebanking.identity.exception.DuplicateEmailException;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("R2dbcUserStore against an in-memory tenant database")
class R2dbcUserStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 10, 9, 0);

    private R2dbcUserStore store;

    @BeforeEach
    void setUp() {
        ConnectionFactory connectionFactory = ConnectionFactories.get("r2dbc:h2:mem:///users_"
                + UUID.randomUUID().toString().replace("-", "") + "?options=DB_CLOSE_DELAY=-1");
        new ResourceDatabasePopulator(new ClassPathResource("schema-tenant.sql"))
                .populate(connectionFactory)
                .block();
        store = new R2dbcUserStore(DatabaseClient.create(connectionFactory), new ResilienceConfig(10, 5, 30));
    }

    private User newUser(String id, String email) {
        return User.newAccount(id, EmailAddress.of(email), "$2a$04$hash", "Ada", "Lovelace",
                PhoneNumber.ofNullable("+15551234567"), UserRole.CUSTOMER, null, NOW);
    }

    @Nested
    @DisplayName("save")
    class Save {

        @Test
        @DisplayName("should insert a new user and read every field back")
        void shouldInsertAndReadBack() {
            User user = newUser("u-1", "ada@example.com")
                    .withEmailVerificationToken("verify-token", NOW.plusHours(24), NOW);

            StepVerifier.create(store.save(user)).expectNext(user).verifyComplete();

            StepVerifier.create(store.findById("u-1"))
                    .assertNext(found -> {
                        assertThat(found.email()).isEqualTo("ada@example.com");
                        assertThat(found.firstName()).isEqualTo("Ada");
                        assertThat(found.phone()).isEqualTo("+15551234567");
                        assertThat(found.role()).isEqualTo(UserRole.CUSTOMER);
                        assertThat(found.status()).isEqualTo(UserStatus.ACTIVE);
                        assertThat(found.emailVerified()).isFalse();
                        assertThat(found.failedLoginAttempts()).isZero();
                        assertThat(found.lockedUntil()).isNull();
                        assertThat(found.emailVerificationToken()).isEqualTo("verify-token");
                        assertThat(found.emailVerificationExpires()).isEqualTo(NOW.plusHours(24));
                        assertThat(found.createdAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should update an existing user in place")
        void shouldUpdateExisting() {
            User user = newUser("u-1", "ada@example.com");
            store.save(user).block();

            LocalDateTime later = NOW.plusMinutes(5);
            User locked = user.lock(later);
            StepVerifier.create(store.save(locked)).expectNext(locked).verifyComplete();

            StepVerifier.create(store.findById("u-1"))
                    .assertNext(found -> {
                        assertThat(found.status()).isEqualTo(UserStatus.LOCKED);
                        assertThat(found.lockedUntil()).isEqualTo(later.plus(User.LOCK_DURATION));
                        assertThat(found.updatedAt()).isEqualTo(later);
                        assertThat(found.createdAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a second user with the same email in the tenant")
        void duplicateEmail_ShouldFail() {
            store.save(newUser("u-1", "ada@example.com")).block();

            StepVerifier.create(store.save(newUser("u-2", "ada@example.com")))
                    .expectError(DuplicateEmailException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @BeforeEach
        void seed() {
            store.save(newUser("u-1", "ada@example.com")
                    .withEmailVerificationToken("verify-token", NOW.plusHours(24), NOW)
                    .withPasswordResetToken("reset-token", NOW.plusHours(1), NOW))
                    .block();
        }

        @Test
        @DisplayName("should find by email")
        void findByEmail() {
            StepVerifier.create(store.findByEmail("ada@example.com"))
                    .assertNext(found -> assertThat(found.id()).isEqualTo("u-1"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty for an unknown email")
        void findByEmail_Unknown() {
            StepVerifier.create(store.findByEmail("nobody@example.com")).verifyComplete();
        }

        @Test
        @DisplayName("should find by verification token and by reset token")
        void findByTokens() {
            StepVerifier.create(store.findByVerificationToken("verify-token"))
                    .assertNext(found -> assertThat(found.id()).isEqualTo("u-1"))
                    .verifyComplete();
            StepVerifier.create(store.findByResetToken("reset-token"))
                    .assertNext(found -> assertThat(found.id()).isEqualTo("u-1"))
                    .verifyComplete();
            StepVerifier.create(store.findByResetToken("verify-token")).verifyComplete();
        }

        @Test
        @DisplayName("exists should reflect stored emails")
        void exists() {
            StepVerifier.create(store.exists("ada@example.com")).expectNext(true).verifyComplete();
            StepVerifier.create(store.exists("grace@example.com")).expectNext(false).verifyComplete();
        }
    }
}
