package dev.corebanking.identity.repository;

import dev.corebanking.identity.config.ResilienceConfig;
import dev.corebanking.identity.entity.User;
import dev.corebanking.identity.exception.DuplicateEmailException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * {@link UserStore} over one tenant's {@link DatabaseClient}, with the SQL kept in one place.
 * Not a Spring bean: one instance exists per routed tenant connection.
 */
@Slf4j
public class R2dbcUserStore implements UserStore {

    private static final String SELECT_USER =
            "SELECT id, email, password_hash, first_name, last_name, phone, role, status, email_verified, " +
            "failed_login_attempts, locked_until, email_verification_token, email_verification_expires, " +
            "password_reset_token, password_reset_expires, last_login_at, created_at, updated_at, created_by " +
            "FROM users ";

    private static final String FIND_BY_EMAIL = SELECT_USER + "WHERE email = :email";
    private static final String FIND_BY_ID = SELECT_USER + "WHERE id = :id";
    private static final String FIND_BY_VERIFICATION_TOKEN = SELECT_USER + "WHERE email_verification_token = :token";
    private static final String FIND_BY_RESET_TOKEN = SELECT_USER + "WHERE password_reset_token = :token";

    private static final String COUNT_BY_EMAIL = "SELECT COUNT(*) AS cnt FROM users WHERE email = :email";

    private static final String UPDATE_USER =
            "UPDATE users SET email = :email, password_hash = :passwordHash, first_name = :firstName, " +
            "last_name = :lastName, phone = :phone, role = :role, status = :status, " +
            "email_verified = :emailVerified, failed_login_attempts = :failedLoginAttempts, " +
            "locked_until = :lockedUntil, email_verification_token = :emailVerificationToken, " +
            "email_verification_expires = :emailVerificationExpires, password_reset_token = :passwordResetToken, " +
            "password_reset_expires = :passwordResetExpires, last_login_at = :lastLoginAt, " +
            "updated_at = :updatedAt, created_by = :createdBy " +
            "WHERE id = :id";

    private static final String INSERT_USER =
            "INSERT INTO users (id, email, password_hash, first_name, last_name, phone, role, status, " +
            "email_verified, failed_login_attempts, locked_until, email_verification_token, " +
            "email_verification_expires, password_reset_token, password_reset_expires, last_login_at, " +
            "created_at, updated_at, created_by) " +
            "VALUES (:id, :email, :passwordHash, :firstName, :lastName, :phone, :role, :status, " +
            ":emailVerified, :failedLoginAttempts, :lockedUntil, :emailVerificationToken, " +
            ":emailVerificationExpires, :passwordResetToken, :passwordResetExpires, :lastLoginAt, " +
            ":createdAt, :updatedAt, :createdBy)";

    private final DatabaseClient databaseClient;
    private final ResilienceConfig resilience;

    public R2dbcUserStore(DatabaseClient databaseClient, ResilienceConfig resilience) {
        this.databaseClient = databaseClient;
        this.resilience = resilience;
    }

    @Override
    public Mono<User> findByEmail(String email) {
        return databaseClient.sql(FIND_BY_EMAIL)
                .bind("email", email)
                .map(UserRowMapper.INSTANCE)
                .one()
                .transform(resilience.databaseCall("user lookup by email"));
    }

    @Override
    public Mono<User> findById(String id) {
        return databaseClient.sql(FIND_BY_ID)
                .bind("id", id)
                .map(UserRowMapper.INSTANCE)
                .one()
                .transform(resilience.databaseCall("user lookup by id"));
    }

    @Override
    public Mono<User> findByVerificationToken(String token) {
        return databaseClient.sql(FIND_BY_VERIFICATION_TOKEN)
                .bind("token", token)
                .map(UserRowMapper.INSTANCE)
                .one()
                .transform(resilience.databaseCall("user lookup by verification token"));
    }

    @Override
    public Mono<User> findByResetToken(String token) {
        return databaseClient.sql(FIND_BY_RESET_TOKEN)
                .bind("token", token)
                .map(UserRowMapper.INSTANCE)
                .one()
                .transform(resilience.databaseCall("user lookup by reset token"));
    }

    @Override
    public Mono<Boolean> exists(String email) {
        return databaseClient.sql(COUNT_BY_EMAIL)
                .bind("email", email)
                .map((row, meta) -> row.get("cnt", Long.class))
                .one()
                .map(count -> count > 0)
                .defaultIfEmpty(false)
                .transform(resilience.databaseCall("user existence check"));
    }

    /**
     * UPDATE by id, falling back to INSERT when no row matched.
     * A unique-email collision becomes {@link DuplicateEmailException}.
     */
    @Override
    public Mono<User> save(User user) {
        return bindUser(databaseClient.sql(UPDATE_USER), user)
                .fetch()
                .rowsUpdated()
                .flatMap(updated -> {
                    if (updated > 0) {
                        return Mono.just(user);
                    }
                    log.debug("Inserting user {}", user.id());
                    return bindCreatedAt(bindUser(databaseClient.sql(INSERT_USER), user), user)
                            .fetch()
                            .rowsUpdated()
                            .thenReturn(user);
                })
                .onErrorMap(DataIntegrityViolationException.class, e -> new DuplicateEmailException())
                .transform(resilience.databaseCall("user save"));
    }

    private static GenericExecuteSpec bindUser(GenericExecuteSpec spec, User user) {
        spec = spec.bind("id", user.id())
                .bind("email", user.email())
                .bind("passwordHash", user.passwordHash())
                .bind("role", user.role().name())
                .bind("status", user.status().name())
                .bind("emailVerified", user.emailVerified())
                .bind("failedLoginAttempts", user.failedLoginAttempts());
        spec = bindNullable(spec, "firstName", user.firstName(), String.class);
        spec = bindNullable(spec, "lastName", user.lastName(), String.class);
        spec = bindNullable(spec, "phone", user.phone(), String.class);
        spec = bindNullable(spec, "lockedUntil", user.lockedUntil(), LocalDateTime.class);
        spec = bindNullable(spec, "emailVerificationToken", user.emailVerificationToken(), String.class);
        spec = bindNullable(spec, "emailVerificationExpires", user.emailVerificationExpires(), LocalDateTime.class);
        spec = bindNullable(spec, "passwordResetToken", user.passwordResetToken(), String.class);
        spec = bindNullable(spec, "passwordResetExpires", user.passwordResetExpires(), LocalDateTime.class);
        spec = bindNullable(spec, "lastLoginAt", user.lastLoginAt(), LocalDateTime.class);
        spec = bindNullable(spec, "updatedAt", user.updatedAt(), LocalDateTime.class);
        return bindNullable(spec, "createdBy", user.createdBy(), String.class);
    }

    private static GenericExecuteSpec bindCreatedAt(GenericExecuteSpec spec, User user) {
        return bindNullable(spec, "createdAt", user.createdAt(), LocalDateTime.class);
    }

    private static <T> GenericExecuteSpec bindNullable(GenericExecuteSpec spec, String name, T value, Class<T> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }
}
