package dev.corebanking.identity.security;

import dev.corebanking.identity.util.PasswordValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PasswordHasherTest {

    private PasswordHasher hasher;

    @BeforeEach
    void setUp() {
        // Low cost factor keeps the suite fast
        hasher = new PasswordHasher(new BCryptPasswordEncoder(4));
    }

    @Test
    @DisplayName("hash should produce a BCrypt hash that verifies against the plaintext")
    void hashThenVerify() {
        String hash = hasher.hash("Secret#2026").block();

        assertThat(hash).startsWith("$2a$04$").isNotEqualTo("Secret#2026");
        StepVerifier.create(hasher.verify("Secret#2026", hash))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(hasher.verify("secret#2026", hash))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    @DisplayName("hashing the same password twice should salt differently")
    void hash_ShouldBeSalted() {
        String first = hasher.hash("Secret#2026").block();
        String second = hasher.hash("Secret#2026").block();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("verify should return false for a null hash")
    void verify_NullHash_ShouldBeFalse() {
        StepVerifier.create(hasher.verify("anything", null))
                .expectNext(false)
                .verifyComplete();
    }

    @RepeatedTest(20)
    @DisplayName("generateRandom should always satisfy the strength policy")
    void generateRandom_ShouldBeStrong() {
        String password = hasher.generateRandom();

        assertThat(password).hasSize(PasswordHasher.DEFAULT_RANDOM_LENGTH);
        assertThat(PasswordValidator.check(password).violations()).isEmpty();
    }

    @Test
    @DisplayName("generateRandom should honour the requested length")
    void generateRandom_CustomLength() {
        assertThat(hasher.generateRandom(32)).hasSize(32);
        assertThatThrownBy(() -> hasher.generateRandom(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("validateStrength should delegate to the password policy")
    void validateStrength() {
        assertThat(hasher.validateStrength("weak").valid()).isFalse();
        assertThat(hasher.validateStrength("Str0ng!Pass").valid()).isTrue();
    }
}
