package dev.corebanking.identity.security;

import dev.corebanking.identity.util.PasswordStrength;
import dev.corebanking.identity.util.PasswordValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.security.SecureRandom;

/**
 * BCrypt hashing and verification, run on the bounded elastic scheduler so
 * the deliberately slow work never blocks event-loop threads.
 */
@Component
@RequiredArgsConstructor
public class PasswordHasher {

    public static final int DEFAULT_RANDOM_LENGTH = 12;

    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    private static final String DIGITS = "0123456789";
    private static final String SYMBOLS = "!@#$%^&*()_+";
    private static final String ALPHABET = UPPER + LOWER + DIGITS + SYMBOLS;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final PasswordEncoder passwordEncoder;

    public Mono<String> hash(String plaintext) {
        return Mono.fromCallable(() -> passwordEncoder.encode(plaintext))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Boolean> verify(String plaintext, String hash) {
        if (plaintext == null || hash == null) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> passwordEncoder.matches(plaintext, hash))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public PasswordStrength validateStrength(String plaintext) {
        return PasswordValidator.check(plaintext);
    }

    public String generateRandom() {
        return generateRandom(DEFAULT_RANDOM_LENGTH);
    }

    /**
     * Random password containing at least one character of every class, so it
     * always passes {@link #validateStrength(String)} when {@code length >= 8}.
     */
    public String generateRandom(int length) {
        if (length < 4) {
            throw new IllegalArgumentException("length must be at least 4");
        }
        char[] chars = new char[length];
        chars[0] = pick(UPPER);
        chars[1] = pick(LOWER);
        chars[2] = pick(DIGITS);
        chars[3] = pick(SYMBOLS);
        for (int i = 4; i < length; i++) {
            chars[i] = pick(ALPHABET);
        }
        for (int i = length - 1; i > 0; i--) {
            int j = SECURE_RANDOM.nextInt(i + 1);
            char tmp = chars[i];
            chars[i] = chars[j];
            chars[j] = tmp;
        }
        return new String(chars);
    }

    private static char pick(String source) {
        return source.charAt(SECURE_RANDOM.nextInt(source.length()));
    }
}
