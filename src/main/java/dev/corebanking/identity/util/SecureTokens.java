package dev.corebanking.identity.util;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Random one-time tokens for email verification and password reset links.
 */
public final class SecureTokens {

    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private SecureTokens() {
    }

    /**
     * @return 64 hex characters drawn from {@link SecureRandom}
     */
    public static String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
