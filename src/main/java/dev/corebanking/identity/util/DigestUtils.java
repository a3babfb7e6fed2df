package dev.corebanking.identity.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 helpers. Used to derive fixed-length Redis keys from bearer tokens
 * so raw tokens never land in the revocation store.
 */
public final class DigestUtils {

    private static final HexFormat HEX = HexFormat.of();

    private DigestUtils() {
        // utility class
    }

    /**
     * @return lowercase hex-encoded SHA-256 digest of the UTF-8 bytes of {@code input}
     */
    public static String sha256Hex(String input) {
        Objects.requireNonNull(input, "Input must not be null");
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
