package dev.corebanking.identity.security;

/**
 * Access and refresh token issued together on login.
 *
 * @param expiresIn access token lifetime in seconds
 */
public record TokenPair(String accessToken, String refreshToken, long expiresIn) {
}
