package dev.corebanking.identity.security;

/**
 * Access tokens authenticate requests; refresh tokens only mint new access tokens.
 * Each kind is signed with its own secret.
 */
public enum TokenKind {
    ACCESS,
    REFRESH;

    String claimValue() {
        return name().toLowerCase();
    }
}
