package dev.corebanking.identity.security;

import dev.corebanking.identity.entity.UserRole;

import java.time.Instant;

/**
 * Verified content of a token.
 */
public record TokenClaims(
        String userId,
        String tenantId,
        UserRole role,
        String email,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt,
        TokenKind kind
) {
}
