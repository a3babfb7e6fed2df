package dev.corebanking.identity.security;

import dev.corebanking.identity.entity.UserRole;

/**
 * Caller identity established from a verified, unrevoked access token.
 */
public record AuthenticatedUser(String userId, String tenantId, UserRole role, String email) {

    public static AuthenticatedUser from(TokenClaims claims) {
        return new AuthenticatedUser(claims.userId(), claims.tenantId(), claims.role(), claims.email());
    }

    public boolean hasAnyRole(UserRole... roles) {
        for (UserRole candidate : roles) {
            if (candidate == role) {
                return true;
            }
        }
        return false;
    }
}
