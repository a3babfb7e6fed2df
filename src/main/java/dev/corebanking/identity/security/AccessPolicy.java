package dev.corebanking.identity.security;

import dev.corebanking.identity.entity.UserRole;
import dev.corebanking.identity.exception.AccessDeniedException;
import dev.corebanking.identity.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Role and tenant checks on an already authenticated caller.
 * SUPER_ADMIN may act in any tenant; every other role only in its own.
 */
@Slf4j
@Component
public class AccessPolicy {

    /**
     * @param allowed roles permitted to proceed; none means any authenticated caller
     * @return the caller, for chaining
     * @throws AccessDeniedException when the caller holds none of {@code allowed}
     */
    public AuthenticatedUser requireRole(AuthenticatedUser caller, UserRole... allowed) {
        if (caller == null) {
            throw new AccessDeniedException(ErrorCode.INSUFFICIENT_PERMISSIONS, "User not authenticated");
        }
        if (allowed.length > 0 && !caller.hasAnyRole(allowed)) {
            log.warn("User {} with role {} denied, requires one of {}",
                    caller.userId(), caller.role(), Arrays.toString(allowed));
            throw new AccessDeniedException(ErrorCode.INSUFFICIENT_PERMISSIONS, "Insufficient permissions");
        }
        return caller;
    }

    /**
     * @return the caller, for chaining
     * @throws AccessDeniedException when a non-SUPER_ADMIN caller targets another tenant
     */
    public AuthenticatedUser requireTenantAccess(AuthenticatedUser caller, String tenantId) {
        if (caller == null) {
            throw new AccessDeniedException(ErrorCode.INSUFFICIENT_PERMISSIONS, "User not authenticated");
        }
        if (caller.role() == UserRole.SUPER_ADMIN) {
            return caller;
        }
        if (!caller.tenantId().equals(tenantId)) {
            log.warn("User {} of tenant {} denied access to tenant {}", caller.userId(), caller.tenantId(), tenantId);
            throw new AccessDeniedException(ErrorCode.CROSS_TENANT_ACCESS_DENIED,
                    "Cannot access resources from different tenant");
        }
        return caller;
    }
}
