package dev.corebanking.identity.entity;

public enum TenantStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    DELETED
}
