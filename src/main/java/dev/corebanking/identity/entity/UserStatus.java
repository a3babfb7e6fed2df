package dev.corebanking.identity.entity;

public enum UserStatus {
    ACTIVE,
    INACTIVE,
    LOCKED,
    SUSPENDED
}
