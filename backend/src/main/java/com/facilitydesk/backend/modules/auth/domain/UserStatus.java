package com.facilitydesk.backend.modules.auth.domain;

public enum UserStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    PENDING,
    BLOCKED
}
