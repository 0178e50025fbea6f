package com.facilitydesk.backend.modules.auth.domain;

public enum VerificationStatus {
    PENDING,
    VERIFIED,
    REJECTED
}
